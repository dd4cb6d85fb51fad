package software.amazon.ahocorasick;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static software.amazon.ahocorasick.Automaton.ROOT;

/**
 * Walks an automaton over a text in a single left-to-right pass. The automaton encodes all failure recovery, so no
 * symbol of the text is ever read twice.
 */
final class MatchFinder {

    private MatchFinder() { }

    /**
     * Report every occurrence of every pattern, in order of end position.
     *
     * @param automaton the built automaton
     * @param text the text to scan
     * @param unit how offsets are counted
     * @param listener receives each occurrence
     */
    static void scan(final Automaton automaton, final CharSequence text, final OffsetUnit unit,
                     final MatchListener listener) {
        int state = ROOT;
        int symbolEnd = 0;
        int i = 0;
        while (i < text.length()) {
            final int codePoint = Character.codePointAt(text, i);
            i += Character.charCount(codePoint);
            symbolEnd++;

            state = automaton.nextState(state, codePoint);

            final int end = unit == OffsetUnit.CHAR ? i : symbolEnd;
            final int outputCount = automaton.outputCount(state);
            for (int o = 0; o < outputCount; o++) {
                final String pattern = automaton.outputPattern(state, o);
                listener.onMatch(new Match(pattern, end - automaton.outputLength(state, o, unit), end));
            }
        }
    }

    /**
     * Collect the start offsets of every occurrence, grouped by pattern. Patterns that do not occur are absent.
     *
     * @return unmodifiable map from pattern to its start offsets in ascending order, in order of first occurrence
     */
    static Map<String, List<Integer>> findPatterns(final Automaton automaton, final CharSequence text,
                                                   final OffsetUnit unit) {
        final Map<String, List<Integer>> result = new LinkedHashMap<>();
        scan(automaton, text, unit,
                match -> result.computeIfAbsent(match.getPattern(), k -> new ArrayList<>()).add(match.getStart()));

        for (Map.Entry<String, List<Integer>> entry : result.entrySet()) {
            entry.setValue(Collections.unmodifiableList(entry.getValue()));
        }
        return Collections.unmodifiableMap(result);
    }

    /**
     * Stops at the first occurrence of any pattern.
     */
    static boolean containsAny(final Automaton automaton, final CharSequence text) {
        int state = ROOT;
        int i = 0;
        while (i < text.length()) {
            final int codePoint = Character.codePointAt(text, i);
            i += Character.charCount(codePoint);
            state = automaton.nextState(state, codePoint);
            if (automaton.outputCount(state) > 0) {
                return true;
            }
        }
        return false;
    }
}
