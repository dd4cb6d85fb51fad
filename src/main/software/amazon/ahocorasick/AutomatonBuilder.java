package software.amazon.ahocorasick;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.concurrent.NotThreadSafe;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Queue;
import java.util.Set;

import static software.amazon.ahocorasick.Automaton.ROOT;
import static software.amazon.ahocorasick.TransitionMap.NO_VALUE;

/**
 * Grows the pattern trie one pattern at a time and then links it into an {@link Automaton}. A builder produces exactly
 * one automaton: once {@link #build()} has run, it refuses any further use.
 */
@NotThreadSafe
class AutomatonBuilder {

    private static final Logger log = LoggerFactory.getLogger(AutomatonBuilder.class);

    private final List<TransitionMap> transitions = new ArrayList<>();
    private final List<Integer> depths = new ArrayList<>();

    /**
     * Patterns recognized at each state. Before linking these hold only the pattern spelled by the state's own trie
     * path, if any. Linking appends everything recognized at the failure target.
     */
    private final List<Set<String>> outputs = new ArrayList<>();

    private final Set<String> patterns = new LinkedHashSet<>();

    private boolean built = false;

    AutomatonBuilder() {
        newState(0);
    }

    /**
     * Adds a pattern, creating a state for each code point not already on its trie path. Inserting a pattern twice
     * leaves the trie unchanged. The empty pattern is recognized at the root.
     *
     * @param pattern the pattern to recognize
     */
    void insert(@Nonnull final String pattern) {
        Objects.requireNonNull(pattern, "pattern");
        checkNotBuilt();

        int state = ROOT;
        int i = 0;
        while (i < pattern.length()) {
            final int codePoint = pattern.codePointAt(i);
            int next = transitions.get(state).get(codePoint);
            if (next == NO_VALUE) {
                next = newState(depths.get(state) + 1);
                transitions.get(state).put(codePoint, next);
            }
            state = next;
            i += Character.charCount(codePoint);
        }
        outputs.get(state).add(pattern);
        patterns.add(pattern);
    }

    /**
     * Computes the failure link of every state and merges output sets along them, then freezes the result.
     *
     * States are visited breadth first from a queue seeded with the children of the root. When a state is dequeued its
     * own failure link and output are final, as are those of every shallower state, which is all that resolving its
     * children's failure links needs.
     *
     * @return the linked automaton
     */
    Automaton build() {
        checkNotBuilt();
        built = true;

        final int stateCount = transitions.size();
        final TransitionMap[] edges = transitions.toArray(new TransitionMap[0]);
        final int[] failures = new int[stateCount];

        final Queue<Integer> queue = new ArrayDeque<>();
        final TransitionMap rootEdges = edges[ROOT];
        for (int codePoint : rootEdges.keys()) {
            final int child = rootEdges.get(codePoint);
            link(failures, child, ROOT);
            queue.add(child);
        }

        while (!queue.isEmpty()) {
            final int state = queue.remove();
            final TransitionMap stateEdges = edges[state];
            for (int codePoint : stateEdges.keys()) {
                final int child = stateEdges.get(codePoint);
                link(failures, child, Automaton.nextState(edges, failures, failures[state], codePoint));
                queue.add(child);
            }
        }

        final int[] frozenDepths = new int[stateCount];
        final String[][] frozenOutputs = new String[stateCount][];
        for (int state = 0; state < stateCount; state++) {
            frozenDepths[state] = depths.get(state);
            frozenOutputs[state] = outputs.get(state).toArray(new String[0]);
        }

        log.debug("Built automaton with {} states from {} distinct patterns", stateCount, patterns.size());
        return new Automaton(edges, failures, frozenDepths, frozenOutputs, new LinkedHashSet<>(patterns));
    }

    private void link(final int[] failures, final int state, final int failure) {
        failures[state] = failure;
        outputs.get(state).addAll(outputs.get(failure));
    }

    private int newState(final int depth) {
        transitions.add(new TransitionMap());
        depths.add(depth);
        outputs.add(new LinkedHashSet<>());
        return transitions.size() - 1;
    }

    private void checkNotBuilt() {
        if (built) {
            throw new IllegalStateException("Automaton has already been built");
        }
    }
}
