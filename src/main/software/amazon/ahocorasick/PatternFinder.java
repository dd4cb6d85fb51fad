package software.amazon.ahocorasick;

import javax.annotation.Nonnull;
import javax.annotation.concurrent.Immutable;
import javax.annotation.concurrent.ThreadSafe;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Finds every occurrence of a fixed set of patterns in a text with one pass over the text, using the Aho-Corasick
 * algorithm. The patterns are compiled into an automaton up front, at a cost proportional to their total length;
 * after that, scanning a text costs one automaton transition per symbol plus the work of reporting each match,
 * however many patterns there are.
 *
 * Matches may overlap and nest: with the patterns "foo", "oof" and "o", the text "foof" yields "foo" at 0, "oof" at
 * 1 and "o" at 1 and 2. Duplicate patterns are recognized once. The empty pattern is legal and is reported at the end
 * of every symbol.
 *
 * A PatternFinder never changes once built and may be shared between threads without synchronization.
 *
 * <pre>
 * {@code
 *   PatternFinder finder = PatternFinder.builder()
 *           .withPatterns("foo", "oof", "o")
 *           .build();
 *   Map<String, List<Integer>> found = finder.findPatterns("foof");
 * }
 * </pre>
 */
@ThreadSafe
@Immutable
public class PatternFinder {

    private final Automaton automaton;
    private final PatternFinderConfiguration configuration;

    /**
     * Build a PatternFinder with the default configuration.
     *
     * @param patterns the patterns to find; may be empty, may contain duplicates and the empty string
     */
    public PatternFinder(@Nonnull final Collection<String> patterns) {
        this(patterns, builder().buildConfig());
    }

    private PatternFinder(final Collection<String> patterns, final PatternFinderConfiguration configuration) {
        final AutomatonBuilder automatonBuilder = new AutomatonBuilder();
        for (String pattern : patterns) {
            automatonBuilder.insert(pattern);
        }
        this.automaton = automatonBuilder.build();
        this.configuration = configuration;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Return the start offsets of every occurrence of every pattern in the text, including overlapping and nested
     * occurrences.
     *
     * @param text the text to scan
     * @return unmodifiable map from each pattern that occurs to its start offsets in ascending order. Patterns that
     * do not occur are absent. The map may be empty but never null.
     */
    public Map<String, List<Integer>> findPatterns(@Nonnull final CharSequence text) {
        Objects.requireNonNull(text, "text");
        return MatchFinder.findPatterns(automaton, text, configuration.getOffsetUnit());
    }

    /**
     * Report every occurrence of every pattern to the listener, ordered by end offset. Occurrences sharing an end
     * offset are reported longest pattern first.
     *
     * @param text the text to scan
     * @param listener receives one Match per occurrence
     */
    public void findMatches(@Nonnull final CharSequence text, @Nonnull final MatchListener listener) {
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(listener, "listener");
        MatchFinder.scan(automaton, text, configuration.getOffsetUnit(), listener);
    }

    /**
     * Return true if any pattern occurs in the text. Stops scanning at the first occurrence.
     */
    public boolean containsAny(@Nonnull final CharSequence text) {
        Objects.requireNonNull(text, "text");
        return MatchFinder.containsAny(automaton, text);
    }

    /**
     * @return the distinct patterns, in the order they were first added
     */
    public Set<String> getPatterns() {
        return automaton.getPatterns();
    }

    /**
     * @return the number of automaton states, counting the root
     */
    public int getStateCount() {
        return automaton.getStateCount();
    }

    public PatternFinderConfiguration getConfiguration() {
        return configuration;
    }

    @Override
    public String toString() {
        return "PatternFinder{patterns=" + automaton.getPatterns().size() + ", states=" + automaton.getStateCount()
                + ", " + configuration + '}';
    }

    public static class Builder {

        private final List<String> patterns = new ArrayList<>();

        /**
         * Offsets reported by the PatternFinder count code points by default. Use {@link OffsetUnit#CHAR} to have them
         * count UTF-16 chars instead, for instance to cut matches out of the text with {@link String#substring}.
         * The two only differ for texts holding characters outside the Basic Multilingual Plane.
         */
        private OffsetUnit offsetUnit = OffsetUnit.CODE_POINT;

        Builder() {}

        public Builder withPattern(@Nonnull String pattern) {
            patterns.add(Objects.requireNonNull(pattern, "pattern"));
            return this;
        }

        public Builder withPatterns(@Nonnull String... patterns) {
            return withPatterns(Arrays.asList(patterns));
        }

        public Builder withPatterns(@Nonnull Collection<String> patterns) {
            for (String pattern : patterns) {
                withPattern(pattern);
            }
            return this;
        }

        public Builder withOffsetUnit(@Nonnull OffsetUnit offsetUnit) {
            this.offsetUnit = Objects.requireNonNull(offsetUnit, "offsetUnit");
            return this;
        }

        public PatternFinder build() {
            return new PatternFinder(patterns, buildConfig());
        }

        PatternFinderConfiguration buildConfig() {
            return new PatternFinderConfiguration(offsetUnit);
        }
    }
}
