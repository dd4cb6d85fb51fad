package software.amazon.ahocorasick;

/**
 * Receives the occurrences found by {@link PatternFinder#findMatches(CharSequence, MatchListener)} in scan order.
 */
@FunctionalInterface
public interface MatchListener {

    void onMatch(Match match);
}
