package software.amazon.ahocorasick;

import javax.annotation.concurrent.Immutable;
import javax.annotation.concurrent.ThreadSafe;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Set;

import static software.amazon.ahocorasick.TransitionMap.NO_VALUE;

/**
 * A built Aho-Corasick automaton. States are dense indices into parallel arrays, with the root at index 0: trie edges
 * and failure links both refer to states by index, so the failure tree can point sideways or backwards through the trie
 * without any state owning another.
 *
 * Instances are only produced by AutomatonBuilder and never change afterwards. None of the arrays escape this class.
 */
@ThreadSafe
@Immutable
final class Automaton {

    static final int ROOT = 0;

    private final TransitionMap[] transitions;
    private final int[] failures;
    private final int[] depths;

    /**
     * Every pattern recognized at a state, its own first and then those inherited along the failure chain, so that
     * longer patterns come before the shorter ones ending at the same position.
     */
    private final String[][] outputs;
    private final int[][] codePointLengths;
    private final int[][] charLengths;

    private final Set<String> patterns;

    Automaton(final TransitionMap[] transitions, final int[] failures, final int[] depths, final String[][] outputs,
              final Set<String> patterns) {
        this.transitions = transitions;
        this.failures = failures;
        this.depths = depths;
        this.outputs = outputs;
        this.patterns = Collections.unmodifiableSet(patterns);
        this.codePointLengths = new int[outputs.length][];
        this.charLengths = new int[outputs.length][];
        for (int state = 0; state < outputs.length; state++) {
            String[] output = outputs[state];
            codePointLengths[state] = new int[output.length];
            charLengths[state] = new int[output.length];
            for (int i = 0; i < output.length; i++) {
                codePointLengths[state][i] = output[i].codePointCount(0, output[i].length());
                charLengths[state][i] = output[i].length();
            }
        }
    }

    /**
     * The effective DFA transition: follow the trie edge for {@code codePoint} if there is one, otherwise fall back
     * along the failure chain. The root loops back onto itself for any symbol it has no edge for.
     */
    int nextState(final int state, final int codePoint) {
        return nextState(transitions, failures, state, codePoint);
    }

    /**
     * Shared with AutomatonBuilder, which resolves failure links against a partially linked automaton. Only the
     * failure links of states shallower than {@code state} are consulted.
     */
    static int nextState(final TransitionMap[] transitions, final int[] failures, final int state,
                         final int codePoint) {
        int current = state;
        while (true) {
            int next = transitions[current].get(codePoint);
            if (next != NO_VALUE) {
                return next;
            }
            if (current == ROOT) {
                return ROOT;
            }
            current = failures[current];
        }
    }

    int outputCount(final int state) {
        return outputs[state].length;
    }

    String outputPattern(final int state, final int index) {
        return outputs[state][index];
    }

    int outputLength(final int state, final int index, final OffsetUnit unit) {
        return unit == OffsetUnit.CHAR ? charLengths[state][index] : codePointLengths[state][index];
    }

    int getFailure(final int state) {
        return state == ROOT ? ROOT : failures[state];
    }

    int getDepth(final int state) {
        return depths[state];
    }

    List<String> getOutput(final int state) {
        return Collections.unmodifiableList(Arrays.asList(outputs[state]));
    }

    int getStateCount() {
        return transitions.length;
    }

    Set<String> getPatterns() {
        return patterns;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (int state = 0; state < transitions.length; state++) {
            sb.append(state).append(": depth=").append(depths[state])
                    .append(" fail=").append(getFailure(state))
                    .append(" goto=").append(transitions[state])
                    .append(" out=").append(Arrays.toString(outputs[state]))
                    .append('\n');
        }
        return sb.toString();
    }
}
