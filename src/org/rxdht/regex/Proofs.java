/*
 * @LICENSE@
 */

package org.rxdht.regex;

import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.rxdht.regex.Automaton.State;
import org.rxdht.regex.Automaton.Transition;
import org.rxdht.regex.Automaton.Type;

/**
 * Assigns every state of a minimized DFA its proof, the canonical regex of
 * all paths from the start state, by Kleene's state elimination recurrence
 * over the depth first numbering of the states. Simplification happens at
 * each step (see {@link RegexAlgebra#simplify}) so the strings stay short.
 */
final class Proofs {

    private static final Logger logger = Logger.getLogger("org.rxdht.regex");
    private static final Level level = Level.FINEST;

    private Proofs() {
    }

    static void create(Automaton dfa) {
        assert dfa.type == Type.DFA;
        final List<State> states = dfa.number();
        final int n = states.size();
        assert n == dfa.states.size() : "unreachable states left in " + dfa;

        String[][] last = new String[n][n];

        // paths of length one
        for (int i = 0; i < n; ++i) {
            for (Transition t : states.get(i).transitions) {
                int j = t.to.dfsId;
                last[i][j] = last[i][j] == null ? t.label : last[i][j] + "|" + t.label;
            }
            last[i][i] = last[i][i] == null ? "" : "(|" + last[i][i] + ")";
        }
        for (int i = 0; i < n; ++i) {
            for (int j = 0; j < n; ++j) {
                if (RegexAlgebra.needsParentheses(last[i][j])) {
                    last[i][j] = "(" + last[i][j] + ")";
                }
            }
        }

        String[][] cur = new String[n][n];
        for (int k = 0; k < n; ++k) {
            for (int i = 0; i < n; ++i) {
                for (int j = 0; j < n; ++j) {
                    cur[i][j] = RegexAlgebra.simplify(last[i][j], last[i][k], last[k][k], last[k][j]);
                }
            }
            String[][] swap = last;
            last = cur;
            cur = swap;
        }

        final int s = dfa.start.dfsId;
        StringBuilder canonical = new StringBuilder();
        for (int i = 0; i < n; ++i) {
            State state = states.get(i);
            String proof = last[s][i];
            if (proof != null) {
                state.proof = proof;
                state.hash = HashCode.of(proof);
            }
            if (state.accepting && proof != null && proof.length() > 0) {
                if (canonical.length() > 0) canonical.append('|');
                canonical.append(proof);
            }
        }
        dfa.canonicalRegex = canonical.toString();

        if (logger.isLoggable(level)) {
            StringBuilder sb = new StringBuilder("proofs for `" + dfa.regex + "':");
            for (State state : states) {
                sb.append(Misc.LS).append("  ").append(state).append(": ")
                    .append(state.proof).append(" ").append(state.hash);
            }
            logger.log(level, sb.toString());
        }
    }
}
