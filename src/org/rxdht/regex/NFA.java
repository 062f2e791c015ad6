/*
 * @LICENSE@
 */

/**
 * NFA: Thompson construction, closures and direct simulation.
 */
package org.rxdht.regex;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.rxdht.regex.Automaton.State;
import org.rxdht.regex.Automaton.Transition;
import org.rxdht.regex.Automaton.Type;

final class NFA {

    private static final Logger logger = Logger.getLogger("org.rxdht.regex");
    private static final Level level = Level.FINER;

    private NFA() {
    }

    /**
     * A partially built automaton: an entry and a single accepting exit.
     */
    static final class Fragment {

        final State start;
        final State end;

        private Fragment(State start, State end) {
            this.start = start;
            this.end = end;
        }

        @Override
        public String toString() {
            return "[" + start + ".." + end + "]";
        }
    }

    /**
     * Creates the states of a single NFA and combines fragments of it. Every
     * state created here belongs to the automaton being built; fragments only
     * name their entry and exit.
     */
    static final class Builder {

        private final Automaton nfa;
        private int stateId;

        Builder(String regex) {
            this.nfa = new Automaton(Type.NFA, regex);
        }

        private State state(boolean accepting) {
            State s = new State(stateId++, accepting);
            nfa.add(s);
            return s;
        }

        /** <code>start -label-> end</code> */
        Fragment label(String label) {
            State start = state(false);
            State end = state(true);
            start.addTransition(label, end);
            return new Fragment(start, end);
        }

        /** <code>ab</code> */
        Fragment concat(Fragment a, Fragment b) {
            a.end.addTransition(null, b.start);
            a.end.accepting = false;
            b.end.accepting = true;
            return new Fragment(a.start, b.end);
        }

        /** <code>a*</code> */
        Fragment star(Fragment a) {
            State start = state(false);
            State end = state(true);
            start.addTransition(null, a.start);
            start.addTransition(null, end);
            a.end.addTransition(null, a.start);
            a.end.addTransition(null, end);
            a.end.accepting = false;
            return new Fragment(start, end);
        }

        /** <code>a+</code> */
        Fragment plus(Fragment a) {
            a.end.addTransition(null, a.start);
            return a;
        }

        /** <code>a?</code> */
        Fragment question(Fragment a) {
            State start = state(false);
            State end = state(true);
            start.addTransition(null, a.start);
            start.addTransition(null, end);
            a.end.addTransition(null, end);
            a.end.accepting = false;
            return new Fragment(start, end);
        }

        /** <code>a|b</code> */
        Fragment alternation(Fragment a, Fragment b) {
            State start = state(false);
            start.addTransition(null, a.start);
            start.addTransition(null, b.start);
            State end = state(true);
            a.end.addTransition(null, end);
            a.end.accepting = false;
            b.end.addTransition(null, end);
            b.end.accepting = false;
            return new Fragment(start, end);
        }

        /**
         * Finishes the automaton with <code>root</code> as its whole.
         */
        Automaton build(Fragment root) {
            nfa.start = root.start;
            List<State> numbered = nfa.number();
            if (logger.isLoggable(level)) {
                logger.log(level, "nfa for `" + nfa.regex + "': " + nfa.states.size()
                    + " states, " + numbered.size() + " reachable" + Misc.LS
                    + nfa.toGraphString());
            }
            return nfa;
        }
    }

    /**
     * Follows transitions labelled <code>label</code> (epsilon for
     * <code>null</code>) from every member of <code>set</code>, as often as
     * they lead somewhere new. For an epsilon closure the members themselves
     * are part of the result.
     */
    static StateSet closure(StateSet set, String label) {
        StateSet.Builder ret = new StateSet.Builder();
        Deque<State> stack = new ArrayDeque<State>();
        for (State root : set) {
            if (label == null) ret.add(root);
            stack.push(root);
            while (!stack.isEmpty()) {
                State s = stack.pop();
                for (Transition t : s.transitions) {
                    if (!Misc.same(t.label, label) || t.to == null) continue;
                    if (ret.add(t.to)) stack.push(t.to);
                }
            }
        }
        return ret.build();
    }

    static StateSet move(StateSet set, String label) {
        return closure(closure(set, label), null);
    }

    /**
     * Simulates the NFA over the whole input, one character at a time.
     */
    static boolean evaluate(Automaton nfa, String input) {
        assert nfa.type == Type.NFA;
        if (input.length() == 0 && nfa.start.accepting) return true;
        StateSet set = closure(StateSet.of(nfa.start), null);
        for (int i = 0; i < input.length() && !set.isEmpty(); ++i) {
            set = move(set, String.valueOf(input.charAt(i)));
        }
        return set.accepting();
    }
}
