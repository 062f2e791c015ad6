/* @LICENSE@
 */


package org.rxdht.regex;


import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.Deque;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.rxdht.regex.Automaton.ConstructionException;
import org.rxdht.regex.Automaton.State;
import org.rxdht.regex.Automaton.Transition;
import org.rxdht.regex.Automaton.Type;
import org.rxdht.regex.Misc.BreadthFirstVisitor;


final class DFA {

    private static final Logger logger = Logger.getLogger("org.rxdht.regex");
    private static final Level level = Level.FINEST;

    /**
     * Watchdog on subset construction.
     */
    static final int MAX_STATE_COUNT = 10 * 1000;

    private DFA() {
    }

    /*
     * subset construction
     */
    private static final class Construction {

        private final Automaton dfa;
        private final Map<StateSet, State> dStates = new HashMap<StateSet, State>();
        private int stateId;

        Construction(Automaton dfa) {
            this.dfa = dfa;
        }

        State create(StateSet set) {
            if (dStates.size() >= MAX_STATE_COUNT) {
                throw new ConstructionException(
                    "DFA for `" + dfa.regex + "' exceeds " + MAX_STATE_COUNT + " states");
            }
            State s = new State(stateId++, set.accepting());
            s.nfaSet = set;
            for (State member : set) {
                for (Transition t : member.transitions) {
                    if (t.label != null) s.addTransition(t.label, null);
                }
            }
            dStates.put(set, s);
            dfa.add(s);
            return s;
        }

        /*
         * Resolves placeholder transitions depth first: a newly created state
         * is completed before the next transition of its creator.
         */
        void resolve(State init) {
            Deque<State> states = new ArrayDeque<State>();
            Deque<Integer> positions = new ArrayDeque<Integer>();
            states.push(init);
            positions.push(0);
            while (!states.isEmpty()) {
                State s = states.peek();
                int i = positions.pop();
                if (i >= s.transitions.size()) {
                    states.pop();
                    continue;
                }
                positions.push(i + 1);
                Transition t = s.transitions.get(i);
                if (t.to != null) continue;
                StateSet target = NFA.move(s.nfaSet, t.label);
                State next = dStates.get(target);
                if (next == null) {
                    next = create(target);
                    t.to = next;
                    states.push(next);
                    positions.push(0);
                } else {
                    t.to = next;
                }
            }
        }
    }

    /**
     * Builds the DFA equivalent to <code>nfa</code>. The NFA is consumed.
     */
    static Automaton determinize(Automaton nfa) {
        assert nfa.type == Type.NFA;
        Automaton dfa = new Automaton(Type.DFA, nfa.regex);
        Construction c = new Construction(dfa);
        dfa.start = c.create(NFA.closure(StateSet.of(nfa.start), null));
        c.resolve(dfa.start);

        nfa.states.clear();
        nfa.start = null;

        if (logger.isLoggable(level)) {
            logger.log(level, "subset construction for `" + dfa.regex + "': "
                + dfa.states.size() + " states");
        }
        return dfa;
    }

    /**
     * Reduces a DFA to the minimal number of states: unreachable and dead
     * states are removed, then equivalent states merged.
     */
    static void minimize(Automaton dfa) {
        assert dfa.type == Type.DFA;
        final int before = dfa.states.size();
        removeUnreachable(dfa);
        removeDead(dfa);
        mergeEquivalent(dfa);
        for (State s : dfa.states) {
            s.nfaSet = null;
        }
        if (logger.isLoggable(level)) {
            logger.log(level, "minimized `" + dfa.regex + "': " + before + " -> "
                + dfa.states.size() + " states");
        }
    }

    static void removeUnreachable(Automaton dfa) {
        BreadthFirstVisitor<State, Transition> bfv =
            new BreadthFirstVisitor<State, Transition>().start(dfa.start);
        for (State s : new ArrayList<State>(dfa.states)) {
            if (!bfv.reached(s)) dfa.remove(s);
        }
    }

    static void removeDead(Automaton dfa) {
        for (State s : new ArrayList<State>(dfa.states)) {
            if (s.dead()) dfa.remove(s);
        }
    }

    /*
     * table filling: pair (i, j), i > j, is marked once the two states are
     * known to be distinguishable.
     */
    static void mergeEquivalent(Automaton dfa) {
        final State[] arr = dfa.states.toArray(new State[dfa.states.size()]);
        final int n = arr.length;
        final Map<State, Integer> index = new IdentityHashMap<State, Integer>();
        for (int i = 0; i < n; ++i) {
            index.put(arr[i], i);
        }

        BitSet table = new BitSet();
        for (int i = 0; i < n; ++i) {
            for (int j = 0; j < i; ++j) {
                if (arr[i].accepting != arr[j].accepting) table.set(i * n + j);
            }
        }

        boolean changed = true;
        while (changed) {
            changed = false;
            for (int i = 0; i < n; ++i) {
                State s1 = arr[i];
                for (int j = 0; j < i; ++j) {
                    if (table.get(i * n + j)) continue;
                    State s2 = arr[j];
                    int common = 0;
                    for (Transition t1 : s1.transitions) {
                        for (Transition t2 : s2.transitions) {
                            if (!Misc.same(t1.label, t2.label)) continue;
                            common++;
                            int a = index.get(t1.to);
                            int b = index.get(t2.to);
                            if (table.get(Math.max(a, b) * n + Math.min(a, b))) {
                                table.set(i * n + j);
                                changed = true;
                            }
                        }
                    }
                    if (common != s1.transitionCount() || common != s2.transitionCount()) {
                        table.set(i * n + j);
                        changed = true;
                    }
                }
            }
        }

        boolean[] removed = new boolean[n];
        for (int i = 0; i < n; ++i) {
            if (removed[i]) continue;
            for (int j = 0; j < i; ++j) {
                if (removed[j] || table.get(i * n + j)) continue;
                if (logger.isLoggable(level)) {
                    logger.log(level, "merging " + arr[j] + " into " + arr[i]);
                }
                dfa.merge(arr[i], arr[j]);
                removed[j] = true;
            }
        }
    }

    /**
     * The transition consuming the longest label that <code>input</code>
     * continues with at <code>pos</code>; among equally long labels the last
     * one wins. <code>null</code> if there is none.
     */
    static Transition move(State s, String input, int pos) {
        Transition ret = null;
        int max = 0;
        for (Transition t : s.transitions) {
            if (t.label == null) continue;
            int len = t.label.length();
            if (len >= max && input.startsWith(t.label, pos)) {
                ret = t;
                max = len;
            }
        }
        return ret;
    }

    static boolean evaluate(Automaton dfa, String input) {
        assert dfa.type == Type.DFA;
        State s = dfa.start;
        if (input.length() == 0 && s.accepting) return true;
        int pos = 0;
        while (pos < input.length()) {
            Transition t = move(s, input, pos);
            if (t == null) return false;
            pos += t.label.length();
            s = t.to;
        }
        return s.accepting;
    }
}
