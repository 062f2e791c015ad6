/*
 * @LICENSE@
 */

package org.rxdht.regex;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.rxdht.regex.Automaton.State;
import org.rxdht.regex.Automaton.Transition;

/**
 * Graph rewrites applied to a DFA after its proofs are known: collapsing
 * linear paths into single multi-character transitions, and adding
 * fixed-length strides. Both leave the language accepted unchanged, provided
 * evaluation takes the longest matching label.
 */
final class PathCompressor {

    private static final Logger logger = Logger.getLogger("org.rxdht.regex");
    private static final Level level = Level.FINEST;

    private PathCompressor() {
    }

    /*
     * a new transition, held back until the walk is over
     */
    private static final class Pending {
        final State from;
        final String label;
        final State to;

        Pending(State from, String label, State to) {
            this.from = from;
            this.label = label;
            this.to = to;
        }
    }

    private static final class Frame {
        final State start;
        final State cur;
        final String label;
        final Iterator<Transition> it;

        Frame(State start, State cur, String label) {
            this.start = start;
            this.cur = cur;
            this.label = label;
            this.it = cur.transitions.iterator();
        }
    }

    private static final class Compression {

        private final Automaton dfa;
        private final int maxLen;
        private final Deque<Pending> pending = new ArrayDeque<Pending>();

        Compression(Automaton dfa, int maxLen) {
            this.dfa = dfa;
            this.maxLen = maxLen;
        }

        /*
         * A path ends at a state entered more than once, an accepting or
         * already visited state, or where the label reaches its length limit
         * (the initial-bytes window for paths out of the start state). A
         * state passed through on the way is absorbed into the path.
         */
        private boolean ends(State start, State cur, String label) {
            if (label == null) return false;
            if (cur.incoming > 1 || cur.accepting || cur.marked) return true;
            if (start != dfa.start) return maxLen > 0 && label.length() == maxLen;
            return label.length() == Automaton.INITIAL_BYTES;
        }

        private Frame enter(State start, State cur, String label) {
            if (ends(start, cur, label)) {
                pending.addFirst(new Pending(start, label, cur));
                if (cur.marked) return null;
                start = cur;
                label = null;
            } else if (cur != start) {
                cur.contained = true;
            }
            if (cur.marked && cur != start) return null;
            cur.marked = true;
            return new Frame(start, cur, label);
        }

        void run() {
            Deque<Frame> stack = new ArrayDeque<Frame>();
            stack.push(enter(dfa.start, dfa.start, null));
            while (!stack.isEmpty()) {
                Frame f = stack.peek();
                if (!f.it.hasNext()) {
                    stack.pop();
                    continue;
                }
                Transition t = f.it.next();
                if (t.to == f.cur) continue;
                String label = f.label == null ? t.label : f.label + t.label;
                Frame next = enter(f.start, t.to, label);
                if (next != null) stack.push(next);
            }
        }
    }

    /**
     * Replaces chains of states with one incoming and one outgoing transition
     * by single transitions labelled with the concatenated labels. States
     * absorbed into a chain are removed.
     *
     * @param maxLen longest label to create; <code>0</code> for no limit
     */
    static void compressPaths(Automaton dfa, int maxLen) {
        for (State s : dfa.states) {
            s.incoming = 0;
            s.marked = false;
            s.contained = false;
        }
        for (State s : dfa.states) {
            for (Transition t : s.transitions) {
                if (t.to != null) t.to.incoming++;
            }
        }

        Compression c = new Compression(dfa, maxLen);
        c.run();

        for (Pending p : c.pending) {
            p.from.addTransition(p.label, p.to);
        }
        int removed = 0;
        for (State s : dfa.states.toArray(new State[dfa.states.size()])) {
            if (s.contained) {
                dfa.remove(s);
                removed++;
            }
        }
        if (logger.isLoggable(level)) {
            logger.log(level, "compressed `" + dfa.regex + "': " + c.pending.size()
                + " paths, " + removed + " states absorbed");
        }
    }

    static void addMultiStrides(Automaton dfa, int stride) {
        if (stride < 1 || dfa.multistrided) return;
        Deque<Pending> pending = new ArrayDeque<Pending>();
        List<State> states = dfa.number();
        for (State s : states) {
            stride(pending, stride, 0, null, s, s);
        }
        for (Pending p : pending) {
            p.from.addTransition(p.label, p.to);
        }
        dfa.multistrided = true;
        if (logger.isLoggable(level)) {
            logger.log(level, "added " + pending.size() + " strides of " + stride
                + " to `" + dfa.regex + "'");
        }
    }

    // self loops are not followed
    private static void stride(Deque<Pending> pending, int stride, int depth,
            String label, State start, State s) {
        if (depth == stride) {
            pending.addFirst(new Pending(start, label, s));
            return;
        }
        for (Transition t : s.transitions) {
            if (t.to == t.from) continue;
            stride(pending, stride, depth + 1, label == null ? t.label : label + t.label, start, t.to);
        }
    }
}
