/*
 * @LICENSE@
 */

package org.rxdht.regex;

import static org.rxdht.regex.Misc.LS;
import static org.rxdht.regex.Misc.same;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.rxdht.regex.Misc.DepthFirstVisitor;
import org.rxdht.regex.Misc.Edge;
import org.rxdht.regex.Misc.Vertex;

/**
 * A finite automaton compiled from a regular expression, and the public entry
 * point of the package.
 * <p>
 * A DFA compiled with {@link #compile(String, int)} has been determinized,
 * minimized and given a <em>proof</em> for each state: a canonical regex
 * describing every path from the start state to that state. The SHA-512
 * digest of a proof is the state's {@linkplain HashCode key}. Independent
 * peers compiling equivalent regexes arrive at identical keys, which is what
 * allows the states to be published to, and looked up in, a distributed hash
 * table.
 * <p>
 * The supported syntax is deliberately small: literal characters, implicit
 * concatenation, <code>|</code>, <code>*</code>, <code>+</code>,
 * <code>?</code> and parentheses. There is no escaping, no character classes
 * and no anchors; matching is always against the whole input.
 * <p>
 * Instances are not thread safe. Iterating the edges of an automaton does not
 * modify it, so a compiled automaton may be iterated (re-announced) any number
 * of times.
 */
public final class Automaton {

    private static final Logger logger = Logger.getLogger("org.rxdht.regex");
    private static final Level level = Level.FINEST;

    /**
     * Length of the prefix window shared by every published automaton. The
     * first key of a search string is the hash of at most this many leading
     * characters.
     */
    public static final int INITIAL_BYTES = 24;

    public enum Type {
        NFA, DFA
    }

    /**
     * Thrown when an automaton exceeds a construction limit.
     */
    public static final class ConstructionException extends RuntimeException {

        private static final long serialVersionUID = 1L;

        public ConstructionException(String msg) {
            super(msg);
        }
    }

    /**
     * A labelled edge, owned by its source state. A <code>null</code> label
     * is an epsilon transition (NFA only). The destination is
     * <code>null</code> only while subset construction is still resolving it.
     */
    static final class Transition implements Edge<State> {

        final State from;
        final String label;
        State to;

        Transition(State from, String label, State to) {
            this.from = from;
            this.label = label;
            this.to = to;
        }

        public State vertex() {
            return to;
        }

        @Override
        public String toString() {
            return from.id + " -" + (label == null ? "ε" : label) + "-> "
                + (to == null ? "?" : String.valueOf(to.id));
        }
    }

    static final class State implements Vertex<Transition> {

        final int id;
        boolean accepting;

        /*
         * sorted by label, epsilons last; see addTransition
         */
        final List<Transition> transitions = new ArrayList<Transition>();

        StateSet nfaSet;    // DFA states only, until minimized
        int dfsId = -1;
        String proof;
        HashCode hash;

        // scratch for path compression
        boolean marked;
        boolean contained;
        int incoming;

        State(int id, boolean accepting) {
            this.id = id;
            this.accepting = accepting;
        }

        public Iterable<Transition> edges() {
            return Collections.unmodifiableList(transitions);
        }

        int transitionCount() {
            return transitions.size();
        }

        /**
         * Adds <code>from -label-> to</code> unless an identical transition
         * exists. The new transition goes before the first transition with a
         * greater (non-null) label.
         */
        void addTransition(String label, State to) {
            int pos = transitions.size();
            for (int i = 0; i < transitions.size(); ++i) {
                Transition t = transitions.get(i);
                if (t.to == to && same(t.label, label)) return;
            }
            for (int i = 0; i < transitions.size(); ++i) {
                String other = transitions.get(i).label;
                if (other != null && label != null && other.compareTo(label) > 0) {
                    pos = i;
                    break;
                }
            }
            transitions.add(pos, new Transition(this, label, to));
        }

        /**
         * A non-accepting state whose transitions, if any, all loop back to
         * itself.
         */
        boolean dead() {
            if (accepting) return false;
            for (Transition t : transitions) {
                if (t.to != null && t.to != this) return false;
            }
            return true;
        }

        List<BlockEdge> blockEdges() {
            List<BlockEdge> ret = new ArrayList<BlockEdge>(transitions.size());
            for (Transition t : transitions) {
                ret.add(new BlockEdge(t.label, t.to.hash));
            }
            return Collections.unmodifiableList(ret);
        }

        private void destroy() {
            transitions.clear();
            nfaSet = null;
            proof = null;
            hash = null;
        }

        @Override
        public String toString() {
            return "s" + id + (accepting ? "(acc)" : "");
        }
    }

    final Type type;
    final String regex;
    State start;
    final LinkedList<State> states = new LinkedList<State>();
    String canonicalRegex;
    boolean multistrided;

    Automaton(Type type, String regex) {
        this.type = type;
        this.regex = regex;
    }

    /*
     * graph surgery
     */
    void add(State state) {
        states.addFirst(state);
    }

    /**
     * Removes a state together with every transition leading to it.
     */
    void remove(State state) {
        for (State check : states) {
            for (Iterator<Transition> it = check.transitions.iterator(); it.hasNext();) {
                if (it.next().to == state) it.remove();
            }
        }
        boolean removed = states.remove(state);
        assert removed : state;
        state.destroy();
    }

    /**
     * Merges <code>s2</code> into <code>s1</code>: incoming transitions of
     * <code>s2</code> are redirected (or dropped where they would duplicate
     * an existing one), its outgoing transitions are copied and
     * <code>s2</code> is removed.
     */
    void merge(State s1, State s2) {
        if (s1 == s2) return;

        for (State check : states) {
            for (Iterator<Transition> it = check.transitions.iterator(); it.hasNext();) {
                Transition t = it.next();
                if (t.to != s2) continue;
                boolean dup = false;
                for (Transition other : check.transitions) {
                    if (other.to == s1 && same(other.label, t.label)) dup = true;
                }
                if (dup) {
                    it.remove();
                } else {
                    t.to = s1;
                }
            }
        }
        for (Transition t : s2.transitions) {
            if (t.to != s1) s1.addTransition(t.label, t.to);
        }
        boolean removed = states.remove(s2);
        assert removed : s2;
        if (start == s2) start = s1;
        s2.destroy();
    }

    /**
     * Assigns dense preorder numbers from the start state.
     *
     * @return the states indexed by their new <code>dfsId</code>
     */
    List<State> number() {
        final List<State> ret = new ArrayList<State>(states.size());
        new DepthFirstVisitor<State, Transition>() {
            @Override
            protected void visit(State state, int count) {
                state.dfsId = count;
                ret.add(state);
            }
        }.start(start);
        return ret;
    }

    /*
     * Public API
     */

    /**
     * Parses a regex into a Thompson NFA.
     *
     * @throws java.util.regex.PatternSyntaxException if the regex is empty
     *             or malformed
     */
    public static Automaton compileNfa(String regex) {
        return new RegexParser().parse(regex);
    }

    /**
     * Compiles a regex into a minimized DFA with proofs, without path
     * compression.
     */
    public static Automaton compile(String regex) {
        return compile(regex, 1);
    }

    /**
     * Compiles a regex into a minimized DFA with proofs and keys for every
     * state.
     *
     * @param maxPathLen the longest edge label path compression may create;
     *            <code>0</code> for no limit and <code>1</code> to skip
     *            compression altogether
     * @throws java.util.regex.PatternSyntaxException if the regex is empty
     *             or malformed
     * @throws ConstructionException if the DFA grows too large
     */
    public static Automaton compile(String regex, int maxPathLen) {
        if (maxPathLen < 0) {
            throw new IllegalArgumentException("negative path length: " + maxPathLen);
        }
        Automaton dfa = DFA.determinize(compileNfa(regex));
        DFA.minimize(dfa);
        Proofs.create(dfa);
        if (maxPathLen != 1) {
            PathCompressor.compressPaths(dfa, maxPathLen);
        }
        if (logger.isLoggable(level)) {
            logger.log(level, "compiled `" + regex + "': " + dfa.stateCount()
                + " states, " + dfa.transitionCount() + " transitions" + LS
                + dfa.toGraphString());
        }
        return dfa;
    }

    /**
     * The key a search for <code>input</code> starts from: the hash of its
     * first {@link #INITIAL_BYTES} characters, or of the whole input when it
     * is shorter.
     */
    public static HashCode firstKey(String input) {
        return HashCode.of(input.substring(0, Math.min(input.length(), INITIAL_BYTES)));
    }

    /**
     * @return whether <code>key</code> is the hash of <code>proof</code>
     */
    public static boolean checkProof(String proof, HashCode key) {
        if (proof == null || key == null) return false;
        return HashCode.of(proof).equals(key);
    }

    /**
     * Matches the whole of <code>input</code>.
     */
    public boolean eval(String input) {
        switch (type) {
        case DFA:
            return DFA.evaluate(this, input);
        case NFA:
            return NFA.evaluate(this, input);
        default:
            throw new AssertionError(type);
        }
    }

    public Type type() {
        return type;
    }

    public String regex() {
        return regex;
    }

    /**
     * The union of the proofs of all accepting states; <code>null</code> for
     * an NFA.
     */
    public String canonicalRegex() {
        return canonicalRegex;
    }

    public int stateCount() {
        return states.size();
    }

    public int transitionCount() {
        int count = 0;
        for (State s : states) {
            count += s.transitionCount();
        }
        return count;
    }

    public boolean isMultistrided() {
        return multistrided;
    }

    /**
     * Adds, for every reachable state, one transition per path of exactly
     * <code>stride</code> non-looping steps. Has no effect on an automaton
     * already multistrided or for a stride below one.
     */
    public void addMultiStrides(int stride) {
        checkDfa();
        PathCompressor.addMultiStrides(this, stride);
    }

    /**
     * Visits every state worth publishing, followed by synthetic entries for
     * the initial-bytes window. Stops early when the iterator returns
     * <code>false</code>.
     */
    public void iterateAllEdges(KeyIterator iterator) {
        checkDfa();
        EdgeIterator.iterateAllEdges(this, iterator);
    }

    /**
     * As {@link #iterateAllEdges(KeyIterator)}, restricted to entries
     * reachable from the initial-bytes window or from an accepting entry.
     */
    public void iterateReachableEdges(KeyIterator iterator) {
        checkDfa();
        EdgeIterator.iterateReachableEdges(this, iterator);
    }

    private void checkDfa() {
        if (type != Type.DFA) {
            throw new IllegalStateException("operation requires a DFA, not " + type);
        }
    }

    String toGraphString() {
        StringBuilder sb = new StringBuilder();
        for (State s : states) {
            sb.append(s == start ? "->" : "  ").append(s);
            for (Transition t : s.transitions) {
                sb.append(' ').append(t);
            }
            sb.append(LS);
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return type + "[" + regex + "]";
    }
}
