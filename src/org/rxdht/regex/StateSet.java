/*
 * @LICENSE@
 */

package org.rxdht.regex;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.IdentityHashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

import org.rxdht.regex.Automaton.State;

/**
 * An immutable set of NFA states ordered by id; the identity of a DFA state
 * during subset construction. Equality is by member identity.
 */
final class StateSet implements Iterable<State> {

    private static final Comparator<State> BY_ID = new Comparator<State>() {
        public int compare(State s1, State s2) {
            return s1.id < s2.id ? -1 : s1.id == s2.id ? 0 : 1;
        }
    };

    static final StateSet EMPTY = new StateSet(Collections.<State>emptyList());

    private final List<State> members;
    private final int hash;

    private StateSet(List<State> members) {
        this.members = members;
        int h = 1;
        for (State s : members) {
            h = 31 * h + System.identityHashCode(s);
        }
        this.hash = h;
    }

    /**
     * Accumulates states, ignoring duplicates.
     */
    static final class Builder {

        private final Map<State, Boolean> seen = new IdentityHashMap<State, Boolean>();
        private final List<State> list = new ArrayList<State>();

        /**
         * @return <code>true</code> if the state was not already present
         */
        boolean add(State s) {
            if (seen.put(s, Boolean.TRUE) != null) return false;
            list.add(s);
            return true;
        }

        StateSet build() {
            if (list.isEmpty()) return EMPTY;
            List<State> sorted = new ArrayList<State>(list);
            Collections.sort(sorted, BY_ID);
            return new StateSet(Collections.unmodifiableList(sorted));
        }
    }

    static StateSet of(State s) {
        return new StateSet(Collections.singletonList(s));
    }

    boolean isEmpty() {
        return members.isEmpty();
    }

    boolean accepting() {
        for (State s : members) {
            if (s.accepting) return true;
        }
        return false;
    }

    public Iterator<State> iterator() {
        return members.iterator();
    }

    @Override
    public int hashCode() {
        return hash;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof StateSet)) return false;
        StateSet that = (StateSet) o;
        if (hash != that.hash || members.size() != that.members.size()) return false;
        for (int i = 0; i < members.size(); ++i) {
            if (members.get(i) != that.members.get(i)) return false;
        }
        return true;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("{");
        for (State s : members) {
            if (sb.length() > 1) sb.append(',');
            sb.append(s.id);
        }
        return sb.append('}').toString();
    }
}
