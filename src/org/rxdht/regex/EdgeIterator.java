/*
 * @LICENSE@
 */

package org.rxdht.regex;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.rxdht.regex.Automaton.State;
import org.rxdht.regex.Automaton.Transition;

/**
 * Enumerates the entries an automaton publishes: one per state with a
 * non-empty proof (or accepting), plus synthetic entries keyed by the
 * concrete strings that fill the initial-bytes window, so that a search can
 * start from the hash of its first characters.
 */
final class EdgeIterator {

    private final KeyIterator iterator;
    private boolean stopped;

    private EdgeIterator(KeyIterator iterator) {
        this.iterator = iterator;
    }

    private void visit(HashCode key, String proof, boolean accepting, List<BlockEdge> edges) {
        if (stopped) return;
        stopped = !iterator.visit(key, proof, accepting, edges);
    }

    static void iterateAllEdges(Automaton dfa, KeyIterator iterator) {
        EdgeIterator ei = new EdgeIterator(iterator);
        for (State s : dfa.states) {
            if ((s.proof != null && s.proof.length() > 0) || s.accepting) {
                ei.visit(s.hash, s.proof, s.accepting, s.blockEdges());
                if (ei.stopped) return;
            }
        }
        ei.initialEdge(Automaton.INITIAL_BYTES, Automaton.INITIAL_BYTES, "", dfa.start);
    }

    /*
     * walks every string of up to max characters spelled from the start
     * state
     */
    private void initialEdge(int min, int max, String consumed, State state) {
        if (stopped) return;
        final int cur = consumed.length();
        if ((cur >= min || state.accepting) && cur > 0) {
            if (cur <= max) {
                if (state.proof != null && !consumed.equals(state.proof)) {
                    visit(HashCode.of(consumed), consumed, state.accepting, state.blockEdges());
                }
                if (state.accepting && cur > 1 && state.transitions.isEmpty() && cur < max) {
                    // a literal shorter than the window still gets a key for its prefix
                    String prefix = consumed.substring(0, cur - 1);
                    visit(HashCode.of(prefix), prefix, false, edge(consumed.substring(cur - 1), state));
                }
            } else {
                String prefix = consumed.substring(0, max);
                visit(HashCode.of(prefix), prefix, false, edge(consumed.substring(max), state));
            }
        }
        if (cur < max) {
            for (Transition t : state.transitions) {
                initialEdge(min, max, consumed + t.label, t.to);
                if (stopped) return;
            }
        }
    }

    private static List<BlockEdge> edge(String label, State to) {
        return Collections.singletonList(new BlockEdge(label, to.hash));
    }

    /*
     * one published entry, held for the reachability pass
     */
    private static final class Record {
        final HashCode key;
        final String proof;
        final boolean accepting;
        final List<BlockEdge> edges;
        boolean reachable;

        Record(HashCode key, String proof, boolean accepting, List<BlockEdge> edges) {
            this.key = key;
            this.proof = proof;
            this.accepting = accepting;
            this.edges = edges;
        }
    }

    static void iterateReachableEdges(Automaton dfa, KeyIterator iterator) {
        final List<Record> records = new ArrayList<Record>();
        final Map<HashCode, List<Record>> byKey = new HashMap<HashCode, List<Record>>();
        iterateAllEdges(dfa, new KeyIterator() {
            public boolean visit(HashCode key, String proof, boolean accepting, List<BlockEdge> edges) {
                Record r = new Record(key, proof, accepting, edges);
                records.add(r);
                List<Record> list = byKey.get(key);
                if (list == null) {
                    list = new ArrayList<Record>(1);
                    byKey.put(key, list);
                }
                list.add(r);
                return true;
            }
        });

        Deque<Record> work = new ArrayDeque<Record>();
        for (Record r : records) {
            int len = r.proof == null ? 0 : r.proof.length();
            if (!r.reachable && (len >= Automaton.INITIAL_BYTES || r.accepting)) {
                r.reachable = true;
                work.push(r);
            }
            while (!work.isEmpty()) {
                Record next = work.pop();
                for (BlockEdge e : next.edges) {
                    List<Record> children = byKey.get(e.destination());
                    if (children == null) continue;
                    for (Record child : children) {
                        if (!child.reachable) {
                            child.reachable = true;
                            work.push(child);
                        }
                    }
                }
            }
        }

        for (Record r : records) {
            if (r.reachable && !iterator.visit(r.key, r.proof, r.accepting, r.edges)) return;
        }
    }
}
