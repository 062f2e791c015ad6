/*
 * @LICENSE@
 */

package org.rxdht.regex;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.Queue;


/**
 * Reusable static helpers: the digraph view of automata and the two
 * traversal orders the engine needs.
 */
final class Misc {

    private Misc() {
    } // never instantiated

    public static final String LS = System.getProperty("line.separator");

    /*
     * null-tolerant label comparison; null is epsilon.
     */
    static boolean same(String s1, String s2) {
        return s1 == null ? s2 == null : s1.equals(s2);
    }

    /*
     * Generic digraph view
     */
    private interface SimpleVertex {
        Iterable<? extends SimpleEdge> edges();
    }
    private interface SimpleEdge {
        SimpleVertex vertex();
    }
    interface Vertex<E extends SimpleEdge> extends SimpleVertex {
        Iterable<E> edges();
    }
    interface Edge<V extends SimpleVertex> extends SimpleEdge {
         V vertex();
    }

    /**
     * Marks everything reachable from an initial vertex. Edges whose vertex is
     * still unresolved (<code>null</code>) are skipped.
     */
    static final class BreadthFirstVisitor<V extends Vertex<E>, E extends Edge<V>> {

        private final Map<V, Boolean> black = new IdentityHashMap<V, Boolean>();
        private final Queue<V> gray = new ArrayDeque<V>();

        final BreadthFirstVisitor<V, E> start(V init) {
            black.clear(); gray.clear();
            black.put(init, Boolean.TRUE);
            gray.offer(init);
            while (!gray.isEmpty()) {
                V vertex = gray.remove();
                for (E edge : vertex.edges()) {
                    V next = edge.vertex();
                    if (next != null && black.put(next, Boolean.TRUE) == null) {
                        gray.offer(next);
                    }
                }
            }
            return this;
        }

        final boolean reached(V vertex) {
            return black.containsKey(vertex);
        }
    }

    /**
     * Iterative preorder depth first traversal. Vertices are numbered in
     * discovery order, which follows the iteration order of each vertex's
     * edges exactly as a recursive walk would.
     */
    static abstract class DepthFirstVisitor<V extends Vertex<E>, E extends Edge<V>> {

        private final Map<V, Integer> black = new IdentityHashMap<V, Integer>();
        private final Deque<Iterator<E>> eiDeq = new ArrayDeque<Iterator<E>>();

        final DepthFirstVisitor<V, E> start(V init) {
            black.clear(); eiDeq.clear();
            discover(init);
            while (!eiDeq.isEmpty()) {
                Iterator<E> ei = eiDeq.peekFirst();
                if (!ei.hasNext()) {
                    eiDeq.removeFirst();
                    continue;
                }
                E edge = ei.next();
                V next = edge.vertex();
                if (next != null && !black.containsKey(next)) {
                    discover(next);
                }
            }
            return this;
        }

        private void discover(V vertex) {
            int count = black.size();
            black.put(vertex, count);
            visit(vertex, count);
            eiDeq.addFirst(vertex.edges().iterator());
        }

        protected abstract void visit(V vertex, int count);
    }
}
