/*
 * @LICENSE@
 */

package org.rxdht.regex;

import java.util.List;

/**
 * Callback for {@link Automaton#iterateAllEdges(KeyIterator)} and
 * {@link Automaton#iterateReachableEdges(KeyIterator)}.
 */
public interface KeyIterator {

    /**
     * @param key hash of <code>proof</code>
     * @param proof the canonical regex of the entry
     * @param accepting whether a search may end here
     * @param edges the outgoing edges, in publication order
     * @return <code>false</code> to stop the iteration
     */
    boolean visit(HashCode key, String proof, boolean accepting, List<BlockEdge> edges);
}
