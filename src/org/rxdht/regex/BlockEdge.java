/*
 * @LICENSE@
 */

package org.rxdht.regex;

/**
 * An outgoing edge as published in a block: the label consumed and the key
 * of the state reached.
 */
public final class BlockEdge {

    private final String label;
    private final HashCode destination;

    public BlockEdge(String label, HashCode destination) {
        if (label == null || destination == null) {
            throw new NullPointerException("label and destination required");
        }
        this.label = label;
        this.destination = destination;
    }

    public String label() {
        return label;
    }

    public HashCode destination() {
        return destination;
    }

    @Override
    public int hashCode() {
        return 31 * label.hashCode() + destination.hashCode();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof BlockEdge)) return false;
        BlockEdge e = (BlockEdge) o;
        return label.equals(e.label) && destination.equals(e.destination);
    }

    @Override
    public String toString() {
        return label + "->" + destination;
    }
}
