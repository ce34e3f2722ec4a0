package io.pagetree.core;

/**
 * Stable identity of a tree node.
 * <p>
 * Ids are opaque to everything except {@link PageTree#allocateId()}, which hands out
 * {@code n<k>} style ids that are unique within one tree value.
 */
public record NodeId(String value) implements Comparable<NodeId> {

    public NodeId {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("node id must not be blank");
        }
    }

    @Override
    public int compareTo(NodeId other) {
        return value.compareTo(other.value);
    }

    @Override
    public String toString() {
        return value;
    }
}
