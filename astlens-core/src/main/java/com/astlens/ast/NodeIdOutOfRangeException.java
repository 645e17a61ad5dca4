package com.astlens.ast;

/**
 * Thrown when a {@link NodeId} does not address a node of the snapshot it is resolved against.
 *
 * This signals a snapshot that violates its own structure; it is distinct from a
 * {@link Missing} node, which is a legitimate part of the tree.
 */
public class NodeIdOutOfRangeException extends IndexOutOfBoundsException {

    private final transient NodeId id;

    public NodeIdOutOfRangeException(NodeId id, String message) {
        super(message);
        this.id = id;
    }

    public NodeId id() {
        return id;
    }
}
