package com.astlens.ast;

/**
 * A node whose kind tag is outside the known set, e.g. from a newer compiler.
 * Only the tag is kept.
 */
public record UnrecognizedNode(String kind) implements AstNode {

    @Override
    public NodeKind nodeKind() {
        return NodeKind.UNRECOGNIZED;
    }
}
