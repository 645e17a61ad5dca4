package com.astlens.ast;

/**
 * Placeholder the compiler emits for a construct it could not produce.
 */
public record Missing() implements AstNode {

    public static final Missing INSTANCE = new Missing();

    @Override
    public String kind() {
        return NodeKind.MISSING.tag();
    }

    @Override
    public NodeKind nodeKind() {
        return NodeKind.MISSING;
    }
}
