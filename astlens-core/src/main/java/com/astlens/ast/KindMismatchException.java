package com.astlens.ast;

/**
 * Thrown when a kind-specific accessor is applied to a node of another kind.
 * Callers are expected to dispatch on {@link Nodes#kindOf(AstNode)} first.
 */
public class KindMismatchException extends IllegalStateException {

    private final NodeKind expected;
    private final String actual;

    public KindMismatchException(NodeKind expected, String actual) {
        super("Expected " + expected.tag() + " but node is " + actual);
        this.expected = expected;
        this.actual = actual;
    }

    public NodeKind expected() {
        return expected;
    }

    /**
     * The raw kind tag of the offending node.
     */
    public String actual() {
        return actual;
    }
}
