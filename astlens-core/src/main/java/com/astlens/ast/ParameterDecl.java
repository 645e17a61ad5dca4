package com.astlens.ast;

/**
 * A function parameter. {@code label} is null when the parameter has no argument label.
 */
public record ParameterDecl(
    String identifier,
    String label,
    SourceRange site
) implements AstNode {

    @Override
    public String kind() {
        return NodeKind.PARAMETER_DECL.tag();
    }

    @Override
    public NodeKind nodeKind() {
        return NodeKind.PARAMETER_DECL;
    }
}
