package com.astlens.ast;

import java.util.List;

public record FunctionDecl(
    String name,
    SourceRange site,
    List<NodeId> parameters
) implements AstNode {
    public FunctionDecl {
        parameters = parameters == null ? List.of() : List.copyOf(parameters);
    }

    @Override
    public String kind() {
        return NodeKind.FUNCTION_DECL.tag();
    }

    @Override
    public NodeKind nodeKind() {
        return NodeKind.FUNCTION_DECL;
    }
}
