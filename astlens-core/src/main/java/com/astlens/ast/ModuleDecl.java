package com.astlens.ast;

import java.util.List;

/**
 * A module groups one or more translation units. It is synthetic and has no site.
 */
public record ModuleDecl(
    String baseName,
    boolean canAccessBuiltins,
    List<NodeId> sources
) implements AstNode {
    public ModuleDecl {
        sources = sources == null ? List.of() : List.copyOf(sources);
    }

    @Override
    public String kind() {
        return NodeKind.MODULE_DECL.tag();
    }

    @Override
    public NodeKind nodeKind() {
        return NodeKind.MODULE_DECL;
    }
}
