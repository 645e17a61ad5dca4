package com.astlens.ast;

import java.util.List;

public record TranslationUnit(
    List<NodeId> decls,
    SourceRange site
) implements AstNode {
    public TranslationUnit {
        decls = decls == null ? List.of() : List.copyOf(decls);
    }

    @Override
    public String kind() {
        return NodeKind.TRANSLATION_UNIT.tag();
    }

    @Override
    public NodeKind nodeKind() {
        return NodeKind.TRANSLATION_UNIT;
    }
}
