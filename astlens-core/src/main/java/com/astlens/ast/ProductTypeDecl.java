package com.astlens.ast;

public record ProductTypeDecl(
    String name,
    SourceRange site,
    SourceRange identifierSite
) implements AstNode {
    public ProductTypeDecl(String name, SourceRange site) {
        this(name, site, null);
    }

    @Override
    public String kind() {
        return NodeKind.PRODUCT_TYPE_DECL.tag();
    }

    @Override
    public NodeKind nodeKind() {
        return NodeKind.PRODUCT_TYPE_DECL;
    }
}
