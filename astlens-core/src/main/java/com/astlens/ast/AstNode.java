package com.astlens.ast;

/**
 * Base interface for all nodes of a snapshot.
 *
 * Children are referenced by {@link NodeId} and resolved through the owning {@link Ast}.
 */
public sealed interface AstNode permits
    Missing,
    FunctionDecl,
    ModuleDecl,
    TranslationUnit,
    ProductTypeDecl,
    ParameterDecl,
    UnrecognizedNode {

    /**
     * The raw kind tag as it appears on the wire.
     */
    String kind();

    NodeKind nodeKind();
}
