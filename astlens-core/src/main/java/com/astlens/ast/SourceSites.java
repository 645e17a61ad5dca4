package com.astlens.ast;

import java.util.Optional;

/**
 * Maps a node to the source range an editor can navigate to.
 */
public final class SourceSites {

    private SourceSites() {
        // Utility class
    }

    /**
     * Returns the node's own site, or empty for modules, missing nodes and unrecognized kinds.
     */
    public static Optional<SourceRange> siteOf(AstNode node) {
        return switch (Nodes.kindOf(node)) {
            case FUNCTION_DECL -> Optional.ofNullable(Nodes.asFunctionDecl(node).site());
            case TRANSLATION_UNIT -> Optional.ofNullable(Nodes.asTranslationUnit(node).site());
            case PRODUCT_TYPE_DECL -> Optional.ofNullable(Nodes.asProductTypeDecl(node).site());
            case PARAMETER_DECL -> Optional.ofNullable(Nodes.asParameterDecl(node).site());
            case MODULE_DECL, MISSING, UNRECOGNIZED -> Optional.empty();
        };
    }
}
