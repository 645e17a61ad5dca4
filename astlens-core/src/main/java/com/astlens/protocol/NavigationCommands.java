package com.astlens.protocol;

import com.astlens.ast.Ast;
import com.astlens.ast.AstNode;
import com.astlens.ast.NodeId;
import com.astlens.ast.NodeIdOutOfRangeException;
import com.astlens.ast.Nodes;
import com.astlens.ast.SourceRange;
import com.astlens.ast.SourceSites;
import com.astlens.ast.TranslationUnit;
import com.astlens.projection.DisplayAction;

import java.util.Optional;

/**
 * Translates selection and action events on a snapshot node into the message they produce, if any.
 */
public final class NavigationCommands {

    private NavigationCommands() {
        // Utility class
    }

    /**
     * Plain selection navigates only for translation units.
     *
     * @throws NodeIdOutOfRangeException if {@code id} is not part of {@code ast}
     */
    public static Optional<HostMessage> onSelect(Ast ast, NodeId id) {
        AstNode node = ast.resolve(id);
        if (Nodes.isTranslationUnit(node)) {
            return openSourceFile(Nodes.asTranslationUnit(node));
        }
        return Optional.empty();
    }

    /**
     * Runs {@code action} on the node. Actions that do not apply to the node produce nothing.
     *
     * @throws NodeIdOutOfRangeException if {@code id} is not part of {@code ast}
     */
    public static Optional<HostMessage> onAction(Ast ast, NodeId id, DisplayAction action) {
        AstNode node = ast.resolve(id);
        return switch (action) {
            case OPEN_SOURCE_FILE -> Nodes.isTranslationUnit(node)
                ? openSourceFile(Nodes.asTranslationUnit(node))
                : Optional.empty();
            case HIGHLIGHT_FULL_DECLARATION -> SourceSites.siteOf(node)
                .<HostMessage>map(HighlightFullDeclaration::new);
        };
    }

    private static Optional<HostMessage> openSourceFile(TranslationUnit unit) {
        SourceRange site = unit.site();
        if (site == null || site.fileUrl() == null) {
            return Optional.empty();
        }
        return Optional.of(new OpenSourceFile(site.fileUrl()));
    }
}
