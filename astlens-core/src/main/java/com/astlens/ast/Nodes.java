package com.astlens.ast;

import java.util.List;

/**
 * Kind-safe access to {@link AstNode} variants.
 *
 * <p>{@code isX} tests the discriminant, {@code asX} narrows to the variant and throws
 * {@link KindMismatchException} otherwise. Code that handles several kinds should switch on
 * {@link #kindOf(AstNode)} rather than chain {@code isX} checks.</p>
 */
public final class Nodes {

    private Nodes() {
        // Utility class
    }

    public static NodeKind kindOf(AstNode node) {
        return node.nodeKind();
    }

    public static boolean isMissing(AstNode node) {
        return node instanceof Missing;
    }

    public static boolean isFunctionDecl(AstNode node) {
        return node instanceof FunctionDecl;
    }

    public static boolean isModuleDecl(AstNode node) {
        return node instanceof ModuleDecl;
    }

    public static boolean isTranslationUnit(AstNode node) {
        return node instanceof TranslationUnit;
    }

    public static boolean isProductTypeDecl(AstNode node) {
        return node instanceof ProductTypeDecl;
    }

    public static boolean isParameterDecl(AstNode node) {
        return node instanceof ParameterDecl;
    }

    public static Missing asMissing(AstNode node) {
        return as(node, Missing.class, NodeKind.MISSING);
    }

    public static FunctionDecl asFunctionDecl(AstNode node) {
        return as(node, FunctionDecl.class, NodeKind.FUNCTION_DECL);
    }

    public static ModuleDecl asModuleDecl(AstNode node) {
        return as(node, ModuleDecl.class, NodeKind.MODULE_DECL);
    }

    public static TranslationUnit asTranslationUnit(AstNode node) {
        return as(node, TranslationUnit.class, NodeKind.TRANSLATION_UNIT);
    }

    public static ProductTypeDecl asProductTypeDecl(AstNode node) {
        return as(node, ProductTypeDecl.class, NodeKind.PRODUCT_TYPE_DECL);
    }

    public static ParameterDecl asParameterDecl(AstNode node) {
        return as(node, ParameterDecl.class, NodeKind.PARAMETER_DECL);
    }

    /**
     * Child references of {@code node}, in declaration order.
     */
    public static List<NodeId> childrenOf(AstNode node) {
        return switch (kindOf(node)) {
            case MODULE_DECL -> asModuleDecl(node).sources();
            case TRANSLATION_UNIT -> asTranslationUnit(node).decls();
            case FUNCTION_DECL -> asFunctionDecl(node).parameters();
            case PRODUCT_TYPE_DECL, PARAMETER_DECL, MISSING, UNRECOGNIZED -> List.of();
        };
    }

    private static <T extends AstNode> T as(AstNode node, Class<T> type, NodeKind expected) {
        if (type.isInstance(node)) {
            return type.cast(node);
        }
        throw new KindMismatchException(expected, node.kind());
    }
}
