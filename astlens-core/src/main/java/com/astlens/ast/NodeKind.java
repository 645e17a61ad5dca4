package com.astlens.ast;

/**
 * Discriminant of an {@link AstNode}.
 *
 * {@link #UNRECOGNIZED} stands for every tag that is not part of the known set;
 * the raw tag stays available through {@link AstNode#kind()}.
 */
public enum NodeKind {
    MISSING("missing"),
    FUNCTION_DECL("FunctionDecl"),
    MODULE_DECL("ModuleDecl"),
    TRANSLATION_UNIT("TranslationUnit"),
    PRODUCT_TYPE_DECL("ProductTypeDecl"),
    PARAMETER_DECL("ParameterDecl"),
    UNRECOGNIZED(null);

    private final String tag;

    NodeKind(String tag) {
        this.tag = tag;
    }

    /**
     * The wire tag of this kind, or null for {@link #UNRECOGNIZED}.
     */
    public String tag() {
        return tag;
    }

    public static NodeKind fromTag(String tag) {
        for (NodeKind kind : values()) {
            if (kind.tag != null && kind.tag.equals(tag)) {
                return kind;
            }
        }
        return UNRECOGNIZED;
    }
}
