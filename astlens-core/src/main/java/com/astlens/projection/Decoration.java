package com.astlens.projection;

/**
 * A short annotation rendered next to an entry's label.
 */
public record Decoration(String content, Appearance appearance) {

    public enum Appearance {
        /** Names the kind of a rendered declaration. */
        KIND,
        /** Flags a node that could not be rendered normally. */
        DIAGNOSTIC
    }

    public static Decoration kind(String content) {
        return new Decoration(content, Appearance.KIND);
    }

    public static Decoration diagnostic(String content) {
        return new Decoration(content, Appearance.DIAGNOSTIC);
    }
}
