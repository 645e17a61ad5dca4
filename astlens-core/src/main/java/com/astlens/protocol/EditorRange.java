package com.astlens.protocol;

import com.astlens.ast.SourceRange;

/**
 * A zero-based selection span as editors expect it.
 */
public record EditorRange(int startLine, int startColumn, int endLine, int endColumn) {

    /**
     * Converts the compiler's 1-based range. This is the only place coordinates are shifted.
     */
    public static EditorRange fromSourceRange(SourceRange range) {
        return new EditorRange(
            range.start().line() - 1,
            range.start().column() - 1,
            range.end().line() - 1,
            range.end().column() - 1);
    }
}
