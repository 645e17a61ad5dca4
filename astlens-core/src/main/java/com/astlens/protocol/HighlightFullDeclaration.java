package com.astlens.protocol;

import com.astlens.ast.SourceRange;

/**
 * Asks the host to open {@code range.fileUrl()} and select the range.
 * The range is in the compiler's 1-based coordinates.
 */
public record HighlightFullDeclaration(SourceRange range) implements HostMessage {

    @Override
    public String type() {
        return HIGHLIGHT_FULL_DECLARATION;
    }
}
