package com.astlens.ast;

import java.util.Objects;

/**
 * Textual span of a construct in a source file. Both positions are always present.
 */
public record SourceRange(
    SourcePosition start,
    SourcePosition end,
    String fileUrl
) {
    public SourceRange {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
    }

    public SourceRange(int startLine, int startColumn, int endLine, int endColumn, String fileUrl) {
        this(new SourcePosition(startLine, startColumn), new SourcePosition(endLine, endColumn), fileUrl);
    }

    /**
     * Returns the last path segment of {@link #fileUrl()}.
     */
    public String fileName() {
        if (fileUrl == null) {
            return "";
        }
        return fileUrl.substring(fileUrl.lastIndexOf('/') + 1);
    }
}
