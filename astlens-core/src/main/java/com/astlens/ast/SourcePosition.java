package com.astlens.ast;

/**
 * A 1-based line/column position as emitted by the compiler.
 */
public record SourcePosition(int line, int column) {
}
