package com.astlens.ast;

/**
 * Identifies a node by the group (one per parsed translation unit or module source)
 * and its offset within that group's node sequence.
 *
 * Only meaningful for the snapshot that produced it.
 */
public record NodeId(int group, int offset) {
}
