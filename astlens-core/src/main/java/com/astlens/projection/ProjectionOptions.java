package com.astlens.projection;

/**
 * Limits applied by {@link TreeProjector} when walking a snapshot.
 *
 * @param maxDepth     deepest level that is expanded; deeper references render as a truncated placeholder
 * @param detectCycles whether a reference that reappears among its own ancestors renders as a cycle placeholder
 */
public record ProjectionOptions(int maxDepth, boolean detectCycles) {

    public static final int DEFAULT_MAX_DEPTH = 512;

    public ProjectionOptions {
        if (maxDepth < 1) {
            throw new IllegalArgumentException("maxDepth must be positive: " + maxDepth);
        }
    }

    public static ProjectionOptions defaults() {
        return new ProjectionOptions(DEFAULT_MAX_DEPTH, true);
    }

    public ProjectionOptions withMaxDepth(int maxDepth) {
        return new ProjectionOptions(maxDepth, detectCycles);
    }

    public ProjectionOptions withDetectCycles(boolean detectCycles) {
        return new ProjectionOptions(maxDepth, detectCycles);
    }
}
