package com.astlens.protocol;

import java.net.URI;

/**
 * Editor operations the host provides.
 */
public interface HostNavigator {

    /**
     * Opens or focuses the resource without moving the focus away from the explorer.
     */
    void openSourceFile(URI resource);

    /**
     * Opens the resource and selects {@code range}.
     */
    void revealRange(URI resource, EditorRange range);
}
