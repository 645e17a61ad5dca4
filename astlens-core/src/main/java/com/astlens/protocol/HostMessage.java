package com.astlens.protocol;

/**
 * Navigation commands sent from the explorer UI to the host editor.
 * Delivery is one-way; no reply is expected.
 */
public sealed interface HostMessage permits OpenSourceFile, HighlightFullDeclaration {

    String OPEN_SOURCE_FILE = "openSourceFile";
    String HIGHLIGHT_FULL_DECLARATION = "highlightFullDeclaration";

    /**
     * The wire discriminator of the message.
     */
    String type();
}
