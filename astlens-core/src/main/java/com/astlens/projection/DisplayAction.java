package com.astlens.projection;

/**
 * Named operations a user can invoke on a display entry.
 */
public enum DisplayAction {
    HIGHLIGHT_FULL_DECLARATION("highlightFullDeclaration", "open-preview", "Highlight Declaration"),
    OPEN_SOURCE_FILE("openSourceFile", "go-to-file", "Open Source File");

    private final String id;
    private final String icon;
    private final String tooltip;

    DisplayAction(String id, String icon, String tooltip) {
        this.id = id;
        this.icon = icon;
        this.tooltip = tooltip;
    }

    public String id() {
        return id;
    }

    public String icon() {
        return icon;
    }

    public String tooltip() {
        return tooltip;
    }

    /**
     * Looks up an action by the id the UI reports back, or null if there is none.
     */
    public static DisplayAction fromId(String id) {
        for (DisplayAction action : values()) {
            if (action.id.equals(id)) {
                return action;
            }
        }
        return null;
    }
}
