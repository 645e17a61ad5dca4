package com.astlens.projection;

import com.astlens.ast.NodeId;

import java.util.List;
import java.util.Objects;

/**
 * One entry of the projected tree.
 *
 * @param label       text shown for the entry
 * @param icon        icon name for the entry's category
 * @param tooltip     hover text, may be null
 * @param reference   the node this entry stands for; null for synthetic groupings
 * @param children    nested entries
 * @param actions     operations offered on the entry
 * @param decorations annotations shown next to the label
 */
public record DisplayNode(
    String label,
    String icon,
    String tooltip,
    NodeId reference,
    List<DisplayNode> children,
    List<DisplayAction> actions,
    List<Decoration> decorations
) {
    public DisplayNode {
        children = children == null ? List.of() : List.copyOf(children);
        actions = actions == null ? List.of() : List.copyOf(actions);
        decorations = decorations == null ? List.of() : List.copyOf(decorations);
    }

    public boolean isSynthetic() {
        return reference == null;
    }

    public boolean hasAction(DisplayAction action) {
        return actions.contains(action);
    }

    /**
     * Finds the first child with the given label, or null.
     */
    public DisplayNode child(String label) {
        for (DisplayNode child : children) {
            if (Objects.equals(child.label(), label)) {
                return child;
            }
        }
        return null;
    }
}
