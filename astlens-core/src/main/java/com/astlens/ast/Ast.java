package com.astlens.ast;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * An immutable AST snapshot.
 *
 * <p>All nodes live in {@code groups}; {@code groups[g][o]} is the node addressed by
 * {@code NodeId(g, o)}. {@code moduleIds} lists the root modules. Nodes refer to their
 * children by id only, so the snapshot is the single owner of every node.</p>
 *
 * <p>A new input always produces a new snapshot; nothing here is ever patched in place.</p>
 */
public record Ast(
    List<NodeId> moduleIds,
    List<List<AstNode>> groups
) {
    public Ast {
        moduleIds = moduleIds == null ? List.of() : List.copyOf(moduleIds);
        if (groups == null) {
            groups = List.of();
        } else {
            List<List<AstNode>> copy = new ArrayList<>(groups.size());
            for (List<AstNode> group : groups) {
                copy.add(group == null ? List.of() : List.copyOf(group));
            }
            groups = List.copyOf(copy);
        }
    }

    public static Ast empty() {
        return new Ast(List.of(), List.of());
    }

    /**
     * Returns the node addressed by {@code id}.
     *
     * @throws NodeIdOutOfRangeException if the group or offset is outside this snapshot
     */
    public AstNode resolve(NodeId id) {
        Objects.requireNonNull(id, "id");
        if (id.group() < 0 || id.group() >= groups.size()) {
            throw new NodeIdOutOfRangeException(id,
                "Group " + id.group() + " out of range [0, " + groups.size() + ")");
        }
        List<AstNode> group = groups.get(id.group());
        if (id.offset() < 0 || id.offset() >= group.size()) {
            throw new NodeIdOutOfRangeException(id,
                "Offset " + id.offset() + " out of range [0, " + group.size() + ") in group " + id.group());
        }
        return group.get(id.offset());
    }

    /**
     * Checks whether {@code id} addresses a node of this snapshot.
     */
    public boolean contains(NodeId id) {
        return id != null
            && id.group() >= 0 && id.group() < groups.size()
            && id.offset() >= 0 && id.offset() < groups.get(id.group()).size();
    }

    /**
     * Returns every id reachable from {@link #moduleIds()}, in depth-first pre-order, each once.
     *
     * @throws NodeIdOutOfRangeException on the first reference that does not resolve
     */
    public Set<NodeId> reachableIds() {
        Set<NodeId> visited = new LinkedHashSet<>();
        Deque<NodeId> pending = new ArrayDeque<>();
        for (int i = moduleIds.size() - 1; i >= 0; i--) {
            pending.push(moduleIds.get(i));
        }
        while (!pending.isEmpty()) {
            NodeId id = pending.pop();
            if (!visited.add(id)) {
                continue;
            }
            List<NodeId> children = Nodes.childrenOf(resolve(id));
            for (int i = children.size() - 1; i >= 0; i--) {
                pending.push(children.get(i));
            }
        }
        return visited;
    }

    public int nodeCount() {
        int count = 0;
        for (List<AstNode> group : groups) {
            count += group.size();
        }
        return count;
    }
}
