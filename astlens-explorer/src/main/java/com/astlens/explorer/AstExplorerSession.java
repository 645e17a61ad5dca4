package com.astlens.explorer;

import com.astlens.ast.Ast;
import com.astlens.ast.NodeId;
import com.astlens.ast.NodeIdOutOfRangeException;
import com.astlens.json.AstJsonException;
import com.astlens.json.AstJsonProvider;
import com.astlens.projection.DisplayAction;
import com.astlens.projection.DisplayNode;
import com.astlens.projection.TreeProjector;
import com.astlens.protocol.HostChannel;
import com.astlens.protocol.HostMessage;
import com.astlens.protocol.NavigationCommands;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Holds the current snapshot of an explorer view and mediates between its UI and the host.
 *
 * <p>New input text replaces the snapshot and its tree as a whole. Input that cannot be
 * read, or a snapshot whose references fall outside it, leaves the view with no snapshot
 * and an empty tree; nothing is thrown to the caller.</p>
 *
 * <p>Selection and action events carry the serialized {@link NodeId} of a display entry.
 * Since the UI may still show a tree from an earlier snapshot, events whose reference cannot
 * be parsed or resolved are logged and ignored.</p>
 *
 * <p>Instances are confined to the thread that delivers UI events.</p>
 */
public class AstExplorerSession {

    private static final Logger log = LoggerFactory.getLogger(AstExplorerSession.class);

    private final AstJsonProvider json;
    private final TreeProjector projector;
    private final HostChannel host;

    private Ast ast;
    private List<DisplayNode> tree = List.of();

    public AstExplorerSession(HostChannel host) {
        this(AstJsonProvider.getProvider(), new TreeProjector(), host);
    }

    public AstExplorerSession(AstJsonProvider json, TreeProjector projector, HostChannel host) {
        this.json = json;
        this.projector = projector;
        this.host = host;
    }

    /**
     * Replaces the current snapshot with the one read from {@code text} and returns its tree.
     */
    public List<DisplayNode> updateInput(String text) {
        ast = null;
        tree = List.of();

        Ast parsed;
        try {
            parsed = json.getDeserializer().deserializeAst(text);
        } catch (AstJsonException e) {
            log.debug("Input is not a valid AST: {}", rootMessage(e));
            return tree;
        }
        return show(parsed);
    }

    /**
     * Replaces the current snapshot with {@code snapshot} and returns its tree.
     */
    public List<DisplayNode> show(Ast snapshot) {
        ast = null;
        tree = List.of();
        try {
            List<DisplayNode> projected = projector.project(snapshot);
            ast = snapshot;
            tree = projected;
        } catch (NodeIdOutOfRangeException e) {
            log.warn("Discarding snapshot with dangling reference {}: {}", e.id(), e.getMessage());
        }
        return tree;
    }

    public List<DisplayNode> currentTree() {
        return tree;
    }

    public Optional<Ast> currentAst() {
        return Optional.ofNullable(ast);
    }

    /**
     * Serialized form of a display entry's reference, as the UI stores it; null for synthetic entries.
     */
    public String referenceOf(DisplayNode entry) {
        return entry.isSynthetic() ? null : json.getSerializer().serializeNodeId(entry.reference());
    }

    /**
     * Handles the user selecting an entry.
     *
     * @return the message posted to the host, if any
     */
    public Optional<HostMessage> select(String reference) {
        NodeId id = parseReference(reference);
        if (id == null) {
            return Optional.empty();
        }
        return select(id);
    }

    public Optional<HostMessage> select(NodeId id) {
        if (ast == null) {
            log.debug("Selection of {} ignored, no snapshot loaded", id);
            return Optional.empty();
        }
        try {
            return post(NavigationCommands.onSelect(ast, id));
        } catch (NodeIdOutOfRangeException e) {
            log.debug("Selection of stale reference {} ignored: {}", id, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Handles the user invoking the action {@code actionId} on an entry.
     *
     * @return the message posted to the host, if any
     */
    public Optional<HostMessage> runAction(String actionId, String reference) {
        DisplayAction action = DisplayAction.fromId(actionId);
        if (action == null) {
            log.warn("Unknown action '{}' ignored", actionId);
            return Optional.empty();
        }
        NodeId id = parseReference(reference);
        if (id == null) {
            return Optional.empty();
        }
        return runAction(action, id);
    }

    public Optional<HostMessage> runAction(DisplayAction action, NodeId id) {
        if (ast == null) {
            log.debug("Action {} on {} ignored, no snapshot loaded", action.id(), id);
            return Optional.empty();
        }
        try {
            Optional<HostMessage> message = NavigationCommands.onAction(ast, id, action);
            if (message.isEmpty()) {
                log.debug("Action {} has no effect on {}", action.id(), id);
            }
            return post(message);
        } catch (NodeIdOutOfRangeException e) {
            log.debug("Action {} on stale reference {} ignored: {}", action.id(), id, e.getMessage());
            return Optional.empty();
        }
    }

    private Optional<HostMessage> post(Optional<HostMessage> message) {
        message.ifPresent(host::post);
        return message;
    }

    private NodeId parseReference(String reference) {
        try {
            return json.getDeserializer().deserializeNodeId(reference);
        } catch (AstJsonException e) {
            log.debug("Error parsing node reference '{}': {}", reference, rootMessage(e));
            return null;
        }
    }

    private static String rootMessage(Throwable e) {
        Throwable root = e;
        while (root.getCause() != null) {
            root = root.getCause();
        }
        return root.getMessage();
    }
}
