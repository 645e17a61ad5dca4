package com.astlens.projection;

import com.astlens.ast.Ast;
import com.astlens.ast.AstNode;
import com.astlens.ast.FunctionDecl;
import com.astlens.ast.ModuleDecl;
import com.astlens.ast.NodeId;
import com.astlens.ast.NodeIdOutOfRangeException;
import com.astlens.ast.Nodes;
import com.astlens.ast.ParameterDecl;
import com.astlens.ast.ProductTypeDecl;
import com.astlens.ast.TranslationUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Builds the display tree of a snapshot, one root entry per module id.
 *
 * <p>Every reference is rendered by dispatching on its kind, so a node of an unexpected
 * kind in any position renders as an "Unknown" placeholder instead of failing. References
 * that do not resolve are a broken snapshot and abort the projection with
 * {@link NodeIdOutOfRangeException}.</p>
 *
 * <p>The projector only reads the snapshot and keeps no state between calls.</p>
 */
public class TreeProjector {

    private static final Logger log = LoggerFactory.getLogger(TreeProjector.class);

    public static final String UNKNOWN_LABEL = "Unknown";
    public static final String CYCLE_LABEL = "Cycle";
    public static final String TRUNCATED_LABEL = "Truncated";
    public static final String PARAMETERS_LABEL = "parameters";
    public static final String NO_LABEL = "<none>";

    private final ProjectionOptions options;

    public TreeProjector() {
        this(ProjectionOptions.defaults());
    }

    public TreeProjector(ProjectionOptions options) {
        this.options = options;
    }

    public ProjectionOptions options() {
        return options;
    }

    /**
     * Projects the whole snapshot.
     *
     * @throws NodeIdOutOfRangeException if a reachable reference is outside the snapshot
     */
    public List<DisplayNode> project(Ast ast) {
        Walk walk = new Walk(ast);
        List<DisplayNode> roots = new ArrayList<>(ast.moduleIds().size());
        for (NodeId moduleId : ast.moduleIds()) {
            roots.add(walk.render(moduleId, 1));
        }
        return List.copyOf(roots);
    }

    /**
     * State of a single projection pass: the snapshot and the ids on the current path.
     */
    private final class Walk {
        private final Ast ast;
        private final Set<NodeId> ancestors = new HashSet<>();

        Walk(Ast ast) {
            this.ast = ast;
        }

        DisplayNode render(NodeId id, int depth) {
            AstNode node = ast.resolve(id);
            if (options.detectCycles() && ancestors.contains(id)) {
                log.warn("Reference cycle at {} ({}), not expanding", id, node.kind());
                return placeholder(id, CYCLE_LABEL, "cycle: " + node.kind());
            }
            if (depth > options.maxDepth()) {
                log.warn("Depth limit {} reached at {}, not expanding", options.maxDepth(), id);
                return placeholder(id, TRUNCATED_LABEL, "depth limit: " + node.kind());
            }

            ancestors.add(id);
            try {
                return switch (Nodes.kindOf(node)) {
                    case MODULE_DECL -> renderModule(id, Nodes.asModuleDecl(node), depth);
                    case TRANSLATION_UNIT -> renderTranslationUnit(id, Nodes.asTranslationUnit(node), depth);
                    case FUNCTION_DECL -> renderFunction(id, Nodes.asFunctionDecl(node), depth);
                    case PRODUCT_TYPE_DECL -> renderProductType(id, Nodes.asProductTypeDecl(node));
                    case PARAMETER_DECL -> renderParameter(id, Nodes.asParameterDecl(node));
                    case MISSING, UNRECOGNIZED -> renderUnknown(id, node);
                };
            } finally {
                ancestors.remove(id);
            }
        }

        private List<DisplayNode> renderAll(List<NodeId> ids, int depth) {
            List<DisplayNode> rendered = new ArrayList<>(ids.size());
            for (NodeId child : ids) {
                rendered.add(render(child, depth));
            }
            return rendered;
        }

        private DisplayNode renderModule(NodeId id, ModuleDecl module, int depth) {
            return new DisplayNode(
                module.baseName(),
                "file-submodule",
                null,
                id,
                renderAll(module.sources(), depth + 1),
                List.of(),
                List.of());
        }

        private DisplayNode renderTranslationUnit(NodeId id, TranslationUnit unit, int depth) {
            String fileUrl = unit.site() != null ? unit.site().fileUrl() : null;
            String label = unit.site() != null ? unit.site().fileName() : UNKNOWN_LABEL;
            return new DisplayNode(
                label,
                "file",
                fileUrl,
                id,
                renderAll(unit.decls(), depth + 1),
                List.of(DisplayAction.HIGHLIGHT_FULL_DECLARATION, DisplayAction.OPEN_SOURCE_FILE),
                List.of());
        }

        private DisplayNode renderFunction(NodeId id, FunctionDecl function, int depth) {
            DisplayNode parameters = new DisplayNode(
                PARAMETERS_LABEL,
                "symbol-property",
                null,
                null,
                renderAll(function.parameters(), depth + 1),
                List.of(),
                List.of());
            return new DisplayNode(
                function.name(),
                "symbol-function",
                null,
                id,
                List.of(parameters),
                List.of(DisplayAction.HIGHLIGHT_FULL_DECLARATION),
                List.of(Decoration.kind(function.kind())));
        }

        private DisplayNode renderProductType(NodeId id, ProductTypeDecl type) {
            return new DisplayNode(
                type.name(),
                "symbol-class",
                null,
                id,
                List.of(),
                List.of(DisplayAction.HIGHLIGHT_FULL_DECLARATION),
                List.of(Decoration.kind(type.kind())));
        }

        private DisplayNode renderParameter(NodeId id, ParameterDecl parameter) {
            String label = parameter.label() != null ? parameter.label() : NO_LABEL;
            return new DisplayNode(
                parameter.identifier() + " (label: " + label + ")",
                "symbol-parameter",
                null,
                id,
                List.of(),
                List.of(DisplayAction.HIGHLIGHT_FULL_DECLARATION),
                List.of(Decoration.kind(parameter.kind())));
        }

        private DisplayNode renderUnknown(NodeId id, AstNode node) {
            log.debug("Rendering {} at {} as unknown", node.kind(), id);
            return placeholder(id, UNKNOWN_LABEL, node.kind());
        }

        private DisplayNode placeholder(NodeId id, String label, String diagnostic) {
            return new DisplayNode(
                label,
                "question",
                null,
                id,
                List.of(),
                List.of(),
                List.of(Decoration.diagnostic(diagnostic)));
        }
    }
}
