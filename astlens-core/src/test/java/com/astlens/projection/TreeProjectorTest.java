package com.astlens.projection;

import com.astlens.ast.Ast;
import com.astlens.ast.AstNode;
import com.astlens.ast.FunctionDecl;
import com.astlens.ast.Missing;
import com.astlens.ast.ModuleDecl;
import com.astlens.ast.NodeId;
import com.astlens.ast.NodeIdOutOfRangeException;
import com.astlens.ast.SampleAsts;
import com.astlens.ast.SourceRange;
import com.astlens.ast.TranslationUnit;
import com.astlens.ast.UnrecognizedNode;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class TreeProjectorTest {

    private final TreeProjector projector = new TreeProjector();

    @Test
    void projectsModuleUnitFunctionAndParameters() {
        List<DisplayNode> tree = projector.project(SampleAsts.singleFunction());

        assertEquals(1, tree.size());
        DisplayNode module = tree.get(0);
        assertEquals("M", module.label());
        assertEquals(new NodeId(0, 2), module.reference());

        DisplayNode unit = module.child("a.src");
        assertNotNull(unit);
        assertEquals(SampleAsts.A_SRC, unit.tooltip());

        DisplayNode main = unit.child("main");
        assertNotNull(main);
        assertEquals(1, main.children().size());

        DisplayNode parameters = main.child(TreeProjector.PARAMETERS_LABEL);
        assertNotNull(parameters);
        assertTrue(parameters.isSynthetic());
        assertTrue(parameters.children().isEmpty());
    }

    @Test
    void rootsFollowModuleOrder() {
        List<DisplayNode> tree = projector.project(SampleAsts.twoModules());
        assertEquals(List.of("ModuleA", "ModuleB"), tree.stream().map(DisplayNode::label).toList());
    }

    @Test
    void parametersShowIdentifierAndLabel() {
        DisplayNode g = projector.project(SampleAsts.twoModules()).get(1).child("b.src").child("g");
        List<String> labels = g.child(TreeProjector.PARAMETERS_LABEL).children().stream()
            .map(DisplayNode::label)
            .toList();
        assertEquals(List.of("p1 (label: p1)", "i2 (label: p2)", "i3 (label: <none>)"), labels);
    }

    @Test
    void declarationsOfferHighlightAction() {
        DisplayNode moduleA = projector.project(SampleAsts.twoModules()).get(0);
        assertTrue(moduleA.actions().isEmpty());

        DisplayNode unit = moduleA.child("a.src");
        assertEquals(List.of(DisplayAction.HIGHLIGHT_FULL_DECLARATION, DisplayAction.OPEN_SOURCE_FILE), unit.actions());

        DisplayNode type = unit.child("E");
        assertTrue(type.hasAction(DisplayAction.HIGHLIGHT_FULL_DECLARATION));
        assertTrue(type.children().isEmpty());
        assertEquals(List.of(Decoration.kind("ProductTypeDecl")), type.decorations());
    }

    @Test
    void missingNodeRendersAsUnknownWithItsTag() {
        DisplayNode unit = projector.project(SampleAsts.twoModules()).get(0).child("a.src");
        DisplayNode unknown = unit.children().get(1);

        assertEquals(TreeProjector.UNKNOWN_LABEL, unknown.label());
        assertEquals(new NodeId(0, 1), unknown.reference());
        assertEquals(1, unknown.decorations().size());
        Decoration decoration = unknown.decorations().get(0);
        assertEquals(Decoration.Appearance.DIAGNOSTIC, decoration.appearance());
        assertTrue(decoration.content().contains("missing"));
        assertTrue(unknown.actions().isEmpty());
    }

    @Test
    void unrecognizedKindDoesNotAbortSiblings() {
        DisplayNode unit = projector.project(SampleAsts.twoModules()).get(1).child("b.src");

        assertEquals(List.of("f", "g", TreeProjector.UNKNOWN_LABEL),
            unit.children().stream().map(DisplayNode::label).toList());
        assertEquals(Decoration.diagnostic("BindingDecl"), unit.children().get(2).decorations().get(0));
    }

    @Test
    void anyKindIsAcceptedInAnyPosition() {
        // Module ids pointing at non-modules, a unit listed as a parameter
        SourceRange site = new SourceRange(1, 1, 1, 5, "file:///c.src");
        List<AstNode> nodes = List.of(
            new TranslationUnit(List.of(), site),
            new FunctionDecl("h", site, List.of(new NodeId(0, 0))),
            Missing.INSTANCE,
            new UnrecognizedNode("Future"));
        Ast ast = new Ast(List.of(new NodeId(0, 1), new NodeId(0, 2), new NodeId(0, 3)), List.of(nodes));

        List<DisplayNode> tree = assertDoesNotThrow(() -> projector.project(ast));
        assertEquals(List.of("h", TreeProjector.UNKNOWN_LABEL, TreeProjector.UNKNOWN_LABEL),
            tree.stream().map(DisplayNode::label).toList());
        assertEquals("c.src", tree.get(0).child(TreeProjector.PARAMETERS_LABEL).children().get(0).label());
    }

    @Test
    void unnamedDeclarationsCanBeLookedUp() {
        SourceRange site = new SourceRange(1, 1, 1, 5, "file:///c.src");
        List<AstNode> nodes = List.of(
            new FunctionDecl(null, site, List.of()),
            new TranslationUnit(List.of(new NodeId(0, 0)), site),
            new ModuleDecl(null, false, List.of(new NodeId(0, 1))));
        DisplayNode module = projector.project(new Ast(List.of(new NodeId(0, 2)), List.of(nodes))).get(0);

        DisplayNode unit = module.child("c.src");
        assertNotNull(unit);
        assertNull(unit.child("main"));
        assertSame(unit.children().get(0), unit.child(null));
    }

    @Test
    void danglingReferenceFailsProjection() {
        Ast ast = new Ast(List.of(new NodeId(0, 0)),
            List.of(List.of(new ModuleDecl("M", false, List.of(new NodeId(0, 7))))));
        NodeIdOutOfRangeException e = assertThrows(NodeIdOutOfRangeException.class, () -> projector.project(ast));
        assertEquals(new NodeId(0, 7), e.id());
    }

    @Test
    void cycleRendersPlaceholderInsteadOfRecursing() {
        Ast ast = new Ast(List.of(new NodeId(0, 0)),
            List.of(List.of(new ModuleDecl("Loop", false, List.of(new NodeId(0, 0))))));

        DisplayNode loop = projector.project(ast).get(0);
        assertEquals("Loop", loop.label());
        DisplayNode cycle = loop.children().get(0);
        assertEquals(TreeProjector.CYCLE_LABEL, cycle.label());
        assertTrue(cycle.children().isEmpty());
        assertEquals(Decoration.Appearance.DIAGNOSTIC, cycle.decorations().get(0).appearance());
    }

    @Test
    void sharedChildIsNotACycle() {
        // Both units list the same function
        SourceRange site = new SourceRange(1, 1, 1, 5, "file:///c.src");
        List<AstNode> nodes = List.of(
            new FunctionDecl("shared", site, List.of()),
            new TranslationUnit(List.of(new NodeId(0, 0)), site),
            new TranslationUnit(List.of(new NodeId(0, 0)), site),
            new ModuleDecl("M", false, List.of(new NodeId(0, 1), new NodeId(0, 2))));
        Ast ast = new Ast(List.of(new NodeId(0, 3)), List.of(nodes));

        DisplayNode module = projector.project(ast).get(0);
        for (DisplayNode unit : module.children()) {
            assertEquals("shared", unit.children().get(0).label());
        }
    }

    @Test
    void depthLimitTruncates() {
        TreeProjector shallow = new TreeProjector(ProjectionOptions.defaults().withMaxDepth(2));
        DisplayNode module = shallow.project(SampleAsts.singleFunction()).get(0);
        DisplayNode unit = module.child("a.src");
        assertNotNull(unit);
        DisplayNode truncated = unit.children().get(0);
        assertEquals(TreeProjector.TRUNCATED_LABEL, truncated.label());
        assertEquals(new NodeId(0, 0), truncated.reference());
    }

    @Test
    void invalidDepthIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new ProjectionOptions(0, true));
    }

    @Test
    void emptySnapshotProjectsToNothing() {
        assertEquals(List.of(), projector.project(Ast.empty()));
    }
}
