package com.astlens.ast;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class AstTest {

    @Test
    void resolvesEveryAddressedNode() {
        Ast ast = SampleAsts.twoModules();
        for (int g = 0; g < ast.groups().size(); g++) {
            for (int o = 0; o < ast.groups().get(g).size(); o++) {
                assertSame(ast.groups().get(g).get(o), ast.resolve(new NodeId(g, o)));
            }
        }
    }

    @Test
    void groupOutOfRangeIsAnError() {
        Ast ast = SampleAsts.singleFunction();
        NodeId id = new NodeId(1, 0);
        NodeIdOutOfRangeException e = assertThrows(NodeIdOutOfRangeException.class, () -> ast.resolve(id));
        assertEquals(id, e.id());
        assertThrows(NodeIdOutOfRangeException.class, () -> ast.resolve(new NodeId(-1, 0)));
    }

    @Test
    void offsetOutOfRangeIsAnError() {
        Ast ast = SampleAsts.singleFunction();
        assertThrows(NodeIdOutOfRangeException.class, () -> ast.resolve(new NodeId(0, 3)));
        assertThrows(NodeIdOutOfRangeException.class, () -> ast.resolve(new NodeId(0, -1)));
        assertFalse(ast.contains(new NodeId(0, 3)));
        assertTrue(ast.contains(new NodeId(0, 2)));
    }

    @Test
    void snapshotIsNotAffectedByItsInputLists() {
        List<AstNode> group = new ArrayList<>(List.of(Missing.INSTANCE));
        List<List<AstNode>> groups = new ArrayList<>(List.of(group));
        Ast ast = new Ast(new ArrayList<>(), groups);

        group.add(Missing.INSTANCE);
        groups.add(List.of());

        assertEquals(1, ast.groups().size());
        assertEquals(1, ast.nodeCount());
        assertThrows(UnsupportedOperationException.class, () -> ast.groups().get(0).add(Missing.INSTANCE));
        assertThrows(UnsupportedOperationException.class, () -> ast.moduleIds().add(new NodeId(0, 0)));
    }

    @Test
    void reachableIdsAreVisitedDepthFirst() {
        Set<NodeId> reachable = SampleAsts.singleFunction().reachableIds();
        assertEquals(List.of(new NodeId(0, 2), new NodeId(0, 1), new NodeId(0, 0)), new ArrayList<>(reachable));
    }

    @Test
    void everyReachableNodeHasAKnownKind() {
        Ast ast = SampleAsts.twoModules();
        Set<NodeId> reachable = ast.reachableIds();
        assertEquals(ast.nodeCount(), reachable.size());
        for (NodeId id : reachable) {
            assertNotNull(Nodes.kindOf(ast.resolve(id)));
        }
    }

    @Test
    void reachableIdsToleratesCycles() {
        // A module that lists itself as a source
        Ast ast = new Ast(List.of(new NodeId(0, 0)),
            List.of(List.of(new ModuleDecl("Loop", false, List.of(new NodeId(0, 0))))));
        assertEquals(Set.of(new NodeId(0, 0)), ast.reachableIds());
    }

    @Test
    void reachableIdsReportsDanglingReference() {
        Ast ast = new Ast(List.of(new NodeId(0, 0)),
            List.of(List.of(new ModuleDecl("M", false, List.of(new NodeId(3, 0))))));
        NodeIdOutOfRangeException e = assertThrows(NodeIdOutOfRangeException.class, ast::reachableIds);
        assertEquals(new NodeId(3, 0), e.id());
    }

    @Test
    void emptySnapshot() {
        Ast ast = Ast.empty();
        assertTrue(ast.moduleIds().isEmpty());
        assertTrue(ast.reachableIds().isEmpty());
        assertEquals(0, ast.nodeCount());
    }
}
