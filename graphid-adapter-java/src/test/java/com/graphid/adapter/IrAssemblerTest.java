package com.graphid.adapter;

import com.graphid.adapter.id.SemanticId;
import com.graphid.adapter.ir.IrAssembler;
import com.graphid.adapter.ir.IrModel;
import com.graphid.adapter.static_analysis.StaticIr;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class IrAssemblerTest {

    private static IrModel.IrNode node(String id) {
        IrModel.IrNode node = new IrModel.IrNode();
        node.id = id;
        node.type = "FUNCTION";
        node.name = id;
        return node;
    }

    private static IrModel.IrEdge edge(String type, String src, String dst) {
        IrModel.IrEdge edge = new IrModel.IrEdge();
        edge.type = type;
        edge.src = src;
        edge.dst = dst;
        return edge;
    }

    private static StaticIr staticIr(List<IrModel.IrNode> nodes, List<IrModel.IrEdge> edges) {
        return new StaticIr(List.of(), nodes, edges, List.of(), List.of());
    }

    @Test
    void duplicateNodeKeepsFirstOccurrence() {
        IrModel.IrNode first = node("a.js->FUNCTION->g");
        IrModel.IrNode second = node("a.js->FUNCTION->g");
        second.line = 99;

        IrModel.IrRoot root = new IrAssembler().assemble(staticIr(List.of(first, second), List.of()), "p", "/tmp/p");

        assertEquals(1, root.nodes.size());
        assertSame(first, root.nodes.get(0));
    }

    @Test
    void pseudoNodesAreMaterializedOnce() {
        IrModel.IrNode a = node("a.js->CALL->print[in:g]");
        IrModel.IrNode b = node("b.js->CALL->print[in:g]");
        List<IrModel.IrEdge> edges = List.of(
            edge("WRITES_TO", a.id, SemanticId.stdio()),
            edge("WRITES_TO", b.id, SemanticId.stdio()),
            edge("IMPORTS_FROM", a.id, SemanticId.externalModule("java.util")));

        IrModel.IrRoot root = new IrAssembler().assemble(staticIr(List.of(a, b), edges), "p", "/tmp/p");

        List<IrModel.IrNode> pseudo = root.nodes.stream()
            .filter(n -> SemanticId.isPseudoNode(n.id))
            .collect(Collectors.toList());
        assertEquals(2, pseudo.size());
        assertEquals(SemanticId.SINGLETON_TYPE, pseudo.get(0).type);
        assertEquals(SemanticId.EXTERNAL_MODULE_TYPE, pseudo.get(1).type);
        assertEquals("java.util", pseudo.get(1).name);
        assertEquals(3, root.edges.size());
    }

    @Test
    void danglingAndRepeatedEdgesAreDropped() {
        IrModel.IrNode g = node("a.js->FUNCTION->g");
        IrModel.IrNode h = node("a.js->FUNCTION->h");
        List<IrModel.IrEdge> edges = List.of(
            edge("CONTAINS", g.id, h.id),
            edge("CONTAINS", g.id, h.id),
            edge("CONTAINS", g.id, "a.js->FUNCTION->missing"));

        IrModel.IrRoot root = new IrAssembler().assemble(staticIr(List.of(g, h), edges), "p", "/tmp/p");

        assertEquals(1, root.edges.size());
    }

    @Test
    void rootCarriesProjectInfo() {
        IrModel.IrRoot root = new IrAssembler().assemble(staticIr(List.of(), List.of()), "inventory", "/repo");
        assertEquals(IrAssembler.IR_VERSION, root.irVersion);
        assertEquals("java", root.language);
        assertEquals("inventory", root.projectName);
        assertEquals("/repo", root.repoRoot);
        assertEquals(IrAssembler.ADAPTER_VERSION, root.adapterVersion);
    }
}
