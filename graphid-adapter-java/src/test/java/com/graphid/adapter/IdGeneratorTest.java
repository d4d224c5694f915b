package com.graphid.adapter;

import com.graphid.adapter.id.CollisionResolver;
import com.graphid.adapter.id.ContentHashHints;
import com.graphid.adapter.id.IdGenerator;
import com.graphid.adapter.id.NodeType;
import com.graphid.adapter.ir.IrModel.IrNode;
import com.graphid.adapter.scope.ScopeTracker;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class IdGeneratorTest {

    private ScopeTracker scopes;
    private IdGenerator ids;

    @BeforeEach
    void setUp() {
        scopes = new ScopeTracker("a.js");
        ids = new IdGenerator(scopes);
    }

    private IrNode generate(NodeType type, String name, ContentHashHints hints) {
        IrNode node = new IrNode();
        ids.generate(type, name, hints, node);
        return node;
    }

    @Test
    void topLevelTypeIsFinalImmediately() {
        IrNode worker = generate(NodeType.CLASS, "Worker", ContentHashHints.EMPTY);

        assertEquals("a.js->CLASS->Worker", worker.id);
        assertTrue(ids.getPendingNodes().isEmpty());
        assertTrue(ids.getReservedIds().contains("a.js->CLASS->Worker"));
    }

    @Test
    void moduleIsFinalImmediately() {
        IrNode module = generate(NodeType.MODULE, "a.js", ContentHashHints.EMPTY);
        assertEquals("a.js->MODULE->a.js", module.id);
        assertTrue(ids.getPendingNodes().isEmpty());
    }

    @Test
    void topLevelFunctionHasNoBrackets() {
        IrNode main = generate(NodeType.FUNCTION, "main", ContentHashHints.builder().arity(0).build());
        new CollisionResolver().resolve(ids.getPendingNodes(), ids.getReservedIds());

        assertEquals("a.js->FUNCTION->main", main.id);
    }

    @Test
    void methodOnClassCarriesClassAsParent() {
        generate(NodeType.CLASS, "Worker", ContentHashHints.EMPTY);
        scopes.enterScope("Worker", "CLASS");
        IrNode run = generate(NodeType.FUNCTION, "run", ContentHashHints.builder().arity(0).build());
        scopes.exitScope();
        new CollisionResolver().resolve(ids.getPendingNodes(), ids.getReservedIds());

        assertEquals("a.js->FUNCTION->run[in:Worker]", run.id);
    }

    @Test
    void nestedTypeIsPending() {
        scopes.enterScope("Outer", "CLASS");
        IrNode inner = generate(NodeType.CLASS, "Inner", ContentHashHints.EMPTY);
        scopes.exitScope();

        assertEquals(1, ids.getPendingNodes().size());
        assertEquals("a.js->CLASS->Inner[in:Outer]", inner.id);
    }

    @Test
    void pendingNodesKeepInsertionOrder() {
        scopes.enterScope("g", "FUNCTION");
        generate(NodeType.CALL, "f", ContentHashHints.EMPTY);
        generate(NodeType.CALL, "f", ContentHashHints.EMPTY);
        scopes.exitScope();

        assertEquals(0, ids.getPendingNodes().get(0).insertionOrder());
        assertEquals(1, ids.getPendingNodes().get(1).insertionOrder());
        assertEquals("a.js->CALL->f[in:g]", ids.getPendingNodes().get(0).baseId());
    }

    @Test
    void anonymousBlocksNeverReachTheId() {
        scopes.enterScope("g", "FUNCTION");
        scopes.enterCountedScope("if");
        scopes.enterCountedScope("lambda");
        IrNode call = generate(NodeType.CALL, "f", ContentHashHints.EMPTY);

        assertEquals("a.js->CALL->f[in:g]", call.id);
        assertFalse(call.id.contains("#"));
    }

    @Test
    void nullHintsAreTreatedAsEmpty() {
        scopes.enterScope("g", "FUNCTION");
        generate(NodeType.CALL, "f", null);
        assertTrue(ids.getPendingNodes().get(0).hints().isEmpty());
    }

    @Test
    void scopeMarkerAlwaysCarriesItsContentHash() {
        scopes.enterScope("g", "FUNCTION");
        IrNode marker = generate(NodeType.SCOPE, "if", ContentHashHints.builder().rhsToken("x").build());

        assertEquals("a.js->SCOPE->if[in:g]", marker.id);  // provisional
        assertTrue(ids.getPendingNodes().get(0).hashRequired());

        new CollisionResolver().resolve(ids.getPendingNodes(), ids.getReservedIds());
        assertTrue(marker.id.startsWith("a.js->SCOPE->if[in:g,h:"), marker.id);
    }
}
