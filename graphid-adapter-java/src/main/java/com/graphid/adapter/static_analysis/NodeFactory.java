package com.graphid.adapter.static_analysis;

import com.github.javaparser.ast.Node;
import com.graphid.adapter.id.ContentHashHints;
import com.graphid.adapter.id.IdGenerator;
import com.graphid.adapter.id.NodeType;
import com.graphid.adapter.ir.IrModel.IrEdge;
import com.graphid.adapter.ir.IrModel.IrNode;
import com.graphid.adapter.scope.ScopeTracker;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Creates graph nodes for one file. Every node gets its ID from the file's single
 * {@link IdGenerator} and a CONTAINS edge from the innermost open container.
 */
class NodeFactory {

    static final String CONTAINS = "CONTAINS";

    private final IdGenerator ids;
    private final FileGraph graph;
    private final Deque<IrNode> containers = new ArrayDeque<>();

    NodeFactory(IdGenerator ids, FileGraph graph) {
        this.ids = ids;
        this.graph = graph;
    }

    ScopeTracker scopes() {
        return ids.getScopes();
    }

    FileGraph graph() {
        return graph;
    }

    IrNode create(NodeType type, String name, ContentHashHints hints, Node astNode) {
        IrNode node = new IrNode();
        node.type = type.name();
        node.name = name;
        node.file = ids.getFile();
        node.namedParent = ids.getScopes().getNamedParent();
        astNode.getBegin().ifPresent(pos -> {
            node.line = pos.line;
            node.column = pos.column;
        });
        ids.generate(type, name, hints, node);

        graph.nodes.add(node);
        if (type.isDeclaration()) {
            // resolution needs the full path, not just the named parent
            node.scopePath = ids.getScopes().getScopePath();
            graph.declarations.add(node);
        }
        IrNode container = containers.peek();
        if (container != null) {
            graph.edges.add(IrEdge.between(CONTAINS, container, node));
        }
        return node;
    }

    /** Locals and parameters, visible only after their declaration. */
    IrNode createLocal(NodeType type, String name, ContentHashHints hints, Node astNode) {
        IrNode node = create(type, name, hints, astNode);
        node.declarationOrder = graph.declarations.size() - 1;
        return node;
    }

    void pushContainer(IrNode node) {
        containers.push(node);
    }

    void popContainer() {
        containers.pop();
    }
}
