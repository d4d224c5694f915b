package com.graphid.adapter.ir;

import com.graphid.adapter.id.ParsedSemanticId;
import com.graphid.adapter.id.SemanticId;
import com.graphid.adapter.static_analysis.StaticIr;

import java.util.*;

/**
 * Assembles static analysis output into a ready-to-serialize IrRoot.
 *
 * Nodes are deduplicated by ID (first occurrence wins), edges by type, source and destination.
 * Pseudo-nodes referenced by edges (stdio, external modules) are materialized once each.
 */
public class IrAssembler {

    public static final String IR_VERSION = "0.2";
    public static final String ADAPTER_VERSION = "0.1.0";

    /**
     * @param staticIr    output of ProjectAnalyzer
     * @param projectName project name from the manifest
     * @param repoRoot    absolute path to the project root
     */
    public IrModel.IrRoot assemble(StaticIr staticIr, String projectName, String repoRoot) {
        // --- Nodes, first occurrence wins ---
        Map<String, IrModel.IrNode> nodeById = new LinkedHashMap<>();
        for (IrModel.IrNode node : staticIr.nodes()) {
            if (!nodeById.containsKey(node.id)) {
                nodeById.put(node.id, node);
            } else {
                System.err.println("[graphid] WARNING: duplicate node ID ignored: " + node.id);
            }
        }

        // --- Edges, dropping exact repeats and dangling endpoints ---
        List<IrModel.IrEdge> edges = new ArrayList<>();
        Set<String> edgeKeys = new HashSet<>();
        for (IrModel.IrEdge edge : staticIr.edges()) {
            if (SemanticId.isPseudoNode(edge.dst) && !nodeById.containsKey(edge.dst)) {
                pseudoNode(edge.dst).ifPresent(n -> nodeById.put(n.id, n));
            }
            if (!nodeById.containsKey(edge.src) || !nodeById.containsKey(edge.dst)) {
                System.err.println("[graphid] WARNING: edge references unknown node (excluded): "
                        + edge.src + " -> " + edge.dst);
                continue;
            }
            if (edgeKeys.add(edge.type + "|" + edge.src + "|" + edge.dst)) {
                edges.add(edge);
            }
        }

        IrModel.IrRoot root = new IrModel.IrRoot();
        root.irVersion = IR_VERSION;
        root.language = "java";
        root.projectName = projectName;
        root.repoRoot = repoRoot;
        root.adapterVersion = ADAPTER_VERSION;
        root.files = staticIr.files();
        root.nodes = new ArrayList<>(nodeById.values());
        root.edges = edges;
        root.callArguments = staticIr.callArguments();
        root.failedFiles = staticIr.failedFiles();
        return root;
    }

    private Optional<IrModel.IrNode> pseudoNode(String id) {
        Optional<ParsedSemanticId> parsed = SemanticId.parse(id);
        if (parsed.isEmpty()) {
            System.err.println("[graphid] WARNING: malformed pseudo-node ID: " + id);
            return Optional.empty();
        }
        IrModel.IrNode node = new IrModel.IrNode();
        node.id = id;
        node.type = parsed.get().type();
        node.name = parsed.get().name();
        return Optional.of(node);
    }
}
