package com.graphid.adapter.static_analysis;

import com.github.javaparser.ast.CompilationUnit;
import com.graphid.adapter.id.CollisionResolver;
import com.graphid.adapter.id.CrossReferenceFixup;
import com.graphid.adapter.id.IdGenerator;
import com.graphid.adapter.ir.IrModel.IrEdge;
import com.graphid.adapter.ir.IrModel.IrFile;
import com.graphid.adapter.ir.IrModel.IrNode;
import com.graphid.adapter.scope.ScopeResolver;
import com.graphid.adapter.scope.ScopeTracker;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Turns one source file into nodes, edges and call arguments with final IDs.
 *
 * Steps, in order: traversal (provisional IDs), collision resolution, binding of name
 * references against full scope paths, cross-reference fixup, uniqueness check.
 * All state is created per call, so one instance can serve several threads.
 */
public class FileAnalyzer {

    private final JavaSourceParser parser;
    private final CollisionResolver collisionResolver = new CollisionResolver();
    private final CrossReferenceFixup fixup = new CrossReferenceFixup();

    public FileAnalyzer() {
        this(new JavaSourceParser());
    }

    public FileAnalyzer(JavaSourceParser parser) {
        this.parser = parser;
    }

    /**
     * @param relativePath path relative to the project root, forward slashes; becomes the
     *                     file segment of every ID
     * @throws JavaSourceParser.SourceParseException if the source does not parse
     */
    public FileAnalysis analyze(String source, String relativePath) {
        CompilationUnit cu = parser.parse(source, relativePath);

        // 1. Traverse with one shared generator
        ScopeTracker scopes = new ScopeTracker(relativePath);
        IdGenerator ids = new IdGenerator(scopes);
        FileGraph graph = new FileGraph();
        cu.accept(new NodeExtractor(new NodeFactory(ids, graph)), null);
        if (!scopes.isTopLevel()) {
            throw new IllegalStateException("Unbalanced scopes after traversal of " + relativePath);
        }

        // 2. Final IDs for pending nodes
        int disambiguated = collisionResolver.resolve(ids.getPendingNodes(), ids.getReservedIds());

        // 3. Bind names to declarations
        bindReferences(graph);

        // 4. Copy final IDs into edges and call arguments
        fixup.apply(graph.edges);
        fixup.apply(graph.callArguments);

        checkUniqueness(graph.nodes, relativePath);

        IrFile file = new IrFile();
        file.path = relativePath;
        file.language = "java";
        file.hash = "sha256:" + sha256(source);
        file.moduleId = graph.module.id;
        file.packageName = graph.packageName;

        return new FileAnalysis(file, graph.module, graph.nodes, graph.edges,
                graph.callArguments, graph.imports, disambiguated);
    }

    private void bindReferences(FileGraph graph) {
        ScopeResolver<IrNode> resolver = new ScopeResolver<>(graph.declarations);
        for (NameReference reference : graph.references) {
            resolver.resolve(reference.name(), reference.scopePath(), reference.declarationsBefore())
                .ifPresent(declaration -> {
                    graph.edges.add(IrEdge.between(reference.edgeType(), reference.from(), declaration));
                    if (reference.argument() != null) {
                        reference.argument().bindValue(declaration);
                    }
                });
        }
    }

    private void checkUniqueness(List<IrNode> nodes, String relativePath) {
        Set<String> seen = new HashSet<>();
        for (IrNode node : nodes) {
            if (!seen.add(node.id)) {
                System.err.println("[graphid] WARNING: Duplicate node ID in " + relativePath + ": " + node.id);
            }
        }
    }

    static String sha256(String source) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(source.getBytes(StandardCharsets.UTF_8));
            StringBuilder hex = new StringBuilder(hash.length * 2);
            for (byte b : hash) {
                hex.append(String.format("%02x", b));
            }
            return hex.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
