package com.graphid.adapter.static_analysis;

import com.graphid.adapter.id.SemanticId;
import com.graphid.adapter.ir.IrModel.*;
import com.graphid.adapter.manifest.ManifestConfig;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Orchestrates the full static analysis pass over a project.
 *
 * Files are analyzed independently, optionally on a fixed thread pool, and merged back in
 * path order, so the result does not depend on the degree of parallelism. A file that cannot
 * be read, parsed or analyzed is reported and skipped.
 */
public class ProjectAnalyzer {

    static final String IMPORTS_FROM = "IMPORTS_FROM";

    private final JavaSourceParser parser;
    private final FileAnalyzer fileAnalyzer;

    public ProjectAnalyzer() {
        this(new JavaSourceParser());
    }

    public ProjectAnalyzer(JavaSourceParser parser) {
        this.parser = parser;
        this.fileAnalyzer = new FileAnalyzer(parser);
    }

    public StaticIr analyze(Path projectRoot, ManifestConfig manifest) {
        // 1. Resolve source root
        SourceRoots roots = new SourceRootResolver().resolve(projectRoot, manifest.getSourceRoot());

        // 2. Collect files
        List<Path> sources = parser.collectSourceFiles(roots.sourceRoot(), manifest.getInclude());
        System.err.println("[graphid] " + sources.size() + " source files under " + roots.sourceRoot()
                + " (" + roots.buildTool() + ")");

        // 3. Analyze each file
        List<FileOutcome> outcomes = analyzeAll(roots.projectRoot(), sources, manifest.getParallelism());

        // 4. Merge in path order
        List<IrFile> files = new ArrayList<>();
        List<IrNode> nodes = new ArrayList<>();
        List<IrEdge> edges = new ArrayList<>();
        List<IrCallArgument> callArguments = new ArrayList<>();
        List<IrFailedFile> failedFiles = new ArrayList<>();
        List<FileAnalysis> analyses = new ArrayList<>();

        for (FileOutcome outcome : outcomes) {
            if (outcome.analysis() == null) {
                IrFailedFile failed = new IrFailedFile();
                failed.path = outcome.path();
                failed.reason = outcome.error();
                failedFiles.add(failed);
                continue;
            }
            FileAnalysis analysis = outcome.analysis();
            analyses.add(analysis);
            files.add(analysis.file());
            nodes.addAll(analysis.nodes());
            edges.addAll(analysis.edges());
            callArguments.addAll(analysis.callArguments());
        }

        // 5. Imports that leave the project
        edges.addAll(linkExternalImports(analyses));

        return new StaticIr(files, nodes, edges, callArguments, failedFiles);
    }

    private List<FileOutcome> analyzeAll(Path projectRoot, List<Path> sources, int parallelism) {
        if (parallelism <= 1 || sources.size() <= 1) {
            List<FileOutcome> outcomes = new ArrayList<>(sources.size());
            for (Path source : sources) {
                outcomes.add(analyzeOne(projectRoot, source));
            }
            return outcomes;
        }

        ExecutorService pool = Executors.newFixedThreadPool(Math.min(parallelism, sources.size()));
        try {
            List<Future<FileOutcome>> futures = new ArrayList<>(sources.size());
            for (Path source : sources) {
                futures.add(pool.submit(() -> analyzeOne(projectRoot, source)));
            }
            List<FileOutcome> outcomes = new ArrayList<>(sources.size());
            for (Future<FileOutcome> future : futures) {
                outcomes.add(future.get());
            }
            return outcomes;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while analyzing sources", e);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Analysis task failed", e.getCause());
        } finally {
            pool.shutdownNow();
        }
    }

    private FileOutcome analyzeOne(Path projectRoot, Path source) {
        String relativePath = relativize(projectRoot, source);
        try {
            String text = Files.readString(source, StandardCharsets.UTF_8);
            return new FileOutcome(relativePath, fileAnalyzer.analyze(text, relativePath), null);
        } catch (IOException | JavaSourceParser.SourceParseException e) {
            System.err.println("[graphid] WARNING: skipping " + relativePath + ": " + e.getMessage());
            return new FileOutcome(relativePath, null, e.getMessage());
        } catch (RuntimeException e) {
            String reason = e.getClass().getSimpleName() + ": " + e.getMessage();
            System.err.println("[graphid] WARNING: analysis failed for " + relativePath + ": " + reason);
            return new FileOutcome(relativePath, null, reason);
        }
    }

    /**
     * One IMPORTS_FROM edge per module and imported package that no analyzed file declares.
     */
    private List<IrEdge> linkExternalImports(List<FileAnalysis> analyses) {
        Set<String> projectPackages = new HashSet<>();
        for (FileAnalysis analysis : analyses) {
            if (analysis.file().packageName != null) projectPackages.add(analysis.file().packageName);
        }

        List<IrEdge> edges = new ArrayList<>();
        for (FileAnalysis analysis : analyses) {
            Set<String> linked = new LinkedHashSet<>();
            for (ImportRef imp : analysis.imports()) {
                if (isProjectImport(imp.name(), projectPackages)) continue;
                linked.add(imp.packageName());
            }
            for (String pkg : linked) {
                IrEdge edge = new IrEdge();
                edge.type = IMPORTS_FROM;
                edge.src = analysis.module().id;
                edge.dst = SemanticId.externalModule(pkg);
                edges.add(edge);
            }
        }
        return edges;
    }

    private static boolean isProjectImport(String name, Set<String> projectPackages) {
        for (String pkg : projectPackages) {
            if (name.equals(pkg) || name.startsWith(pkg + ".")) return true;
        }
        return false;
    }

    private static String relativize(Path projectRoot, Path source) {
        return projectRoot.toAbsolutePath().relativize(source.toAbsolutePath()).toString().replace('\\', '/');
    }

    private record FileOutcome(String path, FileAnalysis analysis, String error) {}
}
