package com.graphid.adapter.ir;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;

/**
 * Sorts and serializes the IrRoot to graph_ir.json.
 * Produces deterministic output by sorting all arrays before writing.
 */
public class IrSerializer {

    public static final String IR_FILE = "graph_ir.json";
    public static final String METADATA_FILE = "metadata.json";

    private static final Gson GSON = new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create();

    public static class SerializerException extends RuntimeException {
        public SerializerException(String msg, Throwable cause) { super(msg, cause); }
    }

    /**
     * Writes {@code root} to {@code outputDir/graph_ir.json} with arrays sorted for determinism.
     * Also writes {@code outputDir/metadata.json} with project and adapter info.
     *
     * @param root        IR root to write
     * @param outputDir   directory to write into (created if absent)
     * @param projectName name for metadata.json
     * @return path of the written graph_ir.json
     */
    public Path write(IrModel.IrRoot root, Path outputDir, String projectName) {
        try {
            Files.createDirectories(outputDir);
        } catch (IOException e) {
            throw new SerializerException("Could not create output directory: " + outputDir, e);
        }

        sort(root);

        Path irPath = outputDir.resolve(IR_FILE);
        try (Writer w = Files.newBufferedWriter(irPath, StandardCharsets.UTF_8)) {
            GSON.toJson(root, w);
        } catch (IOException e) {
            throw new SerializerException("Failed to write " + IR_FILE + ": " + e.getMessage(), e);
        }
        System.err.println("[graphid] " + IR_FILE + " written: " + irPath);

        var meta = new Metadata(projectName, root.language, root.adapterVersion,
                size(root.files), size(root.nodes), size(root.edges), Instant.now().toString());
        Path metaPath = outputDir.resolve(METADATA_FILE);
        try (Writer w = Files.newBufferedWriter(metaPath, StandardCharsets.UTF_8)) {
            GSON.toJson(meta, w);
        } catch (IOException e) {
            throw new SerializerException("Failed to write " + METADATA_FILE + ": " + e.getMessage(), e);
        }
        System.err.println("[graphid] " + METADATA_FILE + " written: " + metaPath);
        return irPath;
    }

    /** Renders the IR as JSON without touching the file system. Arrays are sorted first. */
    public String toJson(IrModel.IrRoot root) {
        sort(root);
        return GSON.toJson(root);
    }

    // Copy to mutable lists and sort for determinism
    private void sort(IrModel.IrRoot root) {
        if (root.files != null) {
            root.files = new ArrayList<>(root.files);
            root.files.sort(Comparator.comparing(f -> f.path));
        }
        if (root.nodes != null) {
            root.nodes = new ArrayList<>(root.nodes);
            root.nodes.sort(Comparator.comparing(n -> n.id));
        }
        if (root.edges != null) {
            root.edges = new ArrayList<>(root.edges);
            root.edges.sort(Comparator.comparing((IrModel.IrEdge e) -> e.src)
                    .thenComparing(e -> e.type)
                    .thenComparing(e -> e.dst));
        }
        if (root.callArguments != null) {
            root.callArguments = new ArrayList<>(root.callArguments);
            root.callArguments.sort(Comparator.comparing((IrModel.IrCallArgument a) -> a.callId)
                    .thenComparingInt(a -> a.argIndex));
        }
        if (root.failedFiles != null) {
            root.failedFiles = new ArrayList<>(root.failedFiles);
            root.failedFiles.sort(Comparator.comparing(f -> f.path));
        }
    }

    private static int size(java.util.List<?> list) {
        return list != null ? list.size() : 0;
    }

    /** Simple metadata record for Gson serialization. */
    private record Metadata(
            String projectName,
            String language,
            String adapterVersion,
            int fileCount,
            int nodeCount,
            int edgeCount,
            String timestamp
    ) {}
}
