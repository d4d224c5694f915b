package com.graphid.adapter;

import com.graphid.adapter.ir.IrAssembler;
import com.graphid.adapter.ir.IrModel;
import com.graphid.adapter.ir.IrSerializer;
import com.graphid.adapter.manifest.ManifestConfig;
import com.graphid.adapter.manifest.ManifestReader;
import com.graphid.adapter.static_analysis.ProjectAnalyzer;
import com.graphid.adapter.static_analysis.StaticIr;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Entry point for the graphid-adapter-java command line.
 *
 * Usage:
 *   java -jar graphid-adapter-java.jar analyze \
 *     --manifest    <path-to-manifest.json> \
 *     --output      <output-dir> \
 *     [--parallelism <n>]
 */
public class AnalyzerMain {

    public static void main(String[] args) {
        try {
            run(args);
            System.exit(0);
        } catch (UsageException e) {
            System.err.println("[graphid] ERROR: " + e.getMessage());
            System.err.println("Usage: java -jar graphid-adapter-java.jar analyze " +
                               "--manifest <path> --output <dir> [--parallelism <n>]");
            System.exit(2);
        } catch (Exception e) {
            System.err.println("[graphid] FATAL: " + e.getMessage());
            System.exit(1);
        }
    }

    static Path run(String[] args) {
        if (args.length == 0) {
            throw new UsageException("No subcommand specified");
        }
        if (!args[0].equals("analyze")) {
            throw new UsageException("Unknown subcommand: " + args[0]);
        }

        // Parse flags
        String manifestPath = null;
        String outputDir = null;
        Integer parallelism = null;

        for (int i = 1; i < args.length; i++) {
            switch (args[i]) {
                case "--manifest"    -> manifestPath = requireNext(args, i++, "--manifest");
                case "--output"      -> outputDir    = requireNext(args, i++, "--output");
                case "--parallelism" -> parallelism  = parsePositive(requireNext(args, i++, "--parallelism"));
                default -> throw new UsageException("Unknown flag: " + args[i]);
            }
        }

        if (manifestPath == null) throw new UsageException("--manifest is required");

        Path manifest = Paths.get(manifestPath);

        // 1. Read manifest
        System.err.println("[graphid] Reading manifest: " + manifest);
        ManifestConfig config = new ManifestReader().read(manifest);
        if (parallelism != null) {
            config = config.withParallelism(parallelism);
        }

        // Project root = directory containing manifest.json
        Path projectRoot = manifest.toAbsolutePath().getParent();
        String projectName = config.getProjectName() != null
                ? config.getProjectName()
                : projectRoot.getFileName().toString();

        if (outputDir == null) outputDir = config.getOutputDir();
        if (outputDir == null) throw new UsageException("--output is required (or output_dir in the manifest)");
        Path output = projectRoot.resolve(outputDir);

        // 2. Static analysis
        System.err.println("[graphid] Analyzing: " + projectRoot);
        StaticIr staticIr = new ProjectAnalyzer().analyze(projectRoot, config);
        System.err.println("[graphid] Analysis complete: "
                + staticIr.files().size() + " files, "
                + staticIr.nodes().size() + " nodes, "
                + staticIr.edges().size() + " edges, "
                + staticIr.failedFiles().size() + " failed");

        // 3. Assemble
        IrModel.IrRoot root = new IrAssembler().assemble(staticIr, projectName, projectRoot.toString());

        // 4. Serialize
        System.err.println("[graphid] Writing output to: " + output);
        Path written = new IrSerializer().write(root, output, projectName);

        System.err.println("[graphid] Done.");
        return written;
    }

    private static String requireNext(String[] args, int i, String flag) {
        if (i + 1 >= args.length) {
            throw new UsageException(flag + " requires an argument");
        }
        return args[i + 1];
    }

    private static int parsePositive(String value) {
        int n;
        try {
            n = Integer.parseInt(value);
        } catch (NumberFormatException e) {
            n = 0;
        }
        if (n <= 0) throw new UsageException("--parallelism must be a positive integer: " + value);
        return n;
    }

    static class UsageException extends RuntimeException {
        UsageException(String msg) { super(msg); }
    }
}
