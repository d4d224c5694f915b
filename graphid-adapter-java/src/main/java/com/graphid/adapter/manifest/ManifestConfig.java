package com.graphid.adapter.manifest;

import com.google.gson.annotations.SerializedName;
import java.util.Collections;
import java.util.List;

/**
 * Deserialized form of the manifest.json that describes a project to analyze.
 */
public class ManifestConfig {

    @SerializedName("project_name")
    private String projectName;

    /**
     * Optional source root, relative to the manifest's directory. When absent the source root is
     * taken from the project's build file.
     */
    @SerializedName("source_root")
    private String sourceRoot;

    /** Path prefixes relative to the source root; only matching files are analyzed. Empty means all. */
    @SerializedName("include")
    private List<String> include;

    /** Number of files analyzed concurrently (default: 1). */
    @SerializedName("parallelism")
    private Integer parallelism;

    @SerializedName("output_dir")
    private String outputDir;

    public String getProjectName()    { return projectName; }
    public String getSourceRoot()     { return sourceRoot; }
    public List<String> getInclude()  { return include != null ? include : Collections.emptyList(); }
    public int getParallelism()       { return parallelism != null && parallelism > 0 ? parallelism : 1; }
    public String getOutputDir()      { return outputDir; }

    public static ManifestConfig defaults() {
        return new ManifestConfig();
    }

    public ManifestConfig withParallelism(int parallelism) {
        ManifestConfig copy = new ManifestConfig();
        copy.projectName = projectName;
        copy.sourceRoot = sourceRoot;
        copy.include = include;
        copy.parallelism = parallelism;
        copy.outputDir = outputDir;
        return copy;
    }
}
