package com.graphid.adapter.static_analysis;

import java.nio.file.Path;

/**
 * Result of source root resolution.
 */
public record SourceRoots(
    Path projectRoot,   // absolute path of the analyzed project
    Path sourceRoot,    // absolute path to src/main/java (or equivalent)
    String buildTool    // "maven", "gradle" or "manifest"
) {}
