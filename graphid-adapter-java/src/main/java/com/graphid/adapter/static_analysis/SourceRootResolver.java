package com.graphid.adapter.static_analysis;

import org.apache.maven.model.Model;
import org.apache.maven.model.io.xpp3.MavenXpp3Reader;
import org.codehaus.plexus.util.xml.pull.XmlPullParserException;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Resolves the main source root of a Maven or Gradle project.
 */
public class SourceRootResolver {

    static final String DEFAULT_SOURCE_DIR = "src/main/java";

    public static class UnsupportedBuildToolException extends RuntimeException {
        public UnsupportedBuildToolException(String message) { super(message); }
    }

    /**
     * Detect build tool and resolve the source root.
     *
     * @param projectRoot path to the project root directory
     * @param override    source root from the manifest, relative to the project root; may be null
     */
    public SourceRoots resolve(Path projectRoot, String override) {
        Path root = projectRoot.toAbsolutePath().normalize();
        if (override != null && !override.isBlank()) {
            return new SourceRoots(root, root.resolve(override).normalize(), "manifest");
        }

        Path pomFile = root.resolve("pom.xml");
        if (Files.exists(pomFile)) {
            return new SourceRoots(root, root.resolve(mavenSourceDir(pomFile)).normalize(), "maven");
        }
        if (Files.exists(root.resolve("build.gradle")) || Files.exists(root.resolve("build.gradle.kts"))) {
            // Gradle: use standard convention; no build script evaluation
            return new SourceRoots(root, root.resolve(DEFAULT_SOURCE_DIR), "gradle");
        }
        throw new UnsupportedBuildToolException(
            "No pom.xml or build.gradle found in: " + root +
            ". Supported build tools: Maven, Gradle. Set source_root in the manifest otherwise."
        );
    }

    public SourceRoots resolve(Path projectRoot) {
        return resolve(projectRoot, null);
    }

    // Custom <sourceDirectory> from pom.xml, or the Maven default
    private String mavenSourceDir(Path pomFile) {
        try (Reader reader = Files.newBufferedReader(pomFile, StandardCharsets.UTF_8)) {
            Model model = new MavenXpp3Reader().read(reader);
            if (model.getBuild() != null && model.getBuild().getSourceDirectory() != null) {
                return model.getBuild().getSourceDirectory();
            }
        } catch (IOException | XmlPullParserException e) {
            System.err.println("[graphid] Warning: could not parse pom.xml, using default source root: " + e.getMessage());
        }
        return DEFAULT_SOURCE_DIR;
    }
}
