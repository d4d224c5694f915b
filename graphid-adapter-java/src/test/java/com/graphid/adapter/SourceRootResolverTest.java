package com.graphid.adapter;

import com.graphid.adapter.static_analysis.SourceRootResolver;
import com.graphid.adapter.static_analysis.SourceRoots;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

import static org.junit.jupiter.api.Assertions.*;

class SourceRootResolverTest {

    private static final Path FIXTURE_ROOT =
        Paths.get(System.getProperty("user.dir"))
             .getParent()
             .resolve("test-fixtures/inventory-service");

    private final SourceRootResolver resolver = new SourceRootResolver();

    @Test
    void mavenProjectResolvesCorrectSourceRoot() {
        SourceRoots roots = resolver.resolve(FIXTURE_ROOT);
        assertTrue(roots.sourceRoot().endsWith("src/main/java"),
            "Expected source root to end with src/main/java but got: " + roots.sourceRoot());
        assertTrue(Files.isDirectory(roots.sourceRoot()),
            "Source root directory must exist: " + roots.sourceRoot());
        assertEquals("maven", roots.buildTool());
    }

    @Test
    void customSourceDirectoryIsReadFromPom(@TempDir Path tmp) throws IOException {
        Files.writeString(tmp.resolve("pom.xml"), """
            <project>
              <modelVersion>4.0.0</modelVersion>
              <build>
                <sourceDirectory>src/java</sourceDirectory>
              </build>
            </project>
            """);
        SourceRoots roots = resolver.resolve(tmp);
        assertEquals(tmp.toAbsolutePath().normalize().resolve("src/java"), roots.sourceRoot());
    }

    @Test
    void manifestOverrideWins() {
        SourceRoots roots = resolver.resolve(FIXTURE_ROOT, "src/main/java/com/acme");
        assertEquals("manifest", roots.buildTool());
        assertTrue(roots.sourceRoot().endsWith("com/acme"));
    }

    @Test
    void gradleProjectUsesConvention(@TempDir Path tmp) throws IOException {
        Files.writeString(tmp.resolve("build.gradle"), "plugins { id 'java' }\n");
        SourceRoots roots = resolver.resolve(tmp);
        assertEquals("gradle", roots.buildTool());
        assertTrue(roots.sourceRoot().endsWith("src/main/java"));
    }

    @Test
    void noBuildFileThrows(@TempDir Path emptyDir) {
        assertThrows(SourceRootResolver.UnsupportedBuildToolException.class,
            () -> resolver.resolve(emptyDir));
    }
}
