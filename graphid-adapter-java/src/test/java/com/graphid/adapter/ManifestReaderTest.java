package com.graphid.adapter;

import com.graphid.adapter.manifest.ManifestConfig;
import com.graphid.adapter.manifest.ManifestReader;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ManifestReaderTest {

    private final ManifestReader reader = new ManifestReader();

    @Test
    void roundTrip(@TempDir Path tmp) throws IOException {
        String json = """
            {
              "project_name": "inventory-service",
              "source_root": "app/src",
              "include": ["com/acme/inventory/model"],
              "parallelism": 4,
              "output_dir": "/tmp/out"
            }
            """;
        Path manifest = tmp.resolve("manifest.json");
        Files.writeString(manifest, json);

        ManifestConfig config = reader.read(manifest);
        assertEquals("inventory-service", config.getProjectName());
        assertEquals("app/src", config.getSourceRoot());
        assertEquals(List.of("com/acme/inventory/model"), config.getInclude());
        assertEquals(4, config.getParallelism());
        assertEquals("/tmp/out", config.getOutputDir());
    }

    @Test
    void missingOptionalFieldsUseDefaults(@TempDir Path tmp) throws IOException {
        Path manifest = tmp.resolve("manifest.json");
        Files.writeString(manifest, "{ \"project_name\": \"test\" }");

        ManifestConfig config = reader.read(manifest);
        assertNotNull(config.getInclude());
        assertTrue(config.getInclude().isEmpty());
        assertEquals(1, config.getParallelism());
        assertNull(config.getSourceRoot());
    }

    @Test
    void nonPositiveParallelismFallsBackToOne(@TempDir Path tmp) throws IOException {
        Path manifest = tmp.resolve("manifest.json");
        Files.writeString(manifest, "{ \"parallelism\": 0 }");
        assertEquals(1, reader.read(manifest).getParallelism());
    }

    @Test
    void withParallelismKeepsOtherFields(@TempDir Path tmp) throws IOException {
        Path manifest = tmp.resolve("manifest.json");
        Files.writeString(manifest, "{ \"project_name\": \"p\", \"parallelism\": 2 }");

        ManifestConfig copy = reader.read(manifest).withParallelism(8);
        assertEquals("p", copy.getProjectName());
        assertEquals(8, copy.getParallelism());
    }

    @Test
    void fileNotFoundThrowsManifestReadException() {
        Path missing = Path.of("/tmp/does-not-exist-manifest.json");
        assertThrows(ManifestReader.ManifestReadException.class, () -> reader.read(missing));
    }

    @Test
    void emptyFileThrowsManifestReadException(@TempDir Path tmp) throws IOException {
        Path empty = tmp.resolve("empty.json");
        Files.writeString(empty, "");
        assertThrows(ManifestReader.ManifestReadException.class, () -> reader.read(empty));
    }

    @Test
    void malformedJsonThrowsManifestReadException(@TempDir Path tmp) throws IOException {
        Path broken = tmp.resolve("broken.json");
        Files.writeString(broken, "{ \"project_name\": ");
        assertThrows(ManifestReader.ManifestReadException.class, () -> reader.read(broken));
    }
}
