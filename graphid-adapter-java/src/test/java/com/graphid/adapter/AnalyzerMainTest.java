package com.graphid.adapter;

import com.graphid.adapter.ir.IrModel;
import com.graphid.adapter.ir.IrSerializer;
import com.google.gson.Gson;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

import static org.junit.jupiter.api.Assertions.*;

class AnalyzerMainTest {

    private static final Path FIXTURE_MANIFEST =
        Paths.get(System.getProperty("user.dir"))
             .getParent()
             .resolve("test-fixtures/inventory-service/manifest.json");

    @Test
    void noArgsThrowsUsageException() {
        assertThrows(AnalyzerMain.UsageException.class, () -> AnalyzerMain.run(new String[]{}));
    }

    @Test
    void unknownSubcommandThrowsUsageException() {
        assertThrows(AnalyzerMain.UsageException.class,
                () -> AnalyzerMain.run(new String[]{"unknown-cmd"}));
    }

    @Test
    void missingManifestFlagThrowsUsageException() {
        assertThrows(AnalyzerMain.UsageException.class,
                () -> AnalyzerMain.run(new String[]{"analyze", "--output", "/tmp"}));
    }

    @Test
    void flagWithoutValueThrowsUsageException() {
        assertThrows(AnalyzerMain.UsageException.class,
                () -> AnalyzerMain.run(new String[]{"analyze", "--manifest"}));
    }

    @Test
    void unknownFlagThrowsUsageException() {
        assertThrows(AnalyzerMain.UsageException.class,
                () -> AnalyzerMain.run(new String[]{"analyze", "--foo", "bar"}));
    }

    @Test
    void invalidParallelismThrowsUsageException() {
        assertThrows(AnalyzerMain.UsageException.class,
                () -> AnalyzerMain.run(new String[]{"analyze", "--manifest", "m.json", "--parallelism", "zero"}));
        assertThrows(AnalyzerMain.UsageException.class,
                () -> AnalyzerMain.run(new String[]{"analyze", "--manifest", "m.json", "--parallelism", "-1"}));
    }

    @Test
    void missingOutputEverywhereThrowsUsageException(@TempDir Path tmp) throws IOException {
        Path manifest = tmp.resolve("manifest.json");
        Files.writeString(manifest, "{ \"project_name\": \"no-output\" }");
        assertThrows(AnalyzerMain.UsageException.class,
                () -> AnalyzerMain.run(new String[]{"analyze", "--manifest", manifest.toString()}));
    }

    @Test
    void analyzeWritesGraphForFixture(@TempDir Path tmp) throws IOException {
        Path written = AnalyzerMain.run(new String[]{
            "analyze", "--manifest", FIXTURE_MANIFEST.toString(), "--output", tmp.toString(), "--parallelism", "3"});

        assertEquals(tmp.resolve(IrSerializer.IR_FILE), written);
        assertTrue(Files.exists(tmp.resolve(IrSerializer.METADATA_FILE)));

        IrModel.IrRoot root = new Gson().fromJson(Files.readString(written), IrModel.IrRoot.class);
        assertEquals("inventory-service", root.projectName);
        assertEquals(7, root.files.size());
        assertTrue(root.nodes.stream().anyMatch(n -> n.id.equals("net:stdio->__stdio__")));
        assertTrue(root.nodes.stream().anyMatch(n -> n.id.equals("EXTERNAL_MODULE->java.util")));
    }
}
