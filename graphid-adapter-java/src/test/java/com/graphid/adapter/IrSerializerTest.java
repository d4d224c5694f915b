package com.graphid.adapter;

import com.graphid.adapter.ir.IrModel;
import com.graphid.adapter.ir.IrSerializer;
import com.google.gson.Gson;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.FileReader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class IrSerializerTest {

    private IrModel.IrRoot makeRoot() {
        IrModel.IrNode n1 = new IrModel.IrNode();
        n1.id = "b.js->FUNCTION->z";
        n1.type = "FUNCTION";
        n1.name = "z";

        IrModel.IrNode n2 = new IrModel.IrNode();
        n2.id = "a.js->FUNCTION->a";
        n2.type = "FUNCTION";
        n2.name = "a";
        n2.scopePath = List.of("A", "run()");

        IrModel.IrEdge edge1 = new IrModel.IrEdge();
        edge1.type = "CONTAINS";
        edge1.src = "b.js->FUNCTION->z";
        edge1.dst = "a.js->FUNCTION->a";

        IrModel.IrEdge edge2 = new IrModel.IrEdge();
        edge2.type = "CONTAINS";
        edge2.src = "a.js->FUNCTION->a";
        edge2.dst = "b.js->FUNCTION->z";

        IrModel.IrRoot root = new IrModel.IrRoot();
        root.irVersion = "0.2";
        root.language = "java";
        root.projectName = "test";
        root.adapterVersion = "0.1.0";
        root.nodes = List.of(n1, n2);  // z before a intentionally
        root.edges = List.of(edge1, edge2);  // z→a before a→z intentionally
        root.callArguments = List.of();
        root.failedFiles = List.of();
        root.files = List.of();
        return root;
    }

    @Test
    void nodesSortedByIdInOutput(@TempDir Path tmp) throws Exception {
        IrSerializer serializer = new IrSerializer();
        serializer.write(makeRoot(), tmp, "test");

        Path irPath = tmp.resolve(IrSerializer.IR_FILE);
        assertTrue(Files.exists(irPath));

        IrModel.IrRoot parsed = new Gson().fromJson(new FileReader(irPath.toFile()), IrModel.IrRoot.class);
        assertEquals("a.js->FUNCTION->a", parsed.nodes.get(0).id, "a.js should come before b.js");
        assertEquals("b.js->FUNCTION->z", parsed.nodes.get(1).id);
    }

    @Test
    void edgesSortedBySourceFirst(@TempDir Path tmp) throws Exception {
        IrSerializer serializer = new IrSerializer();
        serializer.write(makeRoot(), tmp, "test");

        IrModel.IrRoot parsed = new Gson().fromJson(
                new FileReader(tmp.resolve(IrSerializer.IR_FILE).toFile()), IrModel.IrRoot.class);

        assertEquals("a.js->FUNCTION->a", parsed.edges.get(0).src);
        assertEquals("b.js->FUNCTION->z", parsed.edges.get(1).src);
    }

    @Test
    void deterministicOutput(@TempDir Path tmp) throws Exception {
        IrSerializer serializer = new IrSerializer();
        serializer.write(makeRoot(), tmp, "test");
        String content1 = Files.readString(tmp.resolve(IrSerializer.IR_FILE));

        serializer.write(makeRoot(), tmp, "test");
        String content2 = Files.readString(tmp.resolve(IrSerializer.IR_FILE));

        assertEquals(content1, content2, "Identical input should produce identical output");
    }

    @Test
    void jsonUsesSnakeCaseAndKeepsGrammarLiterals() {
        String json = new IrSerializer().toJson(makeRoot());
        assertTrue(json.contains("\"ir_version\""));
        assertTrue(json.contains("\"scope_path\""));
        assertTrue(json.contains("\"call_arguments\""));
        // no HTML escaping of '>' in IDs
        assertTrue(json.contains("a.js->FUNCTION->a"));
    }

    @Test
    void transientReferencesAreNotSerialized() {
        IrModel.IrNode target = new IrModel.IrNode();
        target.id = "a.js->CALL->f[in:g]";
        IrModel.IrRoot root = makeRoot();
        root.edges = List.of(IrModel.IrEdge.between("CONTAINS", target, target));

        String json = new IrSerializer().toJson(root);
        assertFalse(json.contains("srcRef"));
        assertFalse(json.contains("dstRef"));
    }

    @Test
    void metadataJsonWrittenWithExpectedFields(@TempDir Path tmp) throws Exception {
        IrSerializer serializer = new IrSerializer();
        serializer.write(makeRoot(), tmp, "my-project");

        Path metaPath = tmp.resolve(IrSerializer.METADATA_FILE);
        assertTrue(Files.exists(metaPath), "metadata.json must be created");

        String metaJson = Files.readString(metaPath);
        assertTrue(metaJson.contains("\"my-project\""), "projectName must be present");
        assertTrue(metaJson.contains("\"java\""), "language must be present");
        assertTrue(metaJson.contains("nodeCount"), "nodeCount must be present");
        assertTrue(metaJson.contains("timestamp"), "timestamp must be present");
    }

    @Test
    void outputDirCreatedIfAbsent(@TempDir Path tmp) throws Exception {
        Path nested = tmp.resolve("a/b/c");
        IrSerializer serializer = new IrSerializer();
        serializer.write(makeRoot(), nested, "test");
        assertTrue(Files.exists(nested.resolve(IrSerializer.IR_FILE)));
    }
}
