package com.graphid.adapter.ir;

import com.google.gson.annotations.SerializedName;
import com.graphid.adapter.id.CrossReference;
import com.graphid.adapter.id.IdTarget;
import com.graphid.adapter.scope.ScopedDeclaration;

import java.util.List;

/**
 * POJOs matching graph IR schema v0.2.
 * Field names use @SerializedName for JSON snake_case mapping; transient fields never reach JSON.
 */
public final class IrModel {

    private IrModel() {}

    public static class IrRoot {
        @SerializedName("ir_version")      public String irVersion;
        @SerializedName("language")        public String language;
        @SerializedName("project_name")    public String projectName;
        @SerializedName("repo_root")       public String repoRoot;
        @SerializedName("adapter_version") public String adapterVersion;
        @SerializedName("files")           public List<IrFile> files;
        @SerializedName("nodes")           public List<IrNode> nodes;
        @SerializedName("edges")           public List<IrEdge> edges;
        @SerializedName("call_arguments")  public List<IrCallArgument> callArguments;
        @SerializedName("failed_files")    public List<IrFailedFile> failedFiles;
    }

    public static class IrFile {
        @SerializedName("path")      public String path;
        @SerializedName("language")  public String language;
        @SerializedName("hash")      public String hash;
        @SerializedName("module_id") public String moduleId;
        @SerializedName("package")   public String packageName;  // nullable (default package)
    }

    public static class IrFailedFile {
        @SerializedName("path")   public String path;
        @SerializedName("reason") public String reason;
    }

    public static class IrNode implements IdTarget, ScopedDeclaration {
        @SerializedName("id")           public String id;
        @SerializedName("type")         public String type;   // MODULE, CLASS, FUNCTION, CALL, ...
        @SerializedName("name")         public String name;
        @SerializedName("file")         public String file;
        @SerializedName("line")         public int line;
        @SerializedName("column")       public int column;
        @SerializedName("named_parent") public String namedParent;   // nullable
        @SerializedName("scope_path")   public List<String> scopePath; // declarations only

        // index among the file's declarations for locals and parameters, -1 for members
        public transient int declarationOrder = -1;

        @Override public String getId() { return id; }
        @Override public void setId(String id) { this.id = id; }
        @Override public String getName() { return name; }
        @Override public List<String> getScopePath() { return scopePath != null ? scopePath : List.of(); }
        @Override public int getDeclarationOrder() { return declarationOrder; }
    }

    public static class IrEdge implements CrossReference {
        @SerializedName("type") public String type;  // CONTAINS, HAS_PARAMETER, READS_FROM, ...
        @SerializedName("src")  public String src;
        @SerializedName("dst")  public String dst;

        transient IdTarget srcRef;
        transient IdTarget dstRef;

        public static IrEdge between(String type, IdTarget src, IdTarget dst) {
            IrEdge edge = new IrEdge();
            edge.type = type;
            edge.srcRef = src;
            edge.dstRef = dst;
            return edge;
        }

        /** Edge to a node that lives outside any file (stdio, external module). */
        public static IrEdge toPseudoNode(String type, IdTarget src, String dstId) {
            IrEdge edge = new IrEdge();
            edge.type = type;
            edge.srcRef = src;
            edge.dst = dstId;
            return edge;
        }

        @Override
        public void materialize() {
            if (srcRef != null) { src = srcRef.getId(); srcRef = null; }
            if (dstRef != null) { dst = dstRef.getId(); dstRef = null; }
        }
    }

    public static class IrCallArgument implements CrossReference {
        @SerializedName("call_id")    public String callId;
        @SerializedName("arg_index")  public int argIndex;
        @SerializedName("value_type") public String valueType;  // LITERAL, VARIABLE, CALL, EXPRESSION
        @SerializedName("value")      public String value;      // nullable
        @SerializedName("value_id")   public String valueId;    // nullable, resolved declaration

        transient IdTarget callRef;
        transient IdTarget valueRef;

        public static IrCallArgument of(IdTarget call, int argIndex, String valueType, String value) {
            IrCallArgument arg = new IrCallArgument();
            arg.callRef = call;
            arg.argIndex = argIndex;
            arg.valueType = valueType;
            arg.value = value;
            return arg;
        }

        public void bindValue(IdTarget declaration) {
            this.valueRef = declaration;
        }

        @Override
        public void materialize() {
            if (callRef != null) { callId = callRef.getId(); callRef = null; }
            if (valueRef != null) { valueId = valueRef.getId(); valueRef = null; }
        }
    }
}
