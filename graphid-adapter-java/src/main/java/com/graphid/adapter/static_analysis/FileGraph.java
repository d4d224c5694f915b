package com.graphid.adapter.static_analysis;

import com.graphid.adapter.ir.IrModel.IrCallArgument;
import com.graphid.adapter.ir.IrModel.IrEdge;
import com.graphid.adapter.ir.IrModel.IrNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Mutable buffers filled while one file is traversed.
 */
class FileGraph {

    final List<IrNode> nodes = new ArrayList<>();
    final List<IrEdge> edges = new ArrayList<>();
    final List<IrCallArgument> callArguments = new ArrayList<>();
    final List<IrNode> declarations = new ArrayList<>();
    final List<NameReference> references = new ArrayList<>();
    final List<ImportRef> imports = new ArrayList<>();

    IrNode module;
    String packageName;
}
