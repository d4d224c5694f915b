package com.graphid.adapter.static_analysis;

import com.graphid.adapter.ir.IrModel.IrCallArgument;
import com.graphid.adapter.ir.IrModel.IrEdge;
import com.graphid.adapter.ir.IrModel.IrFile;
import com.graphid.adapter.ir.IrModel.IrNode;

import java.util.List;

/**
 * Result of analyzing one file. Every ID in here is final.
 */
public record FileAnalysis(
    IrFile file,
    IrNode module,
    List<IrNode> nodes,
    List<IrEdge> edges,
    List<IrCallArgument> callArguments,
    List<ImportRef> imports,
    int disambiguated
) {}
