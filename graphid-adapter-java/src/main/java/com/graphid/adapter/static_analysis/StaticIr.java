package com.graphid.adapter.static_analysis;

import com.graphid.adapter.ir.IrModel.IrCallArgument;
import com.graphid.adapter.ir.IrModel.IrEdge;
import com.graphid.adapter.ir.IrModel.IrFailedFile;
import com.graphid.adapter.ir.IrModel.IrFile;
import com.graphid.adapter.ir.IrModel.IrNode;

import java.util.List;

/**
 * Aggregate result of the static analysis phase, files in path order.
 */
public record StaticIr(
    List<IrFile> files,
    List<IrNode> nodes,
    List<IrEdge> edges,
    List<IrCallArgument> callArguments,
    List<IrFailedFile> failedFiles
) {}
