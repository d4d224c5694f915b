package com.graphid.adapter.static_analysis;

import com.graphid.adapter.ir.IrModel.IrCallArgument;
import com.graphid.adapter.ir.IrModel.IrNode;

import java.util.List;

/**
 * A simple name used inside an expression, waiting to be bound to its declaration once the
 * whole file has been traversed.
 *
 * @param name      identifier as written
 * @param scopePath full scope path at the use site
 * @param from      expression node the edge starts at
 * @param argument  call argument to bind as well; null when the name is a receiver
 * @param edgeType  PASSES_ARGUMENT or READS_FROM
 * @param declarationsBefore number of declarations recorded when the name was met
 */
record NameReference(String name, List<String> scopePath, IrNode from,
                     IrCallArgument argument, String edgeType, int declarationsBefore) {}
