package com.graphid.adapter.static_analysis;

import com.github.javaparser.ast.NodeList;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.FieldAccessExpr;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.expr.ObjectCreationExpr;
import com.github.javaparser.ast.stmt.ExplicitConstructorInvocationStmt;
import com.graphid.adapter.id.ContentHashHints;
import com.graphid.adapter.id.NodeType;
import com.graphid.adapter.id.SemanticId;
import com.graphid.adapter.ir.IrModel.IrCallArgument;
import com.graphid.adapter.ir.IrModel.IrEdge;
import com.graphid.adapter.ir.IrModel.IrNode;

/**
 * Records invocations and field accesses as graph nodes, together with their call arguments
 * and the names they read. Called by {@link NodeExtractor} in pre-order; does not recurse.
 */
class ExpressionCollector {

    static final String PASSES_ARGUMENT = "PASSES_ARGUMENT";
    static final String READS_FROM = "READS_FROM";
    static final String WRITES_TO = "WRITES_TO";

    private final NodeFactory nodes;

    ExpressionCollector(NodeFactory nodes) {
        this.nodes = nodes;
    }

    IrNode recordMethodCall(MethodCallExpr call) {
        IrNode node;
        if (call.getScope().isEmpty()) {
            node = nodes.create(NodeType.CALL, call.getNameAsString(), callHints(call.getArguments()), call);
        } else {
            Expression receiver = call.getScope().get();
            String name = AstNames.chainText(receiver) + "." + call.getNameAsString();
            node = nodes.create(NodeType.METHOD_CALL, name, callHints(call.getArguments()), call);
            if (receiver.isNameExpr()) {
                addReference(receiver.asNameExpr().getNameAsString(), node, null, READS_FROM);
            }
            if (writesToStdio(name)) {
                nodes.graph().edges.add(IrEdge.toPseudoNode(WRITES_TO, node, SemanticId.stdio()));
            }
        }
        recordArguments(node, call.getArguments());
        return node;
    }

    IrNode recordConstruction(ObjectCreationExpr creation) {
        String name = "new:" + AstNames.instantiatedType(creation.getType());
        IrNode node = nodes.create(NodeType.CALL, name, callHints(creation.getArguments()), creation);
        recordArguments(node, creation.getArguments());
        return node;
    }

    IrNode recordConstructorInvocation(ExplicitConstructorInvocationStmt invocation) {
        String name = invocation.isThis() ? "this" : "super";
        IrNode node = nodes.create(NodeType.CALL, name, callHints(invocation.getArguments()), invocation);
        recordArguments(node, invocation.getArguments());
        return node;
    }

    IrNode recordPropertyAccess(FieldAccessExpr access) {
        String receiver = AstNames.chainText(access.getScope());
        ContentHashHints hints = ContentHashHints.builder().objectChain(receiver).build();
        IrNode node = nodes.create(NodeType.PROPERTY_ACCESS,
                receiver + "." + access.getNameAsString(), hints, access);
        String root = AstNames.rootName(access.getScope());
        if (root != null) {
            addReference(root, node, null, READS_FROM);
        }
        return node;
    }

    private void recordArguments(IrNode call, NodeList<Expression> arguments) {
        for (int i = 0; i < arguments.size(); i++) {
            Expression arg = arguments.get(i);
            String literal = AstNames.literalValue(arg);
            IrCallArgument record;
            if (literal != null) {
                record = IrCallArgument.of(call, i, "LITERAL", literal);
            } else if (arg.isNameExpr()) {
                String name = arg.asNameExpr().getNameAsString();
                record = IrCallArgument.of(call, i, "VARIABLE", name);
                addReference(name, call, record, PASSES_ARGUMENT);
            } else if (arg.isMethodCallExpr() || arg.isObjectCreationExpr()) {
                record = IrCallArgument.of(call, i, "CALL", null);
            } else {
                record = IrCallArgument.of(call, i, "EXPRESSION", null);
            }
            nodes.graph().callArguments.add(record);
        }
    }

    private ContentHashHints callHints(NodeList<Expression> arguments) {
        String firstLiteral = null;
        for (Expression arg : arguments) {
            firstLiteral = AstNames.literalValue(arg);
            if (firstLiteral != null) break;
        }
        return ContentHashHints.builder()
            .arity(arguments.size())
            .firstLiteralArg(firstLiteral)
            .build();
    }

    private void addReference(String name, IrNode from, IrCallArgument argument, String edgeType) {
        nodes.graph().references.add(
            new NameReference(name, nodes.scopes().getScopePath(), from, argument, edgeType,
                nodes.graph().declarations.size()));
    }

    private static boolean writesToStdio(String callName) {
        return callName.startsWith("System.out.") || callName.startsWith("System.err.");
    }
}
