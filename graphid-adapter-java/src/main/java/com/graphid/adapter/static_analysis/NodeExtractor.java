package com.graphid.adapter.static_analysis;

import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.ImportDeclaration;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.NodeList;
import com.github.javaparser.ast.body.*;
import com.github.javaparser.ast.expr.*;
import com.github.javaparser.ast.stmt.*;
import com.github.javaparser.ast.visitor.VoidVisitorAdapter;
import com.github.javaparser.printer.DefaultPrettyPrinter;
import com.github.javaparser.printer.Printer;
import com.github.javaparser.printer.configuration.DefaultConfigurationOption;
import com.github.javaparser.printer.configuration.DefaultPrinterConfiguration;
import com.github.javaparser.printer.configuration.DefaultPrinterConfiguration.ConfigOption;
import com.graphid.adapter.id.ContentHashHints;
import com.graphid.adapter.id.NodeType;
import com.graphid.adapter.ir.IrModel.IrEdge;
import com.graphid.adapter.ir.IrModel.IrNode;
import com.graphid.adapter.scope.ScopeTracker;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Walks one compilation unit depth-first and emits a node for every declaration, anonymous
 * block, invocation and field access it meets.
 *
 * Children are visited explicitly in source order wherever a scope opens; the generated
 * adapter order is only relied on inside plain expressions.
 *
 * An anonymous block is identified by its kind, the kinds of the anonymous blocks around it and
 * its header (condition, selector, resources, or else its first statement), never by position.
 */
public class NodeExtractor extends VoidVisitorAdapter<Void> {

    static final String HAS_PARAMETER = "HAS_PARAMETER";

    private final NodeFactory nodes;
    private final ExpressionCollector expressions;
    private final ScopeTracker scopes;
    private final Printer headerPrinter = new DefaultPrettyPrinter(new DefaultPrinterConfiguration()
        .removeOption(new DefaultConfigurationOption(ConfigOption.PRINT_COMMENTS)));

    NodeExtractor(NodeFactory nodes) {
        this.nodes = nodes;
        this.expressions = new ExpressionCollector(nodes);
        this.scopes = nodes.scopes();
    }

    // --- Compilation unit ---

    @Override
    public void visit(CompilationUnit n, Void arg) {
        FileGraph graph = nodes.graph();
        String file = scopes.getFile();
        String moduleName = file.substring(file.lastIndexOf('/') + 1);
        graph.module = nodes.create(NodeType.MODULE, moduleName, ContentHashHints.EMPTY, n);
        graph.packageName = n.getPackageDeclaration().map(p -> p.getNameAsString()).orElse(null);
        for (ImportDeclaration imp : n.getImports()) {
            graph.imports.add(new ImportRef(imp.getNameAsString(), imp.isStatic(), imp.isAsterisk()));
        }

        nodes.pushContainer(graph.module);
        for (TypeDeclaration<?> type : n.getTypes()) {
            type.accept(this, arg);
        }
        nodes.popContainer();
    }

    // --- Type declarations ---

    @Override
    public void visit(ClassOrInterfaceDeclaration n, Void arg) {
        NodeType type = n.isInterface() ? NodeType.INTERFACE : NodeType.CLASS;
        enterType(n, type, n.isInterface() ? "interface" : "class");
        visitMembers(n.getMembers(), arg);
        exitType();
    }

    @Override
    public void visit(EnumDeclaration n, Void arg) {
        enterType(n, NodeType.ENUM, "enum");
        for (EnumConstantDeclaration constant : n.getEntries()) {
            constant.accept(this, arg);
        }
        visitMembers(n.getMembers(), arg);
        exitType();
    }

    @Override
    public void visit(RecordDeclaration n, Void arg) {
        enterType(n, NodeType.CLASS, "record");
        for (Parameter component : n.getParameters()) {
            nodes.create(NodeType.VARIABLE, component.getNameAsString(),
                ContentHashHints.builder().declaredType(parameterType(component)).build(), component);
        }
        visitMembers(n.getMembers(), arg);
        exitType();
    }

    @Override
    public void visit(AnnotationDeclaration n, Void arg) {
        enterType(n, NodeType.INTERFACE, "@interface");
        visitMembers(n.getMembers(), arg);
        exitType();
    }

    private void enterType(TypeDeclaration<?> n, NodeType type, String keyword) {
        String name = n.getNameAsString();
        ContentHashHints hints = ContentHashHints.builder().declaredType(keyword).build();
        IrNode node = nodes.create(type, name, hints, n);
        scopes.enterScope(name, type.name());
        nodes.pushContainer(node);
    }

    private void exitType() {
        nodes.popContainer();
        scopes.exitScope();
    }

    private void visitMembers(NodeList<BodyDeclaration<?>> members, Void arg) {
        for (BodyDeclaration<?> member : members) {
            member.accept(this, arg);
        }
    }

    // --- Members ---

    @Override
    public void visit(FieldDeclaration n, Void arg) {
        boolean constant = (n.isStatic() && n.isFinal()) || isInterfaceMember(n);
        for (VariableDeclarator variable : n.getVariables()) {
            declareVariable(variable, constant ? NodeType.CONSTANT : NodeType.VARIABLE, false, arg);
        }
    }

    @Override
    public void visit(EnumConstantDeclaration n, Void arg) {
        ContentHashHints hints = ContentHashHints.builder().arity(n.getArguments().size()).build();
        nodes.create(NodeType.CONSTANT, n.getNameAsString(), hints, n);
        for (Expression argument : n.getArguments()) {
            argument.accept(this, arg);
        }
        if (n.getClassBody().isNonEmpty()) {
            inCountedScope("anonymous", n, n.getNameAsString(), () -> visitMembers(n.getClassBody(), arg));
        }
    }

    @Override
    public void visit(MethodDeclaration n, Void arg) {
        visitCallable(n, n.getNameAsString(), n.getParameters(), arg);
        n.getBody().ifPresent(body -> body.accept(this, arg));
        exitCallable();
    }

    @Override
    public void visit(ConstructorDeclaration n, Void arg) {
        visitCallable(n, "<init>", n.getParameters(), arg);
        n.getBody().accept(this, arg);
        exitCallable();
    }

    @Override
    public void visit(CompactConstructorDeclaration n, Void arg) {
        visitCallable(n, "<init>", new NodeList<>(), arg);
        n.getBody().accept(this, arg);
        exitCallable();
    }

    @Override
    public void visit(AnnotationMemberDeclaration n, Void arg) {
        visitCallable(n, n.getNameAsString(), new NodeList<>(), arg);
        exitCallable();
    }

    @Override
    public void visit(InitializerDeclaration n, Void arg) {
        inCountedScope(n.isStatic() ? "static" : "init", n, leadingStatement(n.getBody()),
            () -> n.getBody().accept(this, arg));
    }

    private void visitCallable(Node n, String name, NodeList<Parameter> parameters, Void arg) {
        List<String> types = new ArrayList<>(parameters.size());
        for (Parameter parameter : parameters) {
            types.add(parameterType(parameter));
        }
        String signature = String.join(",", types);
        ContentHashHints hints = ContentHashHints.builder()
            .arity(parameters.size())
            .firstParamName(parameters.isEmpty() ? null : parameters.get(0).getNameAsString())
            .signature(signature)
            .build();

        IrNode function = nodes.create(NodeType.FUNCTION, name, hints, n);
        scopes.enterScope(name, NodeType.FUNCTION.name(), name + "(" + signature + ")");
        nodes.pushContainer(function);
        declareParameters(function, parameters);
    }

    private void exitCallable() {
        nodes.popContainer();
        scopes.exitScope();
    }

    // --- Statements that open anonymous scopes ---

    @Override
    public void visit(BlockStmt n, Void arg) {
        boolean bare = n.getParentNode().map(p -> p instanceof BlockStmt || p instanceof SwitchEntry).orElse(false);
        if (bare) {
            inCountedScope("block", n, leadingStatement(n), () -> super.visit(n, arg));
        } else {
            super.visit(n, arg);
        }
    }

    @Override
    public void visit(IfStmt n, Void arg) {
        n.getCondition().accept(this, arg);
        String condition = headerText(n.getCondition());
        inCountedScope("if", n, condition, () -> n.getThenStmt().accept(this, arg));
        n.getElseStmt().ifPresent(otherwise ->
            inCountedScope("else", otherwise, condition, () -> otherwise.accept(this, arg)));
    }

    @Override
    public void visit(ForStmt n, Void arg) {
        String header = headerTextOf(n.getInitialization()) + ";"
            + n.getCompare().map(this::headerText).orElse("") + ";"
            + headerTextOf(n.getUpdate());
        inCountedScope("for", n, header, () -> {
            n.getInitialization().forEach(e -> e.accept(this, arg));
            n.getCompare().ifPresent(e -> e.accept(this, arg));
            n.getUpdate().forEach(e -> e.accept(this, arg));
            n.getBody().accept(this, arg);
        });
    }

    @Override
    public void visit(ForEachStmt n, Void arg) {
        String header = headerText(n.getVariable()) + " : " + headerText(n.getIterable());
        inCountedScope("for", n, header, () -> {
            n.getVariable().accept(this, arg);
            n.getIterable().accept(this, arg);
            n.getBody().accept(this, arg);
        });
    }

    @Override
    public void visit(WhileStmt n, Void arg) {
        inCountedScope("while", n, headerText(n.getCondition()), () -> {
            n.getCondition().accept(this, arg);
            n.getBody().accept(this, arg);
        });
    }

    @Override
    public void visit(DoStmt n, Void arg) {
        inCountedScope("do", n, headerText(n.getCondition()), () -> {
            n.getBody().accept(this, arg);
            n.getCondition().accept(this, arg);
        });
    }

    @Override
    public void visit(TryStmt n, Void arg) {
        String header = n.getResources().isEmpty()
            ? leadingStatement(n.getTryBlock())
            : headerTextOf(n.getResources());
        inCountedScope("try", n, header, () -> {
            n.getResources().forEach(r -> r.accept(this, arg));
            n.getTryBlock().accept(this, arg);
        });
        for (CatchClause clause : n.getCatchClauses()) {
            String caught = AstNames.simpleTypeName(clause.getParameter().getType());
            inCountedScope("catch", clause, caught, () -> {
                declareParameter(null, clause.getParameter(), 0);
                clause.getBody().accept(this, arg);
            });
        }
        n.getFinallyBlock().ifPresent(block ->
            inCountedScope("finally", block, leadingStatement(block), () -> block.accept(this, arg)));
    }

    @Override
    public void visit(SwitchStmt n, Void arg) {
        n.getSelector().accept(this, arg);
        inCountedScope("switch", n, headerText(n.getSelector()),
            () -> n.getEntries().forEach(e -> e.accept(this, arg)));
    }

    @Override
    public void visit(SwitchExpr n, Void arg) {
        n.getSelector().accept(this, arg);
        inCountedScope("switch", n, headerText(n.getSelector()),
            () -> n.getEntries().forEach(e -> e.accept(this, arg)));
    }

    @Override
    public void visit(SynchronizedStmt n, Void arg) {
        n.getExpression().accept(this, arg);
        inCountedScope("synchronized", n, headerText(n.getExpression()), () -> n.getBody().accept(this, arg));
    }

    @Override
    public void visit(LambdaExpr n, Void arg) {
        String header = n.getParameters().stream()
            .map(Parameter::getNameAsString)
            .collect(Collectors.joining(",")) + " -> " + leadingStatement(n.getBody());
        inCountedScope("lambda", n, header, () -> {
            declareParameters(null, n.getParameters());
            n.getBody().accept(this, arg);
        });
    }

    // --- Declarations inside bodies ---

    @Override
    public void visit(VariableDeclarationExpr n, Void arg) {
        NodeType type = n.isFinal() ? NodeType.CONSTANT : NodeType.VARIABLE;
        for (VariableDeclarator variable : n.getVariables()) {
            declareVariable(variable, type, true, arg);
        }
    }

    private void declareVariable(VariableDeclarator variable, NodeType type, boolean local, Void arg) {
        ContentHashHints.Builder hints = ContentHashHints.builder()
            .declaredType(AstNames.simpleTypeName(variable.getType()));
        variable.getInitializer().ifPresent(init -> hints
            .rhsType(AstNames.initializerKind(init))
            .rhsToken(AstNames.initializerToken(init)));
        if (local) {
            nodes.createLocal(type, variable.getNameAsString(), hints.build(), variable);
        } else {
            nodes.create(type, variable.getNameAsString(), hints.build(), variable);
        }
        variable.getInitializer().ifPresent(init -> init.accept(this, arg));
    }

    private void declareParameters(IrNode owner, NodeList<Parameter> parameters) {
        for (int i = 0; i < parameters.size(); i++) {
            declareParameter(owner, parameters.get(i), i);
        }
    }

    private void declareParameter(IrNode owner, Parameter parameter, int index) {
        ContentHashHints hints = ContentHashHints.builder()
            .declaredType(parameterType(parameter))
            .arity(index)
            .build();
        IrNode node = nodes.createLocal(NodeType.PARAMETER, parameter.getNameAsString(), hints, parameter);
        if (owner != null) {
            nodes.graph().edges.add(IrEdge.between(HAS_PARAMETER, owner, node));
        }
    }

    // --- Expressions ---

    @Override
    public void visit(MethodCallExpr n, Void arg) {
        expressions.recordMethodCall(n);
        n.getScope().ifPresent(receiver -> receiver.accept(this, arg));
        n.getArguments().forEach(a -> a.accept(this, arg));
    }

    @Override
    public void visit(ObjectCreationExpr n, Void arg) {
        expressions.recordConstruction(n);
        n.getScope().ifPresent(outer -> outer.accept(this, arg));
        n.getArguments().forEach(a -> a.accept(this, arg));
        n.getAnonymousClassBody().ifPresent(body ->
            inCountedScope("anonymous", n, AstNames.instantiatedType(n.getType()), () -> visitMembers(body, arg)));
    }

    @Override
    public void visit(ExplicitConstructorInvocationStmt n, Void arg) {
        expressions.recordConstructorInvocation(n);
        n.getExpression().ifPresent(outer -> outer.accept(this, arg));
        n.getArguments().forEach(a -> a.accept(this, arg));
    }

    @Override
    public void visit(FieldAccessExpr n, Void arg) {
        expressions.recordPropertyAccess(n);
        n.getScope().accept(this, arg);
    }

    // --- Helpers ---

    /**
     * Opens {@code type#N} in the scope path for the duration of {@code body} and emits its
     * SCOPE node, named by kind and hashed on the enclosing kinds and the header.
     */
    private void inCountedScope(String type, Node astNode, String header, Runnable body) {
        List<String> enclosing = scopes.getAnonymousKinds();
        ContentHashHints hints = ContentHashHints.builder()
            .objectChain(enclosing.isEmpty() ? null : String.join("/", enclosing))
            .rhsToken(header)
            .build();
        scopes.enterCountedScope(type);
        nodes.create(NodeType.SCOPE, type, hints, astNode);
        body.run();
        scopes.exitScope();
    }

    /** Source text without comments, whitespace runs collapsed so line endings do not matter. */
    private String headerText(Node node) {
        return headerPrinter.print(node).replaceAll("\\s+", " ").trim();
    }

    private String headerTextOf(NodeList<? extends Node> list) {
        return list.stream().map(this::headerText).collect(Collectors.joining(","));
    }

    private String leadingStatement(Statement statement) {
        if (statement.isBlockStmt()) {
            NodeList<Statement> body = statement.asBlockStmt().getStatements();
            return body.isEmpty() ? null : headerText(body.get(0));
        }
        return headerText(statement);
    }

    private static String parameterType(Parameter parameter) {
        String type = AstNames.simpleTypeName(parameter.getType());
        if (type.isEmpty()) return null;  // untyped lambda parameter
        return parameter.isVarArgs() ? type + "..." : type;
    }

    private static boolean isInterfaceMember(FieldDeclaration n) {
        return n.getParentNode()
            .map(p -> p instanceof ClassOrInterfaceDeclaration && ((ClassOrInterfaceDeclaration) p).isInterface())
            .orElse(false);
    }
}
