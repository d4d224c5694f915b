package com.graphid.adapter.static_analysis;

import com.github.javaparser.ast.expr.*;
import com.github.javaparser.ast.type.ClassOrInterfaceType;
import com.github.javaparser.ast.type.Type;

import java.util.stream.Collectors;

/**
 * Renders AST fragments into the short names and hint values that go into IDs.
 * Type names and receiver chains never contain {@code ->}, brackets or {@code #}; literal values
 * are returned verbatim and only ever feed the content hash.
 */
final class AstNames {

    static final String UNKNOWN_RECEIVER = "<expr>";

    private AstNames() {}

    /** {@code java.util.Map<K, V>[]} becomes {@code Map..}; each array dimension renders as {@code ..}. */
    static String simpleTypeName(Type type) {
        if (type.isUnionType()) {
            return type.asUnionType().getElements().stream()
                .map(AstNames::simpleTypeName)
                .collect(Collectors.joining("|"));
        }
        if (type.isArrayType()) {
            return simpleTypeName(type.asArrayType().getComponentType()) + "..";
        }
        String text = stripTypeArguments(type.asString());
        int dot = text.lastIndexOf('.');
        return dot >= 0 ? text.substring(dot + 1) : text;
    }

    /** {@code new Outer.Inner<>()} becomes {@code Outer.Inner}. */
    static String instantiatedType(ClassOrInterfaceType type) {
        String scope = type.getScope().map(s -> s.getNameAsString() + ".").orElse("");
        return scope + type.getNameAsString();
    }

    /**
     * Receiver chain text: names, this, super, field accesses and invocations. Anything else
     * collapses to {@link #UNKNOWN_RECEIVER}.
     */
    static String chainText(Expression expr) {
        if (expr.isNameExpr()) {
            return expr.asNameExpr().getNameAsString();
        }
        if (expr.isThisExpr()) {
            return expr.asThisExpr().getTypeName().map(n -> n.asString() + ".this").orElse("this");
        }
        if (expr.isSuperExpr()) {
            return expr.asSuperExpr().getTypeName().map(n -> n.asString() + ".super").orElse("super");
        }
        if (expr.isFieldAccessExpr()) {
            FieldAccessExpr access = expr.asFieldAccessExpr();
            return chainText(access.getScope()) + "." + access.getNameAsString();
        }
        if (expr.isMethodCallExpr()) {
            MethodCallExpr call = expr.asMethodCallExpr();
            String receiver = call.getScope().map(s -> chainText(s) + ".").orElse("");
            return receiver + call.getNameAsString() + "()";
        }
        if (expr.isEnclosedExpr()) {
            return chainText(expr.asEnclosedExpr().getInner());
        }
        if (expr.isObjectCreationExpr()) {
            return "new:" + instantiatedType(expr.asObjectCreationExpr().getType());
        }
        if (expr.isTypeExpr()) {
            return simpleTypeName(expr.asTypeExpr().getType());
        }
        return UNKNOWN_RECEIVER;
    }

    /** The name at the root of a receiver chain, or null if the chain does not start with one. */
    static String rootName(Expression expr) {
        Expression current = expr;
        while (true) {
            if (current.isNameExpr()) return current.asNameExpr().getNameAsString();
            if (current.isFieldAccessExpr()) {
                current = current.asFieldAccessExpr().getScope();
            } else if (current.isMethodCallExpr() && current.asMethodCallExpr().getScope().isPresent()) {
                current = current.asMethodCallExpr().getScope().get();
            } else if (current.isEnclosedExpr()) {
                current = current.asEnclosedExpr().getInner();
            } else {
                return null;
            }
        }
    }

    /** Source value of a literal, or null if {@code expr} is not one. */
    static String literalValue(Expression expr) {
        if (expr.isStringLiteralExpr()) return expr.asStringLiteralExpr().getValue();
        if (expr.isTextBlockLiteralExpr()) return expr.asTextBlockLiteralExpr().getValue();
        if (expr.isBooleanLiteralExpr()) return String.valueOf(expr.asBooleanLiteralExpr().getValue());
        if (expr.isNullLiteralExpr()) return "null";
        if (expr instanceof LiteralStringValueExpr) return ((LiteralStringValueExpr) expr).getValue();
        return null;
    }

    /** Category of a variable initializer. */
    static String initializerKind(Expression expr) {
        if (expr.isLiteralExpr()) return "LITERAL";
        if (expr.isMethodCallExpr()) return "CALL";
        if (expr.isObjectCreationExpr() || expr.isArrayCreationExpr() || expr.isArrayInitializerExpr()) return "NEW";
        if (expr.isLambdaExpr() || expr.isMethodReferenceExpr()) return "LAMBDA";
        if (expr.isNameExpr() || expr.isFieldAccessExpr()) return "NAME";
        return "EXPRESSION";
    }

    /** First significant token of an initializer, or null when there is nothing stable to take. */
    static String initializerToken(Expression expr) {
        if (expr.isLiteralExpr()) return literalValue(expr);
        if (expr.isMethodCallExpr()) return expr.asMethodCallExpr().getNameAsString();
        if (expr.isObjectCreationExpr()) return instantiatedType(expr.asObjectCreationExpr().getType());
        if (expr.isArrayCreationExpr()) return simpleTypeName(expr.asArrayCreationExpr().getElementType());
        if (expr.isNameExpr() || expr.isFieldAccessExpr()) return chainText(expr);
        return null;
    }

    private static String stripTypeArguments(String text) {
        StringBuilder out = new StringBuilder(text.length());
        int depth = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '<') {
                depth++;
            } else if (c == '>') {
                depth--;
            } else if (depth == 0 && !Character.isWhitespace(c)) {
                out.append(c);
            }
        }
        return out.toString();
    }
}
