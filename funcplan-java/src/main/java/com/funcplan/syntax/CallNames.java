package com.funcplan.syntax;

import org.eclipse.jdt.core.dom.*;

/**
 * Derives dotted call-target names such as {@code orders.repository.save} from invocation expressions.
 * A leading {@code this.} is dropped; qualifiers that are neither names, field accesses nor calls
 * collapse to the bare method name.
 */
public final class CallNames {

    private CallNames() {}

    public static String of(Expression expression) {
        if (expression instanceof MethodInvocation) {
            MethodInvocation call = (MethodInvocation) expression;
            String qualifier = qualifierOf(call.getExpression());
            String name = call.getName().getIdentifier();
            return qualifier.isEmpty() ? name : qualifier + "." + name;
        }
        if (expression instanceof SuperMethodInvocation) {
            return "super." + ((SuperMethodInvocation) expression).getName().getIdentifier();
        }
        if (expression instanceof ClassInstanceCreation) {
            return "new " + ((ClassInstanceCreation) expression).getType().toString();
        }
        return expression == null ? "" : expression.toString();
    }

    private static String qualifierOf(Expression qualifier) {
        if (qualifier == null || qualifier instanceof ThisExpression) {
            return "";
        }
        if (qualifier instanceof Name) {
            return ((Name) qualifier).getFullyQualifiedName();
        }
        if (qualifier instanceof FieldAccess) {
            FieldAccess access = (FieldAccess) qualifier;
            String inner = qualifierOf(access.getExpression());
            String field = access.getName().getIdentifier();
            return inner.isEmpty() ? field : inner + "." + field;
        }
        if (qualifier instanceof MethodInvocation || qualifier instanceof SuperMethodInvocation) {
            return of(qualifier) + "()";
        }
        if (qualifier instanceof ParenthesizedExpression) {
            return qualifierOf(((ParenthesizedExpression) qualifier).getExpression());
        }
        return "";
    }
}
