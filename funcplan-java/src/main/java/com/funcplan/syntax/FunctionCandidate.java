package com.funcplan.syntax;

import org.eclipse.jdt.core.dom.MethodDeclaration;

import java.util.List;

/**
 * A method or constructor with a body, as found in a parsed source file.
 *
 * @param ownerType        simple name of the declaring type, {@code <anonymous>} for anonymous classes
 * @param statementCount   statements in the body, nested ones included
 * @param controlFlowCount branching, looping and try statements in the body
 * @param order            position in declaration order, starting at 0
 * @param declaration      the JDT node, {@code null} when the candidate was not produced by a parse
 */
public record FunctionCandidate(
        String name,
        String ownerType,
        List<String> parameterTypes,
        int lineStart,
        int lineEnd,
        int statementCount,
        int controlFlowCount,
        int order,
        MethodDeclaration declaration
) {
    public FunctionCandidate {
        parameterTypes = List.copyOf(parameterTypes);
    }

    /** {@code name(Type1, Type2)} */
    public String signature() {
        return name + "(" + String.join(", ", parameterTypes) + ")";
    }

    /** {@code Owner.name(Type1, Type2)} */
    public String qualifiedSignature() {
        return ownerType == null || ownerType.isEmpty() ? signature() : ownerType + "." + signature();
    }
}
