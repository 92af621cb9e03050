package com.funcplan.syntax;

import org.eclipse.jdt.core.dom.ASTNode;
import org.eclipse.jdt.core.dom.CompilationUnit;

/**
 * A successfully parsed compilation unit together with its original text.
 */
public record ParsedSource(String unitName, String source, CompilationUnit unit) {

    public int lineOf(ASTNode node) {
        return unit.getLineNumber(node.getStartPosition());
    }

    public int endLineOf(ASTNode node) {
        return unit.getLineNumber(node.getStartPosition() + Math.max(0, node.getLength() - 1));
    }

    /** Original source text of {@code node}. */
    public String textOf(ASTNode node) {
        int start = node.getStartPosition();
        int end = Math.min(source.length(), start + node.getLength());
        if (start < 0 || start >= end) {
            return node.toString();
        }
        return source.substring(start, end);
    }
}
