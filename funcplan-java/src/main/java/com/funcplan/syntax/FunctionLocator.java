package com.funcplan.syntax;

import org.eclipse.jdt.core.dom.*;

import java.util.ArrayList;
import java.util.List;

/**
 * ASTVisitor that collects every method and constructor declaration with a body,
 * nested and anonymous types included, in declaration order.
 */
public class FunctionLocator extends ASTVisitor {

    private final ParsedSource source;
    private final List<FunctionCandidate> candidates = new ArrayList<>();

    public FunctionLocator(ParsedSource source) {
        this.source = source;
    }

    public static List<FunctionCandidate> locate(ParsedSource source) {
        FunctionLocator locator = new FunctionLocator(source);
        source.unit().accept(locator);
        return locator.getCandidates();
    }

    public List<FunctionCandidate> getCandidates() { return candidates; }

    @Override
    public boolean visit(MethodDeclaration node) {
        Block body = node.getBody();
        if (body == null) {
            // abstract, interface or native declaration
            return true;
        }

        List<String> params = new ArrayList<>();
        for (Object p : node.parameters()) {
            SingleVariableDeclaration param = (SingleVariableDeclaration) p;
            params.add(param.getType().toString() + (param.isVarargs() ? "..." : ""));
        }

        StatementCounter counter = new StatementCounter();
        body.accept(counter);

        candidates.add(new FunctionCandidate(
                node.getName().getIdentifier(),
                ownerOf(node),
                params,
                source.lineOf(node),
                source.endLineOf(node),
                counter.statements,
                counter.controlFlow,
                candidates.size(),
                node
        ));
        return true;
    }

    private String ownerOf(ASTNode node) {
        ASTNode parent = node.getParent();
        while (parent != null) {
            if (parent instanceof AbstractTypeDeclaration) {
                return ((AbstractTypeDeclaration) parent).getName().getIdentifier();
            }
            if (parent instanceof AnonymousClassDeclaration) {
                return "<anonymous>";
            }
            parent = parent.getParent();
        }
        return "";
    }

    private static final class StatementCounter extends ASTVisitor {
        int statements;
        int controlFlow;

        @Override
        public void preVisit(ASTNode node) {
            if (node instanceof Statement && !(node instanceof Block) && !(node instanceof EmptyStatement)) {
                statements++;
            }
            if (node instanceof IfStatement
                    || node instanceof ForStatement
                    || node instanceof EnhancedForStatement
                    || node instanceof WhileStatement
                    || node instanceof DoStatement
                    || node instanceof TryStatement
                    || node instanceof SwitchStatement) {
                controlFlow++;
            }
        }
    }
}
