package com.funcplan.syntax;

import org.eclipse.jdt.core.dom.*;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Converts the JDT statements of one method body into {@link StatementDescriptor}s.
 * Nested blocks are inlined, empty statements dropped, and statement types without a plan
 * counterpart are reported as {@link StatementKind#UNSUPPORTED}.
 */
public class StatementExtractor {

    private final ParsedSource source;
    private final int labelMaxLength;

    public StatementExtractor(ParsedSource source, int labelMaxLength) {
        this.source = source;
        this.labelMaxLength = labelMaxLength;
    }

    public List<StatementDescriptor> extract(MethodDeclaration method) {
        Block body = method.getBody();
        return body == null ? List.of() : extractAll(body.statements());
    }

    public List<StatementDescriptor> extractAll(List<?> statements) {
        List<StatementDescriptor> result = new ArrayList<>();
        for (Object s : statements) {
            appendStatement((Statement) s, result);
        }
        return result;
    }

    private List<StatementDescriptor> extractBranch(Statement statement) {
        List<StatementDescriptor> result = new ArrayList<>();
        if (statement != null) {
            appendStatement(statement, result);
        }
        return result;
    }

    private void appendStatement(Statement statement, List<StatementDescriptor> out) {
        if (statement instanceof Block) {
            out.addAll(extractAll(((Block) statement).statements()));
            return;
        }
        if (statement instanceof EmptyStatement) {
            return;
        }
        out.add(describe(statement));
    }

    private StatementDescriptor describe(Statement statement) {
        int line = source.lineOf(statement);
        String text = label(source.textOf(statement));

        if (statement instanceof ExpressionStatement) {
            return describeExpression(((ExpressionStatement) statement).getExpression(), line, text);
        }
        if (statement instanceof VariableDeclarationStatement) {
            return describeDeclaration((VariableDeclarationStatement) statement, line, text);
        }
        if (statement instanceof ConstructorInvocation) {
            return StatementDescriptor.simple(StatementKind.CALL, line, "this", text);
        }
        if (statement instanceof SuperConstructorInvocation) {
            return StatementDescriptor.simple(StatementKind.CALL, line, "super", text);
        }
        if (statement instanceof AssertStatement) {
            return StatementDescriptor.simple(StatementKind.PLAIN, line, text, text);
        }
        if (statement instanceof ReturnStatement) {
            Expression value = ((ReturnStatement) statement).getExpression();
            return StatementDescriptor.simple(StatementKind.RETURN, line,
                    value == null ? "return" : label(source.textOf(value)), text);
        }
        if (statement instanceof BreakStatement) {
            SimpleName target = ((BreakStatement) statement).getLabel();
            return StatementDescriptor.simple(StatementKind.BREAK, line,
                    target == null ? "break" : "break " + target.getIdentifier(), text);
        }
        if (statement instanceof ContinueStatement) {
            SimpleName target = ((ContinueStatement) statement).getLabel();
            return StatementDescriptor.simple(StatementKind.CONTINUE, line,
                    target == null ? "continue" : "continue " + target.getIdentifier(), text);
        }
        if (statement instanceof ThrowStatement) {
            Expression thrown = ((ThrowStatement) statement).getExpression();
            return StatementDescriptor.simple(StatementKind.RAISE, line, label(source.textOf(thrown)), text);
        }
        if (statement instanceof IfStatement) {
            IfStatement ifStatement = (IfStatement) statement;
            String condition = label(source.textOf(ifStatement.getExpression()));
            Statement elseBranch = ifStatement.getElseStatement();
            return StatementDescriptor.ifStatement(line, condition, "if (" + condition + ")",
                    extractBranch(ifStatement.getThenStatement()),
                    elseBranch == null ? null : extractBranch(elseBranch));
        }
        if (statement instanceof ForStatement) {
            ForStatement forStatement = (ForStatement) statement;
            String header = label(joinText(forStatement.initializers()) + "; "
                    + (forStatement.getExpression() == null ? "" : source.textOf(forStatement.getExpression()))
                    + "; " + joinText(forStatement.updaters()));
            if (header.isEmpty()) {
                header = ";;";
            }
            return StatementDescriptor.loop(StatementKind.FOR, line, header, "for (" + header + ")",
                    extractBranch(forStatement.getBody()));
        }
        if (statement instanceof EnhancedForStatement) {
            EnhancedForStatement forEach = (EnhancedForStatement) statement;
            String header = label(forEach.getParameter().getName().getIdentifier()
                    + " : " + source.textOf(forEach.getExpression()));
            return StatementDescriptor.loop(StatementKind.FOR, line, header, "for (" + header + ")",
                    extractBranch(forEach.getBody()));
        }
        if (statement instanceof WhileStatement) {
            WhileStatement whileStatement = (WhileStatement) statement;
            String condition = label(source.textOf(whileStatement.getExpression()));
            return StatementDescriptor.loop(StatementKind.WHILE, line, condition, "while (" + condition + ")",
                    extractBranch(whileStatement.getBody()));
        }
        if (statement instanceof DoStatement) {
            DoStatement doStatement = (DoStatement) statement;
            String condition = label(source.textOf(doStatement.getExpression()));
            return StatementDescriptor.loop(StatementKind.WHILE, line, condition, "do ... while (" + condition + ")",
                    extractBranch(doStatement.getBody()));
        }
        if (statement instanceof TryStatement) {
            return describeTry((TryStatement) statement, line);
        }
        if (statement instanceof LabeledStatement) {
            LabeledStatement labeled = (LabeledStatement) statement;
            StatementDescriptor inner = describe(labeled.getBody());
            if (inner.kind() == StatementKind.FOR || inner.kind() == StatementKind.WHILE) {
                return StatementDescriptor.loop(inner.kind(), line, inner.label(),
                        labeled.getLabel().getIdentifier() + ": " + inner.text(), inner.body());
            }
        }
        return StatementDescriptor.unsupported(statement.getClass().getSimpleName(), line, text);
    }

    private StatementDescriptor describeExpression(Expression expression, int line, String text) {
        if (expression instanceof MethodInvocation
                || expression instanceof SuperMethodInvocation
                || expression instanceof ClassInstanceCreation) {
            return StatementDescriptor.simple(StatementKind.CALL, line, label(CallNames.of(expression)), text);
        }
        if (expression instanceof Assignment) {
            Expression target = ((Assignment) expression).getLeftHandSide();
            return StatementDescriptor.simple(StatementKind.ASSIGN, line, label(source.textOf(target)), text);
        }
        if (expression instanceof PrefixExpression) {
            PrefixExpression prefix = (PrefixExpression) expression;
            if (prefix.getOperator() == PrefixExpression.Operator.INCREMENT
                    || prefix.getOperator() == PrefixExpression.Operator.DECREMENT) {
                return StatementDescriptor.simple(StatementKind.ASSIGN, line,
                        label(source.textOf(prefix.getOperand())), text);
            }
        }
        if (expression instanceof PostfixExpression) {
            return StatementDescriptor.simple(StatementKind.ASSIGN, line,
                    label(source.textOf(((PostfixExpression) expression).getOperand())), text);
        }
        return StatementDescriptor.simple(StatementKind.PLAIN, line, text, text);
    }

    private StatementDescriptor describeDeclaration(VariableDeclarationStatement declaration, int line, String text) {
        List<String> names = new ArrayList<>();
        boolean initialized = false;
        for (Object f : declaration.fragments()) {
            VariableDeclarationFragment fragment = (VariableDeclarationFragment) f;
            names.add(fragment.getName().getIdentifier());
            initialized |= fragment.getInitializer() != null;
        }
        if (!initialized) {
            return StatementDescriptor.simple(StatementKind.PLAIN, line, text, text);
        }
        return StatementDescriptor.simple(StatementKind.ASSIGN, line, label(String.join(", ", names)), text);
    }

    private StatementDescriptor describeTry(TryStatement tryStatement, int line) {
        String tryLabel = "try";
        if (!tryStatement.resources().isEmpty()) {
            String resources = ((List<?>) tryStatement.resources()).stream()
                    .map(r -> source.textOf((ASTNode) r))
                    .collect(Collectors.joining("; "));
            tryLabel = label("try (" + resources + ")");
        }

        List<HandlerDescriptor> handlers = new ArrayList<>();
        for (Object c : tryStatement.catchClauses()) {
            CatchClause clause = (CatchClause) c;
            handlers.add(new HandlerDescriptor(
                    label(source.textOf(clause.getException())),
                    source.lineOf(clause),
                    extractAll(clause.getBody().statements())));
        }

        Block finallyBlock = tryStatement.getFinally();
        return StatementDescriptor.tryStatement(line, tryLabel, tryLabel,
                extractAll(tryStatement.getBody().statements()),
                handlers,
                finallyBlock == null ? null : extractAll(finallyBlock.statements()));
    }

    private String joinText(List<?> expressions) {
        return expressions.stream()
                .map(e -> source.textOf((ASTNode) e))
                .collect(Collectors.joining(", "));
    }

    private String label(String raw) {
        return LabelText.normalize(raw, labelMaxLength);
    }
}
