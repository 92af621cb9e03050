package com.funcplan.syntax;

/**
 * Statement categories the plan builder understands.
 * Everything the walker cannot map lands in {@link #UNSUPPORTED}.
 */
public enum StatementKind {
    PLAIN,
    CALL,
    ASSIGN,
    RETURN,
    BREAK,
    CONTINUE,
    RAISE,
    IF,
    FOR,
    WHILE,
    TRY,
    UNSUPPORTED
}
