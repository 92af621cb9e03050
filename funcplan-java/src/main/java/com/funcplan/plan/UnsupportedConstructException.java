package com.funcplan.plan;

/**
 * Raised under {@link UnsupportedPolicy#ABORT} when a statement has no plan counterpart.
 */
public class UnsupportedConstructException extends RuntimeException {

    private final String nodeType;
    private final int line;

    public UnsupportedConstructException(String nodeType, int line) {
        super("Unsupported construct " + nodeType + " at line " + line);
        this.nodeType = nodeType;
        this.line = line;
    }

    public String getNodeType() { return nodeType; }
    public int getLine()        { return line; }
}
