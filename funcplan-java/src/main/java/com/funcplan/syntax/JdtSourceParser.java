package com.funcplan.syntax;

import org.eclipse.jdt.core.JavaCore;
import org.eclipse.jdt.core.compiler.IProblem;
import org.eclipse.jdt.core.dom.AST;
import org.eclipse.jdt.core.dom.ASTParser;
import org.eclipse.jdt.core.dom.CompilationUnit;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * Wrapper around Eclipse JDT's ASTParser.
 * Parses a single Java compilation unit without binding resolution; any syntax error is fatal.
 */
public class JdtSourceParser {

    public static final int DEFAULT_MAX_SOURCE_CHARS = 200_000;

    private final int maxSourceChars;

    public JdtSourceParser() {
        this(DEFAULT_MAX_SOURCE_CHARS);
    }

    public JdtSourceParser(int maxSourceChars) {
        this.maxSourceChars = maxSourceChars;
    }

    public static class ParseException extends RuntimeException {
        private final int line;

        public ParseException(String msg, int line) {
            super(msg);
            this.line = line;
        }

        public ParseException(String msg, Throwable cause) {
            super(msg, cause);
            this.line = -1;
        }

        /** 1-based line of the first error, or -1 when unknown. */
        public int getLine() { return line; }
    }

    /**
     * Reads and parses a source file as UTF-8.
     *
     * @throws ParseException if the file cannot be read, is too large, or does not parse
     */
    public ParsedSource parseFile(Path sourceFile) {
        String source;
        try {
            source = Files.readString(sourceFile, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ParseException("Could not read source file " + sourceFile + ": " + e.getMessage(), e);
        }
        return parse(source, sourceFile.getFileName().toString());
    }

    /**
     * Parses {@code source} as a compilation unit.
     *
     * @param unitName file name used for diagnostics, e.g. {@code Orders.java}
     */
    public ParsedSource parse(String source, String unitName) {
        if (source.length() > maxSourceChars) {
            throw new ParseException("Source too large: " + source.length()
                    + " characters (limit " + maxSourceChars + ")", -1);
        }

        ASTParser parser = ASTParser.newParser(AST.JLS17);
        parser.setKind(ASTParser.K_COMPILATION_UNIT);
        parser.setResolveBindings(false);
        parser.setStatementsRecovery(false);

        Map<String, String> options = JavaCore.getOptions();
        JavaCore.setComplianceOptions(JavaCore.VERSION_17, options);
        parser.setCompilerOptions(options);
        parser.setUnitName(unitName);
        parser.setSource(source.toCharArray());

        CompilationUnit unit = (CompilationUnit) parser.createAST(null);
        for (IProblem problem : unit.getProblems()) {
            if (problem.isError()) {
                throw new ParseException(unitName + ":" + problem.getSourceLineNumber()
                        + ": " + problem.getMessage(), problem.getSourceLineNumber());
            }
        }
        return new ParsedSource(unitName, source, unit);
    }
}
