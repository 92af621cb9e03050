package com.funcplan.syntax;

import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Orchestrates the syntax pass: parse the file, locate candidate functions,
 * pick one, and extract its statement descriptors.
 */
public class SourceAnalyzer {

    private final JdtSourceParser parser;
    private final FunctionSelector selector;
    private final int labelMaxLength;

    public SourceAnalyzer() {
        this(JdtSourceParser.DEFAULT_MAX_SOURCE_CHARS, LabelText.DEFAULT_MAX_LENGTH, new ScoringFunctionSelector());
    }

    public SourceAnalyzer(int maxSourceChars, int labelMaxLength, FunctionSelector selector) {
        this.parser = new JdtSourceParser(maxSourceChars);
        this.selector = selector;
        this.labelMaxLength = labelMaxLength;
    }

    public static class FunctionNotFoundException extends RuntimeException {
        public FunctionNotFoundException(String msg) { super(msg); }
    }

    /**
     * @param functionName method to plan, or {@code null} to let the selector choose
     * @throws JdtSourceParser.ParseException if the file cannot be read or parsed
     * @throws FunctionNotFoundException      if no matching function exists
     */
    public ParsedFunction analyze(Path sourceFile, String functionName) {
        System.err.println("[funcplan] Parsing: " + sourceFile);
        return analyze(parser.parseFile(sourceFile), sourceFile.toString(), functionName);
    }

    public ParsedFunction analyze(String source, String unitName, String functionName) {
        return analyze(parser.parse(source, unitName), unitName, functionName);
    }

    private ParsedFunction analyze(ParsedSource parsed, String sourceFile, String functionName) {
        List<FunctionCandidate> candidates = FunctionLocator.locate(parsed);
        if (candidates.isEmpty()) {
            throw new FunctionNotFoundException("No function definitions found in " + parsed.unitName());
        }

        FunctionCandidate chosen = functionName != null
                ? byName(candidates, functionName, parsed.unitName())
                : selector.select(candidates).orElseThrow(() -> new FunctionNotFoundException(
                        "No suitable function found in " + parsed.unitName() + "; specify --func to disambiguate"));

        System.err.println("[funcplan] Selected function: " + chosen.qualifiedSignature()
                + " (lines " + chosen.lineStart() + "-" + chosen.lineEnd() + ")");

        List<StatementDescriptor> statements =
                new StatementExtractor(parsed, labelMaxLength).extract(chosen.declaration());
        return new ParsedFunction(sourceFile, chosen, candidates, statements);
    }

    private FunctionCandidate byName(List<FunctionCandidate> candidates, String functionName, String unitName) {
        List<FunctionCandidate> matches = candidates.stream()
                .filter(c -> c.name().equals(functionName))
                .collect(Collectors.toList());
        if (matches.isEmpty()) {
            throw new FunctionNotFoundException("Function '" + functionName + "' not found in " + unitName);
        }
        if (matches.size() > 1) {
            System.err.println("[funcplan] Warning: " + matches.size() + " declarations named '" + functionName
                    + "'; using the first one at line " + matches.get(0).lineStart());
        }
        return matches.get(0);
    }
}
