package com.funcplan.syntax;

import java.util.List;

/**
 * The selected function of a source file and its statement descriptors.
 */
public record ParsedFunction(
        String sourceFile,
        FunctionCandidate function,
        List<FunctionCandidate> candidates,
        List<StatementDescriptor> statements
) {}
