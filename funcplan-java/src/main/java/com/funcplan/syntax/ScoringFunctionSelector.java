package com.funcplan.syntax;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Default {@link FunctionSelector}.
 * A candidate named {@value #PREFERRED_NAME} wins outright; otherwise the highest
 * {@link #score(FunctionCandidate)} wins, earlier declarations breaking ties.
 */
public class ScoringFunctionSelector implements FunctionSelector {

    public static final String PREFERRED_NAME = "plan";

    @Override
    public Optional<FunctionCandidate> select(List<FunctionCandidate> candidates) {
        Optional<FunctionCandidate> preferred = candidates.stream()
                .filter(c -> PREFERRED_NAME.equals(c.name()))
                .min(Comparator.comparingInt(FunctionCandidate::order));
        if (preferred.isPresent()) {
            return preferred;
        }
        return candidates.stream()
                .max(Comparator.comparingInt(ScoringFunctionSelector::score)
                        .thenComparing(Comparator.comparingInt(FunctionCandidate::order).reversed()));
    }

    /** statements + 2 x control-flow statements */
    public static int score(FunctionCandidate candidate) {
        return candidate.statementCount() + 2 * candidate.controlFlowCount();
    }
}
