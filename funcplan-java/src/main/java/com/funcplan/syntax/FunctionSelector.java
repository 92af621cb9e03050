package com.funcplan.syntax;

import java.util.List;
import java.util.Optional;

/**
 * Chooses the function to plan when the caller did not name one.
 * Implementations must be pure: the same candidates always give the same answer.
 */
public interface FunctionSelector {

    Optional<FunctionCandidate> select(List<FunctionCandidate> candidates);
}
