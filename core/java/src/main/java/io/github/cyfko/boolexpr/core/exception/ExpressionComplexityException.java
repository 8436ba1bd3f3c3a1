package io.github.cyfko.boolexpr.core.exception;

import io.github.cyfko.boolexpr.core.config.EnginePolicy;

/**
 * Exception thrown when an operation would exceed a limit of the {@link EnginePolicy}.
 * <p>
 * Exhaustive equivalence checking evaluates both expressions under {@code 2^n} interpretations for
 * {@code n} distinct variables; above {@link EnginePolicy#maxEquivalenceVariables()} the check is refused
 * rather than left running.
 * </p>
 *
 * @author cyfko
 * @since 1.0.0
 */
public class ExpressionComplexityException extends RuntimeException {

    private final int variableCount;
    private final int limit;

    /**
     * @param variableCount the number of variables the operation needed
     * @param limit         the configured limit
     */
    public ExpressionComplexityException(int variableCount, int limit) {
        super(String.format(
            "Equivalence check over %d variables exceeds the configured limit (max: %d)",
            variableCount, limit));
        this.variableCount = variableCount;
        this.limit = limit;
    }

    public int getVariableCount() {
        return variableCount;
    }

    public int getLimit() {
        return limit;
    }
}
