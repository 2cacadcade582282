package io.github.eutro.ilcore.il;

/**
 * The comparison performed by a {@link Comp} instruction.
 */
public enum ComparisonKind {
    EQUALITY("=="),
    INEQUALITY("!="),
    LESS_THAN("<"),
    LESS_THAN_OR_EQUAL("<="),
    GREATER_THAN(">"),
    GREATER_THAN_OR_EQUAL(">=");

    private final String operator;

    ComparisonKind(String operator) {
        this.operator = operator;
    }

    /**
     * Get the operator this comparison is rendered with.
     *
     * @return The operator.
     */
    public String getOperator() {
        return operator;
    }
}
