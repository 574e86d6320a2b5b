package com.alertwarden.core.model;

import java.util.Objects;

/**
 * Closed set of comparators a rule condition may use against its threshold.
 *
 * <p>
 * Comparison is exact: no epsilon is applied, so {@link #EQUAL} only matches
 * values that are numerically identical to the threshold.
 * </p>
 *
 * @since 1.0.0
 */
public enum ComparisonOperator {

    GREATER_THAN(">", "GreaterThan"),
    GREATER_OR_EQUAL(">=", "GreaterThanOrEqual"),
    LESS_THAN("<", "LessThan"),
    LESS_OR_EQUAL("<=", "LessThanOrEqual"),
    EQUAL("==", "Equals");

    private final String symbol;
    private final String operatorName;

    ComparisonOperator(String symbol, String operatorName) {
        this.symbol = symbol;
        this.operatorName = operatorName;
    }

    /**
     * @return the symbolic form, e.g. {@code >=}
     */
    public String symbol() {
        return symbol;
    }

    /**
     * Apply the comparator.
     *
     * @param value     observed aggregate value
     * @param threshold configured threshold
     * @return {@code true} when {@code value <op> threshold} holds
     */
    public boolean test(double value, double threshold) {
        return switch (this) {
            case GREATER_THAN -> value > threshold;
            case GREATER_OR_EQUAL -> value >= threshold;
            case LESS_THAN -> value < threshold;
            case LESS_OR_EQUAL -> value <= threshold;
            case EQUAL -> Double.compare(value, threshold) == 0;
        };
    }

    /**
     * Parse an operator from its symbol ({@code >}), its operator name
     * ({@code GreaterThan}) or its enum constant name, case-insensitively.
     *
     * @param text operator text; must not be {@code null}
     * @return the matching operator
     * @throws IllegalArgumentException if nothing matches
     */
    public static ComparisonOperator parse(String text) {
        Objects.requireNonNull(text, "Operator must not be null");
        String trimmed = text.trim();
        for (ComparisonOperator op : values()) {
            if (op.symbol.equals(trimmed)
                    || op.operatorName.equalsIgnoreCase(trimmed)
                    || op.name().equalsIgnoreCase(trimmed)) {
                return op;
            }
        }
        if ("=".equals(trimmed)) {
            return EQUAL;
        }
        throw new IllegalArgumentException("Unknown comparison operator: '" + text
                + "'. Supported: >, >=, <, <=, ==");
    }

    @Override
    public String toString() {
        return symbol;
    }
}
