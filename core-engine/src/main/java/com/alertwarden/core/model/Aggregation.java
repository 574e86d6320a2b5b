package com.alertwarden.core.model;

import java.util.Locale;
import java.util.Objects;

/**
 * Aggregate a rule condition is evaluated on.
 *
 * <p>
 * The set of kinds is closed: {@code avg}, {@code count}, {@code ratio} and
 * {@code pNN} (percentile, e.g. {@code p95} or {@code p99.9}). The engine never
 * computes the aggregate itself; it is handed to the telemetry source as part
 * of the query.
 * </p>
 *
 * @since 1.0.0
 */
public final class Aggregation {

    /** Aggregate kinds understood by the telemetry source. */
    public enum Kind {
        AVG, COUNT, PERCENTILE, RATIO
    }

    public static final Aggregation AVG = new Aggregation(Kind.AVG, Double.NaN);
    public static final Aggregation COUNT = new Aggregation(Kind.COUNT, Double.NaN);
    public static final Aggregation RATIO = new Aggregation(Kind.RATIO, Double.NaN);

    private final Kind kind;
    private final double percentile;

    private Aggregation(Kind kind, double percentile) {
        this.kind = kind;
        this.percentile = percentile;
    }

    /**
     * Percentile aggregation.
     *
     * @param percentile value in (0, 100]
     * @return aggregation for the given percentile
     * @throws IllegalArgumentException if {@code percentile} is out of range
     */
    public static Aggregation percentile(double percentile) {
        if (!(percentile > 0 && percentile <= 100)) {
            throw new IllegalArgumentException(
                    "Percentile must be in (0, 100], got: " + percentile);
        }
        return new Aggregation(Kind.PERCENTILE, percentile);
    }

    /**
     * Parse {@code avg}, {@code average}, {@code count}, {@code ratio} or
     * {@code pNN}.
     *
     * @param text aggregation text; must not be {@code null}
     * @return parsed aggregation
     * @throws IllegalArgumentException if the text is not a supported aggregation
     */
    public static Aggregation parse(String text) {
        Objects.requireNonNull(text, "Aggregation must not be null");
        String value = text.trim().toLowerCase(Locale.ROOT);
        switch (value) {
            case "avg", "average" -> {
                return AVG;
            }
            case "count" -> {
                return COUNT;
            }
            case "ratio" -> {
                return RATIO;
            }
            default -> {
                if (value.length() > 1 && value.charAt(0) == 'p') {
                    try {
                        return percentile(Double.parseDouble(value.substring(1)));
                    } catch (NumberFormatException e) {
                        throw new IllegalArgumentException("Malformed percentile aggregation: '" + text + "'", e);
                    }
                }
                throw new IllegalArgumentException("Unknown aggregation: '" + text
                        + "'. Supported: avg, count, ratio, pNN");
            }
        }
    }

    public Kind kind() {
        return kind;
    }

    /**
     * @return the percentile for {@link Kind#PERCENTILE}, {@code NaN} otherwise
     */
    public double percentile() {
        return percentile;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Aggregation that))
            return false;
        return kind == that.kind && Double.compare(percentile, that.percentile) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, percentile);
    }

    @Override
    public String toString() {
        if (kind == Kind.PERCENTILE) {
            return percentile == Math.rint(percentile)
                    ? "p" + (long) percentile
                    : "p" + percentile;
        }
        return kind.name().toLowerCase(Locale.ROOT);
    }
}
