package com.alertwarden.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link Aggregation}.
 */
class AggregationTest {

    @Test
    @DisplayName("Should parse named aggregations case-insensitively")
    void shouldParseNamed() {
        assertThat(Aggregation.parse("AVG")).isSameAs(Aggregation.AVG);
        assertThat(Aggregation.parse("average")).isSameAs(Aggregation.AVG);
        assertThat(Aggregation.parse("count")).isSameAs(Aggregation.COUNT);
        assertThat(Aggregation.parse(" Ratio ")).isSameAs(Aggregation.RATIO);
    }

    @Test
    @DisplayName("Should parse percentiles")
    void shouldParsePercentiles() {
        Aggregation p95 = Aggregation.parse("p95");
        assertThat(p95.kind()).isEqualTo(Aggregation.Kind.PERCENTILE);
        assertThat(p95.percentile()).isEqualTo(95.0);
        assertThat(p95).isEqualTo(Aggregation.percentile(95)).hasToString("p95");
        assertThat(Aggregation.parse("p99.9")).hasToString("p99.9");
    }

    @Test
    @DisplayName("Should reject out-of-range and malformed percentiles")
    void shouldRejectBadPercentiles() {
        assertThatThrownBy(() -> Aggregation.parse("p0"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("(0, 100]");
        assertThatThrownBy(() -> Aggregation.parse("p101"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Aggregation.parse("pxx"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Malformed percentile");
    }

    @Test
    @DisplayName("Should reject unknown aggregations")
    void shouldRejectUnknown() {
        assertThatThrownBy(() -> Aggregation.parse("median"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unknown aggregation");
    }
}
