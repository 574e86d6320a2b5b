package com.alertwarden.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link ComparisonOperator}.
 */
class ComparisonOperatorTest {

    @ParameterizedTest(name = "{1} {0} {2} -> {3}")
    @CsvSource({
            ">,  5.0, 4.0, true",
            ">,  4.0, 4.0, false",
            ">=, 4.0, 4.0, true",
            "<,  3.9, 4.0, true",
            "<,  4.0, 4.0, false",
            "<=, 4.0, 4.0, true",
            "==, 4.0, 4.0, true",
            "==, 4.0, 4.000001, false"
    })
    @DisplayName("Should compare value against threshold")
    void shouldCompare(String symbol, double value, double threshold, boolean expected) {
        assertThat(ComparisonOperator.parse(symbol).test(value, threshold)).isEqualTo(expected);
    }

    @Test
    @DisplayName("Should parse symbols, operator names and constant names")
    void shouldParseAllSpellings() {
        assertThat(ComparisonOperator.parse(">=")).isEqualTo(ComparisonOperator.GREATER_OR_EQUAL);
        assertThat(ComparisonOperator.parse("GreaterThanOrEqual")).isEqualTo(ComparisonOperator.GREATER_OR_EQUAL);
        assertThat(ComparisonOperator.parse("less_than")).isEqualTo(ComparisonOperator.LESS_THAN);
        assertThat(ComparisonOperator.parse(" = ")).isEqualTo(ComparisonOperator.EQUAL);
    }

    @Test
    @DisplayName("Should reject unknown operators")
    void shouldRejectUnknown() {
        assertThatThrownBy(() -> ComparisonOperator.parse("!="))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unknown comparison operator");
    }

    @Test
    @DisplayName("Should render as symbol")
    void shouldRenderSymbol() {
        assertThat(ComparisonOperator.LESS_OR_EQUAL).hasToString("<=");
    }
}
