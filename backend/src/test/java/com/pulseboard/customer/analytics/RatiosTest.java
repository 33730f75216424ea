package com.pulseboard.customer.analytics;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class RatiosTest {

    @ParameterizedTest
    @CsvSource({
        "300.125, 2, 300.12",
        "300.375, 2, 300.38",
        "2.675, 2, 2.67",
        "0.5, 0, 0.0",
        "1.5, 0, 2.0",
        "2.5, 0, 2.0",
        "66.66666, 1, 66.7",
        "-1.25, 1, -1.2"
    })
    void round_should_round_exact_halves_to_even(double value, int scale, double expected) {
        assertThat(Ratios.round(value, scale)).isEqualTo(expected);
    }

    @Test
    void round_should_map_non_finite_values_to_zero() {
        assertThat(Ratios.round(Double.NaN, 2)).isZero();
        assertThat(Ratios.round(Double.POSITIVE_INFINITY, 2)).isZero();
    }

    @Test
    void percent_and_average_should_return_zero_for_empty_denominator() {
        assertThat(Ratios.percent(3, 0)).isZero();
        assertThat(Ratios.average(10, 0, 2)).isZero();
        assertThat(Ratios.percent(1, 3)).isEqualTo(33.3);
        assertThat(Ratios.average(10, 4, 1)).isEqualTo(2.5);
    }
}
