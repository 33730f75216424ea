package com.pulseboard.customer.analytics;

import static com.pulseboard.customer.analytics.AnalyticsFixtures.order;
import static org.assertj.core.api.Assertions.assertThat;

import com.pulseboard.customer.dto.CohortRetentionResponse;
import com.pulseboard.customer.dto.CohortRowResponse;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class CohortRetentionCalculatorTest {

    private final CustomerIntelligenceProperties properties = new CustomerIntelligenceProperties();

    private final CohortRetentionCalculator calculator = new CohortRetentionCalculator(properties);

    @Test
    void calculate_should_report_share_of_cohort_reordering_in_following_month() {
        List<OrderRecord> orders = new ArrayList<>();
        long orderId = 1;
        for (int i = 0; i < 10; i++) {
            orders.add(order(orderId++, "c" + i + "@test.com", at(2025, 1, 5 + i)));
        }
        for (int i = 0; i < 6; i++) {
            orders.add(order(orderId++, "c" + i + "@test.com", at(2025, 2, 10)));
        }
        orders.add(order(orderId, "c0@test.com", at(2025, 2, 20)));

        CohortRetentionResponse response = calculator.calculate(orders);

        assertThat(response.maxMonths()).isEqualTo(12);
        assertThat(response.cohorts()).hasSize(1);
        CohortRowResponse cohort = response.cohorts().get(0);
        assertThat(cohort.cohort()).isEqualTo("2025-01");
        assertThat(cohort.size()).isEqualTo(10);
        assertThat(cohort.retention()).hasSize(12);
        assertThat(cohort.retention().get(0)).isEqualTo(100.0);
        assertThat(cohort.retention().get(1)).isEqualTo(60.0);
        assertThat(cohort.retention().subList(2, 12)).containsOnly(0.0);
    }

    @Test
    void calculate_should_keep_only_the_most_recent_cohorts() {
        List<OrderRecord> orders = new ArrayList<>();
        OffsetDateTime start = at(2024, 1, 15);
        for (int month = 0; month < 14; month++) {
            orders.add(order(month + 1, "c" + month + "@test.com", start.plusMonths(month)));
        }

        CohortRetentionResponse response = calculator.calculate(orders);

        assertThat(response.cohorts()).hasSize(12);
        assertThat(response.cohorts().get(0).cohort()).isEqualTo("2024-03");
        assertThat(response.cohorts().get(11).cohort()).isEqualTo("2025-02");
        assertThat(response.cohorts()).allSatisfy(row -> assertThat(row.retention().get(0)).isEqualTo(100.0));
    }

    @Test
    void calculate_should_bucket_months_in_configured_zone() {
        properties.setZone("Australia/Sydney");
        OffsetDateTime lateJanuaryUtc = OffsetDateTime.of(2025, 1, 31, 20, 0, 0, 0, ZoneOffset.UTC);

        CohortRetentionResponse response = calculator.calculate(List.of(order(1, "a@test.com", lateJanuaryUtc)));

        assertThat(response.cohorts()).extracting(CohortRowResponse::cohort).containsExactly("2025-02");
    }

    @Test
    void calculate_should_return_empty_payload_without_orders() {
        CohortRetentionResponse response = calculator.calculate(List.of());

        assertThat(response.cohorts()).isEmpty();
        assertThat(response.maxMonths()).isZero();
    }

    private static OffsetDateTime at(int year, int month, int day) {
        return OffsetDateTime.of(year, month, day, 10, 0, 0, 0, ZoneOffset.UTC);
    }
}
