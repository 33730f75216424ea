package com.pulseboard.customer.analytics;

import static com.pulseboard.customer.analytics.AnalyticsFixtures.profile;
import static org.assertj.core.api.Assertions.assertThat;

import com.pulseboard.customer.dto.RecencyBucketResponse;
import com.pulseboard.customer.dto.RetentionKpisResponse;
import java.util.List;
import org.junit.jupiter.api.Test;

class RetentionKpiCalculatorTest {

    private final RetentionKpiCalculator calculator = new RetentionKpiCalculator(new CustomerIntelligenceProperties());

    @Test
    void calculate_should_derive_retention_and_churn_from_profiles() {
        List<RfmProfile> profiles = List.of(
            profile("a@test.com", 4, 400, 10, RfmSegment.CHAMPIONS),
            profile("b@test.com", 2, 100, 60, RfmSegment.LOYAL),
            profile("c@test.com", 1, 50, 5, RfmSegment.NEW_CUSTOMERS),
            profile("d@test.com", 3, 90, 200, RfmSegment.HIBERNATING),
            profile("e@test.com", 5, 20, RfmProfile.NEVER_ORDERED_DAYS, RfmSegment.LOST)
        );

        RetentionKpisResponse kpis = calculator.calculate(profiles);

        assertThat(kpis.retained30d()).isEqualTo(1);
        assertThat(kpis.retention30dPct()).isEqualTo(20.0);
        assertThat(kpis.retained90d()).isEqualTo(2);
        assertThat(kpis.retention90dPct()).isEqualTo(40.0);
        assertThat(kpis.churnRate()).isEqualTo(40.0);
        assertThat(kpis.avgOrdersLoyal()).isEqualTo(4.0);
    }

    @Test
    void calculate_should_return_zeros_for_empty_profiles() {
        assertThat(calculator.calculate(List.of())).isEqualTo(RetentionKpisResponse.empty());
    }

    @Test
    void recency_distribution_should_bucket_repeat_customers_with_known_recency() {
        List<RfmProfile> profiles = List.of(
            profile("a@test.com", 2, 10, 0, RfmSegment.LOYAL),
            profile("b@test.com", 2, 10, 30, RfmSegment.LOYAL),
            profile("c@test.com", 3, 10, 31, RfmSegment.LOYAL),
            profile("d@test.com", 2, 10, 365, RfmSegment.AT_RISK),
            profile("e@test.com", 2, 10, 366, RfmSegment.AT_RISK),
            profile("f@test.com", 1, 10, 12, RfmSegment.NEW_CUSTOMERS),
            profile("g@test.com", 4, 10, RfmProfile.NEVER_ORDERED_DAYS, RfmSegment.LOST)
        );

        List<RecencyBucketResponse> buckets = calculator.recencyDistribution(profiles);

        assertThat(buckets).extracting(RecencyBucketResponse::label)
            .containsExactly("0-30", "31-60", "61-90", "91-180", "181-365", "365+");
        assertThat(buckets).extracting(RecencyBucketResponse::count)
            .containsExactly(2, 1, 0, 0, 1, 1);
    }
}
