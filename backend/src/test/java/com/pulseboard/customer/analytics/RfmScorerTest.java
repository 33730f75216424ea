package com.pulseboard.customer.analytics;

import static com.pulseboard.customer.analytics.AnalyticsFixtures.NOW;
import static com.pulseboard.customer.analytics.AnalyticsFixtures.customer;
import static com.pulseboard.customer.analytics.AnalyticsFixtures.order;
import static org.assertj.core.api.Assertions.assertThat;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.IntStream;
import org.junit.jupiter.api.Test;

class RfmScorerTest {

    private final RfmScorer rfmScorer = new RfmScorer();

    @Test
    void score_should_assign_monetary_quintiles_in_ascending_spend_order() {
        List<CustomerRecord> customers = List.of(
            customer("a@test.com", 1, 10),
            customer("b@test.com", 1, 20),
            customer("c@test.com", 1, 30),
            customer("d@test.com", 1, 40),
            customer("e@test.com", 1, 100)
        );
        List<OrderRecord> orders = customers.stream()
            .map(c -> order(1, c.email(), NOW.minusDays(10)))
            .toList();

        List<RfmProfile> profiles = rfmScorer.score(customers, orders, NOW);

        assertThat(profiles).extracting(RfmProfile::monetaryScore).containsExactly(1, 2, 3, 4, 5);
    }

    @Test
    void score_should_give_most_recent_buyer_the_top_recency_score() {
        List<CustomerRecord> customers = List.of(
            customer("old@test.com", 2, 50),
            customer("recent@test.com", 2, 50),
            customer("mid@test.com", 2, 50),
            customer("older@test.com", 2, 50),
            customer("oldest@test.com", 2, 50)
        );
        List<OrderRecord> orders = List.of(
            order(1, "old@test.com", NOW.minusDays(200)),
            order(2, "recent@test.com", NOW.minusDays(2)),
            order(3, "recent@test.com", NOW.minusDays(90)),
            order(4, "mid@test.com", NOW.minusDays(40)),
            order(5, "older@test.com", NOW.minusDays(300)),
            order(6, "oldest@test.com", NOW.minusDays(500))
        );

        List<RfmProfile> profiles = rfmScorer.score(customers, orders, NOW);

        assertThat(profiles).extracting(RfmProfile::recencyScore).containsExactly(3, 5, 4, 2, 1);
        assertThat(profiles.get(1).daysSinceLastOrder()).isEqualTo(2);
        assertThat(profiles.get(1).lastOrderAt()).isEqualTo(NOW.minusDays(2));
    }

    @Test
    void score_should_treat_customers_without_order_rows_as_never_ordered() {
        List<CustomerRecord> customers = List.of(
            customer("ghost@test.com", 3, 300),
            customer("a@test.com", 1, 10),
            customer("b@test.com", 1, 10),
            customer("c@test.com", 1, 10),
            customer("d@test.com", 1, 10)
        );
        List<OrderRecord> orders = List.of(
            order(1, "a@test.com", NOW.minusDays(1)),
            order(2, "b@test.com", NOW.minusDays(1)),
            order(3, "c@test.com", NOW.minusDays(1)),
            order(4, "d@test.com", NOW.minusDays(1))
        );

        RfmProfile ghost = rfmScorer.score(customers, orders, NOW).get(0);

        assertThat(ghost.daysSinceLastOrder()).isEqualTo(RfmProfile.NEVER_ORDERED_DAYS);
        assertThat(ghost.hasOrderHistory()).isFalse();
        assertThat(ghost.lastOrderAt()).isNull();
        assertThat(ghost.recencyScore()).isEqualTo(1);
    }

    @Test
    void score_should_clamp_future_orders_to_zero_days() {
        List<RfmProfile> profiles = rfmScorer.score(
            List.of(customer("a@test.com", 1, 10)),
            List.of(order(1, "a@test.com", NOW.plusHours(5))),
            NOW
        );

        assertThat(profiles.get(0).daysSinceLastOrder()).isZero();
    }

    @Test
    void score_should_skip_customers_without_orders_or_spend() {
        List<RfmProfile> profiles = rfmScorer.score(
            List.of(customer("a@test.com", 0, 10), customer("b@test.com", 2, 0), customer("c@test.com", 1, 5)),
            List.of(),
            NOW
        );

        assertThat(profiles).extracting(profile -> profile.customer().email()).containsExactly("c@test.com");
    }

    @Test
    void score_should_return_empty_for_empty_input() {
        assertThat(rfmScorer.score(List.of(), List.of(), NOW)).isEmpty();
    }

    @Test
    void score_should_break_ties_by_input_order() {
        List<CustomerRecord> customers = IntStream.range(0, 5)
            .mapToObj(i -> customer("c" + i + "@test.com", 2, 75))
            .toList();

        List<RfmProfile> profiles = rfmScorer.score(customers, List.of(), NOW);

        assertThat(profiles).extracting(RfmProfile::frequencyScore).containsExactly(1, 2, 3, 4, 5);
        assertThat(profiles).extracting(RfmProfile::monetaryScore).containsExactly(1, 2, 3, 4, 5);
    }

    @Test
    void quintile_buckets_should_differ_in_size_by_at_most_one() {
        for (int n = 1; n <= 60; n++) {
            int[] sizes = new int[6];
            for (int rank = 0; rank < n; rank++) {
                int quintile = RfmScorer.quintile(rank, n);
                assertThat(quintile).isBetween(1, 5);
                sizes[quintile]++;
            }
            int[] buckets = Arrays.copyOfRange(sizes, 1, 6);
            int max = Arrays.stream(buckets).max().orElseThrow();
            int min = Arrays.stream(buckets).min().orElseThrow();
            assertThat(max - min).as("bucket sizes for n=%d", n).isLessThanOrEqualTo(1);
        }
    }

    @Test
    void score_should_give_every_customer_exactly_one_segment() {
        List<CustomerRecord> customers = new ArrayList<>();
        List<OrderRecord> orders = new ArrayList<>();
        for (int i = 0; i < 37; i++) {
            String email = "c" + i + "@test.com";
            customers.add(customer(email, 1 + i % 7, 10 + (i * 37) % 400));
            orders.add(order(i, email, NOW.minusDays((i * 13) % 365)));
        }

        List<RfmProfile> profiles = rfmScorer.score(customers, orders, NOW);

        assertThat(profiles).hasSize(37);
        assertThat(profiles).allSatisfy(profile -> {
            assertThat(profile.segment()).isNotNull();
            assertThat(profile.segment())
                .isEqualTo(RfmSegmentClassifier.classify(profile.recencyScore(), profile.frequencyScore(), profile.monetaryScore()));
        });
        assertThat(rfmScorer.score(customers, orders, NOW)).isEqualTo(profiles);
    }
}
