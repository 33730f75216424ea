package com.pulseboard.customer.analytics;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class RfmSegmentClassifierTest {

    @ParameterizedTest
    @CsvSource({
        "5, 5, 5, CHAMPIONS",
        "4, 4, 4, CHAMPIONS",
        "1, 3, 3, LOYAL",
        "5, 5, 3, LOYAL",
        "3, 2, 2, POTENTIAL_LOYALIST",
        "4, 2, 1, PROMISING",
        "5, 1, 1, NEW_CUSTOMERS",
        "5, 1, 5, NEW_CUSTOMERS",
        "2, 2, 2, NEED_ATTENTION",
        "2, 1, 1, ABOUT_TO_SLEEP",
        "3, 1, 5, ABOUT_TO_SLEEP",
        "1, 3, 1, AT_RISK",
        "1, 2, 2, HIBERNATING",
        "1, 1, 1, LOST",
        "1, 2, 1, LOST"
    })
    void classify_should_follow_rule_priority(int r, int f, int m, RfmSegment expected) {
        assertThat(RfmSegmentClassifier.classify(r, f, m)).isEqualTo(expected);
    }

    @Test
    void classify_should_be_total_and_deterministic_over_all_score_triples() {
        for (int r = 1; r <= 5; r++) {
            for (int f = 1; f <= 5; f++) {
                for (int m = 1; m <= 5; m++) {
                    RfmSegment first = RfmSegmentClassifier.classify(r, f, m);
                    assertThat(first).isNotNull();
                    assertThat(RfmSegmentClassifier.classify(r, f, m)).isSameAs(first);
                }
            }
        }
    }

    @Test
    void new_customers_rule_should_be_reachable_ahead_of_promising() {
        int newCustomers = 0;
        int promising = 0;
        for (int m = 1; m <= 5; m++) {
            for (int r = 4; r <= 5; r++) {
                if (RfmSegmentClassifier.classify(r, 1, m) == RfmSegment.NEW_CUSTOMERS) {
                    newCustomers++;
                }
                if (RfmSegmentClassifier.classify(r, 2, m) == RfmSegment.PROMISING) {
                    promising++;
                }
            }
        }

        assertThat(newCustomers).isEqualTo(10);
        assertThat(promising).isEqualTo(2);
    }

    @Test
    void rules_should_be_listed_in_priority_order_with_lost_as_fallback() {
        assertThat(RfmSegmentClassifier.RULES)
            .extracting(RfmSegmentClassifier.SegmentRule::segment)
            .containsExactly(
                RfmSegment.CHAMPIONS,
                RfmSegment.LOYAL,
                RfmSegment.POTENTIAL_LOYALIST,
                RfmSegment.PROMISING,
                RfmSegment.NEW_CUSTOMERS,
                RfmSegment.NEED_ATTENTION,
                RfmSegment.ABOUT_TO_SLEEP,
                RfmSegment.AT_RISK,
                RfmSegment.HIBERNATING
            );
    }
}
