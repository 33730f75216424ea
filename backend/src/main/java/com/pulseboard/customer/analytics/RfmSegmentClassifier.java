package com.pulseboard.customer.analytics;

import java.util.List;

/**
 * Maps an (r, f, m) score triple to a segment. Rules are evaluated top to bottom and the
 * first match wins; {@link RfmSegment#LOST} is the fallback, so the mapping is total.
 */
public final class RfmSegmentClassifier {

    @FunctionalInterface
    public interface ScorePredicate {

        boolean test(int r, int f, int m);
    }

    public record SegmentRule(RfmSegment segment, ScorePredicate predicate) {

        boolean matches(int r, int f, int m) {
            return predicate.test(r, f, m);
        }
    }

    public static final List<SegmentRule> RULES = List.of(
        new SegmentRule(RfmSegment.CHAMPIONS, (r, f, m) -> r >= 4 && f >= 4 && m >= 4),
        new SegmentRule(RfmSegment.LOYAL, (r, f, m) -> f >= 3 && m >= 3),
        new SegmentRule(RfmSegment.POTENTIAL_LOYALIST, (r, f, m) -> r >= 3 && f >= 2 && m >= 2),
        new SegmentRule(RfmSegment.PROMISING, (r, f, m) -> r >= 4 && f <= 2 && f != 1),
        new SegmentRule(RfmSegment.NEW_CUSTOMERS, (r, f, m) -> r >= 4 && f == 1),
        new SegmentRule(RfmSegment.NEED_ATTENTION, (r, f, m) -> r >= 2 && r <= 3 && f >= 2 && m >= 2),
        new SegmentRule(RfmSegment.ABOUT_TO_SLEEP, (r, f, m) -> r >= 2 && r <= 3 && f <= 2),
        new SegmentRule(RfmSegment.AT_RISK, (r, f, m) -> r <= 2 && f >= 3),
        new SegmentRule(RfmSegment.HIBERNATING, (r, f, m) -> r <= 2 && f <= 2 && m >= 2)
    );

    private RfmSegmentClassifier() {
    }

    public static RfmSegment classify(int r, int f, int m) {
        for (SegmentRule rule : RULES) {
            if (rule.matches(r, f, m)) {
                return rule.segment();
            }
        }
        return RfmSegment.LOST;
    }
}
