package com.pulseboard.customer.analytics;

import com.pulseboard.customer.dto.RecencyBucketResponse;
import com.pulseboard.customer.dto.RetentionKpisResponse;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Retention figures derived from scored profiles. Recency always comes from the profile,
 * which was computed from the order stream.
 */
@Component
public class RetentionKpiCalculator {

    private static final List<RecencyBucket> RECENCY_BUCKETS = List.of(
        new RecencyBucket("0-30", 0, 30),
        new RecencyBucket("31-60", 31, 60),
        new RecencyBucket("61-90", 61, 90),
        new RecencyBucket("91-180", 91, 180),
        new RecencyBucket("181-365", 181, 365),
        new RecencyBucket("365+", 366, Long.MAX_VALUE)
    );

    private final CustomerIntelligenceProperties properties;

    public RetentionKpiCalculator(CustomerIntelligenceProperties properties) {
        this.properties = properties;
    }

    public RetentionKpisResponse calculate(List<RfmProfile> profiles) {
        if (profiles.isEmpty()) {
            return RetentionKpisResponse.empty();
        }

        int retainedShort = 0;
        int retainedLong = 0;
        int churned = 0;
        int loyalCount = 0;
        long loyalOrders = 0;

        for (RfmProfile profile : profiles) {
            if (profile.ordersCount() >= 2) {
                if (profile.daysSinceLastOrder() <= properties.getRetentionShortWindowDays()) {
                    retainedShort++;
                }
                if (profile.daysSinceLastOrder() <= properties.getRetentionLongWindowDays()) {
                    retainedLong++;
                }
            }
            if (RfmSegment.CHURNED.contains(profile.segment())) {
                churned++;
            }
            if (profile.ordersCount() >= 3) {
                loyalCount++;
                loyalOrders += profile.ordersCount();
            }
        }

        int total = profiles.size();
        return new RetentionKpisResponse(
            retainedShort,
            Ratios.percent(retainedShort, total),
            retainedLong,
            Ratios.percent(retainedLong, total),
            Ratios.percent(churned, total),
            Ratios.average(loyalOrders, loyalCount, 1)
        );
    }

    /** Histogram of days since last order for repeat customers with a known last order. */
    public List<RecencyBucketResponse> recencyDistribution(List<RfmProfile> profiles) {
        int[] counts = new int[RECENCY_BUCKETS.size()];
        for (RfmProfile profile : profiles) {
            if (profile.ordersCount() < 2 || !profile.hasOrderHistory()) {
                continue;
            }
            for (int i = 0; i < RECENCY_BUCKETS.size(); i++) {
                if (RECENCY_BUCKETS.get(i).contains(profile.daysSinceLastOrder())) {
                    counts[i]++;
                    break;
                }
            }
        }

        List<RecencyBucketResponse> buckets = new ArrayList<>(RECENCY_BUCKETS.size());
        for (int i = 0; i < RECENCY_BUCKETS.size(); i++) {
            buckets.add(new RecencyBucketResponse(RECENCY_BUCKETS.get(i).label(), counts[i]));
        }
        return buckets;
    }

    private record RecencyBucket(String label, long minDays, long maxDays) {

        boolean contains(long days) {
            return days >= minDays && days <= maxDays;
        }
    }
}
