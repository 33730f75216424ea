package com.pulseboard.customer.analytics;

import com.pulseboard.customer.dto.SegmentDistributionResponse;
import com.pulseboard.customer.dto.SegmentRevenueResponse;
import com.pulseboard.customer.dto.SegmentSummaryResponse;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Per-segment rollups of scored profiles. Every segment is reported, including empty ones,
 * so consumers always see all ten rows.
 */
@Component
public class SegmentBreakdownCalculator {

    public List<SegmentDistributionResponse> distribution(List<RfmProfile> profiles) {
        Map<RfmSegment, SegmentAggregate> aggregates = aggregate(profiles);
        return aggregates.entrySet().stream()
            .map(entry -> new SegmentDistributionResponse(
                entry.getKey().label(),
                entry.getValue().count,
                Ratios.percent(entry.getValue().count, profiles.size()),
                entry.getKey().color()
            ))
            .sorted(Comparator.comparingInt(SegmentDistributionResponse::count).reversed())
            .toList();
    }

    public List<SegmentRevenueResponse> revenue(List<RfmProfile> profiles) {
        return aggregate(profiles).entrySet().stream()
            .map(entry -> new SegmentRevenueResponse(
                entry.getKey().label(),
                Ratios.round(entry.getValue().revenue, 2),
                entry.getKey().color()
            ))
            .sorted(Comparator.comparingDouble(SegmentRevenueResponse::revenue).reversed())
            .toList();
    }

    public List<SegmentSummaryResponse> summary(List<RfmProfile> profiles) {
        return aggregate(profiles).entrySet().stream()
            .map(entry -> {
                RfmSegment segment = entry.getKey();
                SegmentAggregate aggregate = entry.getValue();
                return new SegmentSummaryResponse(
                    segment.label(),
                    aggregate.count,
                    Ratios.percent(aggregate.count, profiles.size()),
                    Ratios.average(aggregate.orders, aggregate.count, 1),
                    Ratios.average(aggregate.revenue, aggregate.count, 2),
                    (long) Ratios.average(aggregate.recencyDays, aggregate.count, 0),
                    Ratios.round(aggregate.revenue, 2),
                    segment.color(),
                    segment.description(),
                    segment.action()
                );
            })
            .sorted(Comparator.comparingDouble(SegmentSummaryResponse::totalRevenue).reversed())
            .toList();
    }

    private Map<RfmSegment, SegmentAggregate> aggregate(List<RfmProfile> profiles) {
        Map<RfmSegment, SegmentAggregate> aggregates = new EnumMap<>(RfmSegment.class);
        for (RfmSegment segment : RfmSegment.values()) {
            aggregates.put(segment, new SegmentAggregate());
        }
        for (RfmProfile profile : profiles) {
            SegmentAggregate aggregate = aggregates.get(profile.segment());
            aggregate.count++;
            aggregate.orders += profile.ordersCount();
            aggregate.revenue += profile.totalSpent();
            aggregate.recencyDays += profile.daysSinceLastOrder();
        }
        return aggregates;
    }

    private static final class SegmentAggregate {

        private int count;
        private long orders;
        private double revenue;
        private long recencyDays;
    }
}
