package com.pulseboard.customer.analytics;

import com.pulseboard.customer.dto.GeoDistributionResponse;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

@Component
public class GeoDistributionAggregator {

    private final CustomerIntelligenceProperties properties;

    public GeoDistributionAggregator(CustomerIntelligenceProperties properties) {
        this.properties = properties;
    }

    public List<GeoDistributionResponse> aggregate(List<CustomerRecord> customers) {
        Map<Location, LocationAggregate> aggregates = new LinkedHashMap<>();
        for (CustomerRecord customer : customers) {
            if (customer.city() == null || customer.city().isBlank()) {
                continue;
            }
            Location location = new Location(customer.city(), nullToEmpty(customer.region()), nullToEmpty(customer.country()));
            LocationAggregate aggregate = aggregates.computeIfAbsent(location, key -> new LocationAggregate());
            aggregate.customers++;
            aggregate.revenue += customer.totalSpent();
            aggregate.orders += customer.ordersCount();
        }

        return aggregates.entrySet().stream()
            .map(entry -> new GeoDistributionResponse(
                entry.getKey().city(),
                entry.getKey().state(),
                entry.getKey().country(),
                entry.getValue().customers,
                Ratios.round(entry.getValue().revenue, 2),
                Ratios.average(entry.getValue().orders, entry.getValue().customers, 1)
            ))
            .sorted(Comparator.comparingDouble(GeoDistributionResponse::totalRevenue).reversed())
            .limit(Math.max(0, properties.getGeoLimit()))
            .toList();
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }

    private record Location(String city, String state, String country) {
    }

    private static final class LocationAggregate {

        private int customers;
        private double revenue;
        private long orders;
    }
}
