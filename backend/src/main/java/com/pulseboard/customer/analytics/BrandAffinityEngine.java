package com.pulseboard.customer.analytics;

import com.pulseboard.customer.dto.BrandAffinityResponse;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import org.springframework.stereotype.Component;

/**
 * Co-purchase analysis between brands. For a pair bought together by {@code c} customers,
 * lift is {@code c / (P(A) * P(B) * N)} where {@code N} is the number of customers with
 * at least one branded purchase. Lift above 1 means the brands attract each other.
 */
@Component
public class BrandAffinityEngine {

    private final CustomerIntelligenceProperties properties;

    public BrandAffinityEngine(CustomerIntelligenceProperties properties) {
        this.properties = properties;
    }

    public List<BrandAffinityResponse> calculate(List<OrderRecord> orders) {
        Map<String, Set<String>> brandsByCustomer = new LinkedHashMap<>();
        for (OrderRecord order : orders) {
            for (LineItemRecord item : order.lineItems()) {
                if (item.hasBrand()) {
                    brandsByCustomer.computeIfAbsent(order.customerEmail(), key -> new TreeSet<>())
                        .add(item.brand());
                }
            }
        }

        int totalCustomers = brandsByCustomer.size();
        if (totalCustomers == 0) {
            return List.of();
        }

        Map<String, Integer> customersByBrand = new HashMap<>();
        Map<BrandPair, Integer> coPurchases = new LinkedHashMap<>();
        for (Set<String> brands : brandsByCustomer.values()) {
            List<String> sorted = new ArrayList<>(brands);
            for (int i = 0; i < sorted.size(); i++) {
                customersByBrand.merge(sorted.get(i), 1, Integer::sum);
                for (int j = i + 1; j < sorted.size(); j++) {
                    coPurchases.merge(new BrandPair(sorted.get(i), sorted.get(j)), 1, Integer::sum);
                }
            }
        }

        List<BrandAffinityResponse> results = new ArrayList<>();
        for (Map.Entry<BrandPair, Integer> entry : coPurchases.entrySet()) {
            int coPurchaseCount = entry.getValue();
            if (coPurchaseCount < properties.getMinCoPurchaseCount()) {
                continue;
            }
            BrandPair pair = entry.getKey();
            double lift = lift(
                coPurchaseCount,
                customersByBrand.getOrDefault(pair.brandA(), 0),
                customersByBrand.getOrDefault(pair.brandB(), 0),
                totalCustomers
            );
            // zero expected co-purchases
            if (lift <= 0) {
                continue;
            }
            results.add(new BrandAffinityResponse(pair.brandA(), pair.brandB(), coPurchaseCount, Ratios.round(lift, 2)));
        }

        return results.stream()
            .sorted(Comparator.comparingInt(BrandAffinityResponse::coPurchaseCount).reversed()
                .thenComparing(Comparator.comparingDouble(BrandAffinityResponse::lift).reversed()))
            .limit(Math.max(0, properties.getAffinityLimit()))
            .toList();
    }

    /**
     * Lift of a brand pair; symmetric in its two brand counts. Returns 0 when either brand
     * has no buyers.
     */
    public static double lift(int coPurchaseCount, int customersA, int customersB, int totalCustomers) {
        double expected = expectedCoPurchases(customersA, customersB, totalCustomers);
        return expected <= 0 ? 0 : coPurchaseCount / expected;
    }

    private static double expectedCoPurchases(int customersA, int customersB, int totalCustomers) {
        if (totalCustomers == 0) {
            return 0;
        }
        double probabilityA = (double) customersA / totalCustomers;
        double probabilityB = (double) customersB / totalCustomers;
        return probabilityA * probabilityB * totalCustomers;
    }

    private record BrandPair(String brandA, String brandB) {
    }
}
