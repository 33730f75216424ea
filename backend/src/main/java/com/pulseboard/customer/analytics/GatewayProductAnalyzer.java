package com.pulseboard.customer.analytics;

import com.pulseboard.customer.dto.GatewayProductResponse;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.springframework.stereotype.Component;

/**
 * Finds the products that open customer relationships: those most often present in a
 * customer's first order, with the repeat rate and lifetime value of the customers they
 * brought in.
 */
@Component
public class GatewayProductAnalyzer {

    private final CustomerIntelligenceProperties properties;

    public GatewayProductAnalyzer(CustomerIntelligenceProperties properties) {
        this.properties = properties;
    }

    public List<GatewayProductResponse> analyze(List<CustomerRecord> customers, List<OrderRecord> orders) {
        Map<String, OrderRecord> firstOrderByEmail = new LinkedHashMap<>();
        for (OrderRecord order : orders) {
            firstOrderByEmail.merge(order.customerEmail(), order, (a, b) -> a.orderId() <= b.orderId() ? a : b);
        }

        Map<String, Set<String>> customersByProduct = new LinkedHashMap<>();
        for (Map.Entry<String, OrderRecord> entry : firstOrderByEmail.entrySet()) {
            for (LineItemRecord item : entry.getValue().lineItems()) {
                customersByProduct.computeIfAbsent(item.productKey(), key -> new LinkedHashSet<>())
                    .add(entry.getKey());
            }
        }
        if (customersByProduct.isEmpty()) {
            return List.of();
        }

        Set<String> repeatEmails = new HashSet<>();
        Map<String, Double> lifetimeValueByEmail = new HashMap<>();
        for (CustomerRecord customer : customers) {
            if (customer.ordersCount() >= 2) {
                repeatEmails.add(customer.email());
            }
            if (customer.ordersCount() >= 1) {
                lifetimeValueByEmail.put(customer.email(), customer.totalSpent());
            }
        }

        List<GatewayProductResponse> results = new ArrayList<>();
        for (Map.Entry<String, Set<String>> entry : customersByProduct.entrySet()) {
            Set<String> productCustomers = entry.getValue();
            int firstOrderCount = productCustomers.size();
            if (firstOrderCount < properties.getMinFirstOrderCount()) {
                continue;
            }

            int repeatCount = 0;
            double lifetimeValue = 0;
            for (String email : productCustomers) {
                if (repeatEmails.contains(email)) {
                    repeatCount++;
                }
                lifetimeValue += lifetimeValueByEmail.getOrDefault(email, 0.0);
            }

            results.add(new GatewayProductResponse(
                entry.getKey(),
                firstOrderCount,
                Ratios.percent(repeatCount, firstOrderCount),
                Ratios.average(lifetimeValue, firstOrderCount, 2)
            ));
        }

        return results.stream()
            .sorted(Comparator.comparingInt(GatewayProductResponse::firstOrderCount).reversed())
            .limit(Math.max(0, properties.getGatewayLimit()))
            .toList();
    }
}
