package com.pulseboard.customer.analytics;

import com.pulseboard.customer.dto.RepeatCurvePointResponse;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Component;

@Component
public class RepeatPurchaseCurveCalculator {

    private final CustomerIntelligenceProperties properties;

    public RepeatPurchaseCurveCalculator(CustomerIntelligenceProperties properties) {
        this.properties = properties;
    }

    /** Share of purchasing customers who reached at least N orders, for N = 1..max. */
    public List<RepeatCurvePointResponse> calculate(List<CustomerRecord> customers) {
        int maxOrders = Math.max(1, properties.getRepeatCurveMaxOrders());

        // customersAtLeast[n] = customers with orders_count >= n
        long[] customersAtLeast = new long[maxOrders + 1];
        for (CustomerRecord customer : customers) {
            int reached = Math.min(customer.ordersCount(), maxOrders);
            for (int n = 1; n <= reached; n++) {
                customersAtLeast[n]++;
            }
        }

        long purchasers = customersAtLeast[1];
        List<RepeatCurvePointResponse> curve = new ArrayList<>(maxOrders);
        for (int n = 1; n <= maxOrders; n++) {
            curve.add(new RepeatCurvePointResponse(n, customersAtLeast[n], Ratios.percent(customersAtLeast[n], purchasers)));
        }
        return curve;
    }
}
