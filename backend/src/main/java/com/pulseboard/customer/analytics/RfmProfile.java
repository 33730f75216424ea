package com.pulseboard.customer.analytics;

import java.time.OffsetDateTime;

public record RfmProfile(
    CustomerRecord customer,
    long daysSinceLastOrder,
    OffsetDateTime lastOrderAt,
    int recencyScore,
    int frequencyScore,
    int monetaryScore,
    RfmSegment segment
) {

    /** Recency assigned to customers with no order rows in the stream. */
    public static final long NEVER_ORDERED_DAYS = 9999;

    public boolean hasOrderHistory() {
        return daysSinceLastOrder < NEVER_ORDERED_DAYS;
    }

    public int ordersCount() {
        return customer.ordersCount();
    }

    public double totalSpent() {
        return customer.totalSpent();
    }
}
