package com.pulseboard.customer.analytics;

import java.time.OffsetDateTime;

public record CustomerRecord(
    String email,
    String firstName,
    String lastName,
    int ordersCount,
    double totalSpent,
    OffsetDateTime createdAt,
    String city,
    String region,
    String country
) {

    public String displayName() {
        String name = (firstName + " " + lastName).trim();
        return name.isEmpty() ? email : name;
    }

    public boolean isScorable() {
        return ordersCount > 0 && totalSpent > 0;
    }
}
