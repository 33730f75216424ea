package com.pulseboard.customer.analytics;

import java.time.OffsetDateTime;
import java.util.List;

public record OrderRecord(
    long orderId,
    String customerEmail,
    OffsetDateTime createdAt,
    double totalPrice,
    List<LineItemRecord> lineItems
) {

    public OrderRecord {
        lineItems = lineItems == null ? List.of() : List.copyOf(lineItems);
    }
}
