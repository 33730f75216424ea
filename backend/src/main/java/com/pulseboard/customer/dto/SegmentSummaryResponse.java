package com.pulseboard.customer.dto;

public record SegmentSummaryResponse(
    String segment,
    int count,
    double pct,
    double avgOrders,
    double avgSpend,
    long avgRecency,
    double totalRevenue,
    String color,
    String description,
    String action
) {
}
