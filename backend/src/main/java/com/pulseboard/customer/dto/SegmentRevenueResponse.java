package com.pulseboard.customer.dto;

public record SegmentRevenueResponse(
    String segment,
    double revenue,
    String color
) {
}
