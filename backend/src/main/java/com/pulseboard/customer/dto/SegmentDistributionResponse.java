package com.pulseboard.customer.dto;

public record SegmentDistributionResponse(
    String segment,
    int count,
    double pct,
    String color
) {
}
