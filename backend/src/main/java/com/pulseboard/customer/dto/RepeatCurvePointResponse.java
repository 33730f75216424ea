package com.pulseboard.customer.dto;

public record RepeatCurvePointResponse(
    int orderNumber,
    long customers,
    double pct
) {
}
