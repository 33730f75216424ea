package com.pulseboard.customer.dto;

public record BrandAffinityResponse(
    String brandA,
    String brandB,
    int coPurchaseCount,
    double lift
) {
}
