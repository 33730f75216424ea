package com.pulseboard.customer.dto;

public record GatewayProductResponse(
    String product,
    int firstOrderCount,
    double repeatRate,
    double avgCustomerLtv
) {
}
