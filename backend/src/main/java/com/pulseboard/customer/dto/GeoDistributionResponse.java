package com.pulseboard.customer.dto;

public record GeoDistributionResponse(
    String city,
    String state,
    String country,
    int customerCount,
    double totalRevenue,
    double avgOrders
) {
}
