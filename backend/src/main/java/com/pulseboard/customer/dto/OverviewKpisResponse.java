package com.pulseboard.customer.dto;

public record OverviewKpisResponse(
    long totalCustomers,
    int activeCustomers,
    double avgOrders,
    double avgLtv,
    long newThisMonth,
    double repeatRate,
    int atRiskCount,
    int avgDaysBetween
) {
}
