package com.pulseboard.customer.dto;

import java.time.LocalDate;
import java.util.List;

public record CustomerDetailResponse(
    String email,
    String name,
    String segment,
    int rScore,
    int fScore,
    int mScore,
    int totalOrders,
    double totalSpent,
    double avgOrderValue,
    long daysSinceLastOrder,
    LocalDate firstOrderDate,
    LocalDate lastOrderDate,
    long customerSinceMonths,
    String city,
    String state,
    String country,
    List<String> flags,
    List<CustomerOrderResponse> orders
) {
}
