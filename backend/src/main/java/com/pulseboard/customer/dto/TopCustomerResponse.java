package com.pulseboard.customer.dto;

import java.time.LocalDate;

public record TopCustomerResponse(
    String name,
    String email,
    int orders,
    double totalSpent,
    LocalDate lastOrder,
    String segment,
    long daysSince
) {
}
