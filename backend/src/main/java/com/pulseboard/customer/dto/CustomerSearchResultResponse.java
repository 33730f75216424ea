package com.pulseboard.customer.dto;

import java.time.LocalDate;

public record CustomerSearchResultResponse(
    String email,
    String name,
    int orders,
    double totalSpent,
    LocalDate lastOrder
) {
}
