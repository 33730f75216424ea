package com.pulseboard.customer.dto;

import java.time.LocalDate;

public record CustomerOrderResponse(
    Integer orderNumber,
    double total,
    LocalDate date,
    String status,
    String fulfillment
) {
}
