package com.pulseboard.customer.dto;

public record AcquisitionMonthResponse(
    String month,
    int count
) {
}
