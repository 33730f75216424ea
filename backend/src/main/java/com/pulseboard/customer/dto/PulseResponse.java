package com.pulseboard.customer.dto;

public record PulseResponse(
    String narrative,
    String status,
    String proNarrative
) {
}
