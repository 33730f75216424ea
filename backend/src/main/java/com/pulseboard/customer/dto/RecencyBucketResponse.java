package com.pulseboard.customer.dto;

public record RecencyBucketResponse(
    String label,
    int count
) {
}
