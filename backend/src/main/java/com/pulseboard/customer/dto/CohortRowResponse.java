package com.pulseboard.customer.dto;

import java.util.List;

public record CohortRowResponse(
    String cohort,
    int size,
    List<Double> retention
) {
}
