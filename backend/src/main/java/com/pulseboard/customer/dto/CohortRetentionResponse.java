package com.pulseboard.customer.dto;

import java.util.List;

public record CohortRetentionResponse(
    List<CohortRowResponse> cohorts,
    int maxMonths
) {

    public static CohortRetentionResponse empty() {
        return new CohortRetentionResponse(List.of(), 0);
    }
}
