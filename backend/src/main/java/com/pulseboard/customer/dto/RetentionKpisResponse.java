package com.pulseboard.customer.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record RetentionKpisResponse(
    @JsonProperty("retained_30d")
    int retained30d,

    @JsonProperty("retention_30d_pct")
    double retention30dPct,

    @JsonProperty("retained_90d")
    int retained90d,

    @JsonProperty("retention_90d_pct")
    double retention90dPct,

    double churnRate,

    double avgOrdersLoyal
) {

    public static RetentionKpisResponse empty() {
        return new RetentionKpisResponse(0, 0, 0, 0, 0, 0);
    }
}
