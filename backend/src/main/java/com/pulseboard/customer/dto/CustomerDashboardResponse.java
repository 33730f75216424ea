package com.pulseboard.customer.dto;

import java.util.List;

public record CustomerDashboardResponse(
    PulseResponse pulse,
    OverviewKpisResponse overviewKpis,
    List<SegmentDistributionResponse> rfmDistribution,
    List<SegmentRevenueResponse> revenueBySegment,
    List<AcquisitionMonthResponse> acquisitionTrend,
    List<TopCustomerResponse> topCustomers,
    List<SegmentSummaryResponse> rfmSegments,
    CohortRetentionResponse cohortRetention,
    List<RepeatCurvePointResponse> repeatCurve,
    List<RecencyBucketResponse> daysBetweenDistribution,
    RetentionKpisResponse retentionKpis,
    List<GatewayProductResponse> gatewayProducts,
    List<BrandAffinityResponse> brandAffinity,
    List<GeoDistributionResponse> geoDistribution
) {
}
