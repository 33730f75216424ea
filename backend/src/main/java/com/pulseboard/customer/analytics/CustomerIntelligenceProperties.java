package com.pulseboard.customer.analytics;

import java.time.ZoneId;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "customer.intelligence")
public class CustomerIntelligenceProperties {

    private String zone = "UTC";

    private int activeWindowDays = 90;

    private int retentionShortWindowDays = 30;

    private int retentionLongWindowDays = 90;

    private int cohortMonths = 12;

    private int acquisitionMonths = 12;

    private int repeatCurveMaxOrders = 10;

    private int minFirstOrderCount = 3;

    private int minCoPurchaseCount = 3;

    private int gatewayLimit = 20;

    private int affinityLimit = 20;

    private int geoLimit = 25;

    private int topCustomersLimit = 20;

    private double highValueThreshold = 1000;

    private int searchMaxLimit = 100;

    public ZoneId zoneId() {
        return zone == null || zone.isBlank() ? ZoneId.of("UTC") : ZoneId.of(zone.trim());
    }
}
