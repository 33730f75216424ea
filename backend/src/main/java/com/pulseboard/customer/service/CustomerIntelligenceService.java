package com.pulseboard.customer.service;

import com.pulseboard.customer.analytics.BrandAffinityEngine;
import com.pulseboard.customer.analytics.CohortRetentionCalculator;
import com.pulseboard.customer.analytics.CustomerIntelligenceProperties;
import com.pulseboard.customer.analytics.CustomerOverviewCalculator;
import com.pulseboard.customer.analytics.CustomerSnapshot;
import com.pulseboard.customer.analytics.GatewayProductAnalyzer;
import com.pulseboard.customer.analytics.GeoDistributionAggregator;
import com.pulseboard.customer.analytics.PulseNarrativeGenerator;
import com.pulseboard.customer.analytics.Ratios;
import com.pulseboard.customer.analytics.RepeatPurchaseCurveCalculator;
import com.pulseboard.customer.analytics.RetentionKpiCalculator;
import com.pulseboard.customer.analytics.RfmProfile;
import com.pulseboard.customer.analytics.RfmScorer;
import com.pulseboard.customer.analytics.RfmSegment;
import com.pulseboard.customer.analytics.SegmentBreakdownCalculator;
import com.pulseboard.customer.dto.BrandAffinityResponse;
import com.pulseboard.customer.dto.CohortRetentionResponse;
import com.pulseboard.customer.dto.CustomerDashboardResponse;
import com.pulseboard.customer.dto.CustomerDetailResponse;
import com.pulseboard.customer.dto.CustomerOrderResponse;
import com.pulseboard.customer.dto.CustomerSearchResultResponse;
import com.pulseboard.customer.dto.OverviewKpisResponse;
import com.pulseboard.customer.dto.SegmentSummaryResponse;
import com.pulseboard.customer.entity.CustomerEntity;
import com.pulseboard.customer.entity.OrderEntity;
import com.pulseboard.customer.repository.CustomerLastOrderView;
import com.pulseboard.customer.repository.CustomerRepository;
import com.pulseboard.customer.repository.OrderRepository;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.server.ResponseStatusException;

/**
 * Builds the customer intelligence views. Each call reads a fresh snapshot, scores it once
 * and hands the resulting profiles to every calculator that needs them.
 */
@Service
public class CustomerIntelligenceService {

    private static final Logger log = LoggerFactory.getLogger(CustomerIntelligenceService.class);

    private static final int RECENT_ORDER_LIMIT = 10;

    private final CustomerSnapshotLoader snapshotLoader;
    private final CustomerRepository customerRepository;
    private final OrderRepository orderRepository;
    private final RfmScorer rfmScorer;
    private final CustomerOverviewCalculator overviewCalculator;
    private final SegmentBreakdownCalculator segmentBreakdownCalculator;
    private final CohortRetentionCalculator cohortRetentionCalculator;
    private final RepeatPurchaseCurveCalculator repeatPurchaseCurveCalculator;
    private final RetentionKpiCalculator retentionKpiCalculator;
    private final GatewayProductAnalyzer gatewayProductAnalyzer;
    private final BrandAffinityEngine brandAffinityEngine;
    private final GeoDistributionAggregator geoDistributionAggregator;
    private final PulseNarrativeGenerator pulseNarrativeGenerator;
    private final CustomerIntelligenceProperties properties;
    private final Clock clock;

    public CustomerIntelligenceService(
        CustomerSnapshotLoader snapshotLoader,
        CustomerRepository customerRepository,
        OrderRepository orderRepository,
        RfmScorer rfmScorer,
        CustomerOverviewCalculator overviewCalculator,
        SegmentBreakdownCalculator segmentBreakdownCalculator,
        CohortRetentionCalculator cohortRetentionCalculator,
        RepeatPurchaseCurveCalculator repeatPurchaseCurveCalculator,
        RetentionKpiCalculator retentionKpiCalculator,
        GatewayProductAnalyzer gatewayProductAnalyzer,
        BrandAffinityEngine brandAffinityEngine,
        GeoDistributionAggregator geoDistributionAggregator,
        PulseNarrativeGenerator pulseNarrativeGenerator,
        CustomerIntelligenceProperties properties,
        Clock clock
    ) {
        this.snapshotLoader = snapshotLoader;
        this.customerRepository = customerRepository;
        this.orderRepository = orderRepository;
        this.rfmScorer = rfmScorer;
        this.overviewCalculator = overviewCalculator;
        this.segmentBreakdownCalculator = segmentBreakdownCalculator;
        this.cohortRetentionCalculator = cohortRetentionCalculator;
        this.repeatPurchaseCurveCalculator = repeatPurchaseCurveCalculator;
        this.retentionKpiCalculator = retentionKpiCalculator;
        this.gatewayProductAnalyzer = gatewayProductAnalyzer;
        this.brandAffinityEngine = brandAffinityEngine;
        this.geoDistributionAggregator = geoDistributionAggregator;
        this.pulseNarrativeGenerator = pulseNarrativeGenerator;
        this.properties = properties;
        this.clock = clock;
    }

    @Transactional(readOnly = true)
    public CustomerDashboardResponse getDashboard() {
        long startedAt = System.nanoTime();
        CustomerSnapshot snapshot = snapshotLoader.load();
        CustomerDashboardResponse dashboard = buildDashboard(snapshot, OffsetDateTime.now(clock));

        log.info(
            "Customer dashboard built (customers={}, orders={}, elapsedMs={})",
            snapshot.customers().size(),
            snapshot.orders().size(),
            Duration.ofNanos(System.nanoTime() - startedAt).toMillis()
        );
        return dashboard;
    }

    CustomerDashboardResponse buildDashboard(CustomerSnapshot snapshot, OffsetDateTime now) {
        List<RfmProfile> profiles = rfmScorer.score(snapshot.customers(), snapshot.orders(), now);

        OverviewKpisResponse kpis = overviewCalculator.kpis(snapshot, profiles);

        return new CustomerDashboardResponse(
            pulseNarrativeGenerator.generate(profiles, kpis),
            kpis,
            segmentBreakdownCalculator.distribution(profiles),
            segmentBreakdownCalculator.revenue(profiles),
            overviewCalculator.acquisitionTrend(snapshot.signupDates(), now),
            overviewCalculator.topCustomers(profiles),
            segmentBreakdownCalculator.summary(profiles),
            cohortRetentionCalculator.calculate(snapshot.orders()),
            repeatPurchaseCurveCalculator.calculate(snapshot.customers()),
            retentionKpiCalculator.recencyDistribution(profiles),
            retentionKpiCalculator.calculate(profiles),
            gatewayProductAnalyzer.analyze(snapshot.customers(), snapshot.orders()),
            brandAffinityEngine.calculate(snapshot.orders()),
            geoDistributionAggregator.aggregate(snapshot.customers())
        );
    }

    @Transactional(readOnly = true)
    public List<SegmentSummaryResponse> getRfmSegments() {
        CustomerSnapshot snapshot = snapshotLoader.load();
        List<RfmProfile> profiles = rfmScorer.score(snapshot.customers(), snapshot.orders(), OffsetDateTime.now(clock));
        return segmentBreakdownCalculator.summary(profiles);
    }

    @Transactional(readOnly = true)
    public CohortRetentionResponse getCohortData() {
        return cohortRetentionCalculator.calculate(snapshotLoader.load().orders());
    }

    @Transactional(readOnly = true)
    public List<BrandAffinityResponse> getBrandAffinity() {
        return brandAffinityEngine.calculate(snapshotLoader.load().orders());
    }

    @Transactional(readOnly = true)
    public CustomerDetailResponse getCustomerDetail(String email) {
        CustomerEntity customer = customerRepository.findFirstByEmail(email)
            .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Customer not found"));

        OffsetDateTime now = OffsetDateTime.now(clock);
        CustomerSnapshot snapshot = snapshotLoader.load();
        RfmProfile profile = rfmScorer.score(snapshot.customers(), snapshot.orders(), now).stream()
            .filter(candidate -> candidate.customer().email().equals(email))
            .findFirst()
            .orElse(null);

        List<OrderEntity> recentOrders = orderRepository.findByCustomerEmailOrderByCreatedAtDesc(
            email,
            PageRequest.of(0, RECENT_ORDER_LIMIT)
        );

        OffsetDateTime lastOrderAt = profile != null
            ? profile.lastOrderAt()
            : recentOrders.stream().map(OrderEntity::getCreatedAt).filter(Objects::nonNull).findFirst().orElse(null);
        long daysSinceLastOrder = lastOrderAt == null ? 0 : Math.max(0, Duration.between(lastOrderAt, now).toDays());

        int ordersCount = customer.getOrdersCount() == null ? 0 : customer.getOrdersCount();
        double totalSpent = CustomerSnapshotLoader.amount(customer.getTotalSpent());

        long customerSinceMonths = 0;
        if (customer.getCreatedAt() != null) {
            customerSinceMonths = Math.max(1, Duration.between(customer.getCreatedAt(), now).toDays() / 30);
        }

        return new CustomerDetailResponse(
            customer.getEmail(),
            CustomerSnapshotLoader.toRecord(customer).displayName(),
            profile == null ? "Unknown" : profile.segment().label(),
            profile == null ? 0 : profile.recencyScore(),
            profile == null ? 0 : profile.frequencyScore(),
            profile == null ? 0 : profile.monetaryScore(),
            ordersCount,
            totalSpent,
            ordersCount > 0 ? Ratios.round(totalSpent / ordersCount, 2) : 0,
            daysSinceLastOrder,
            toLocalDate(customer.getCreatedAt()),
            toLocalDate(lastOrderAt),
            customerSinceMonths,
            nullToEmpty(customer.getCity()),
            nullToEmpty(customer.getProvince()),
            nullToEmpty(customer.getCountry()),
            flagsFor(profile),
            recentOrders.stream()
                .map(order -> new CustomerOrderResponse(
                    order.getOrderNumber(),
                    CustomerSnapshotLoader.amount(order.getTotalPrice()),
                    toLocalDate(order.getCreatedAt()),
                    nullToEmpty(order.getFinancialStatus()),
                    nullToEmpty(order.getFulfillmentStatus())
                ))
                .toList()
        );
    }

    @Transactional(readOnly = true)
    public List<CustomerSearchResultResponse> searchCustomers(String query, int limit) {
        if (query == null || query.isBlank()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Search query must not be blank");
        }
        int normalizedLimit = Math.max(1, Math.min(limit, properties.getSearchMaxLimit()));

        List<CustomerEntity> matches = customerRepository.search(query.trim(), PageRequest.of(0, normalizedLimit));
        if (matches.isEmpty()) {
            return List.of();
        }

        List<String> emails = matches.stream()
            .map(CustomerEntity::getEmail)
            .filter(email -> email != null && !email.isBlank())
            .toList();
        Map<String, OffsetDateTime> lastOrderByEmail = new HashMap<>();
        if (!emails.isEmpty()) {
            for (CustomerLastOrderView view : orderRepository.findLastOrderDates(emails)) {
                lastOrderByEmail.put(view.getCustomerEmail(), view.getLastOrderAt());
            }
        }

        return matches.stream()
            .map(customer -> new CustomerSearchResultResponse(
                nullToEmpty(customer.getEmail()),
                (nullToEmpty(customer.getFirstName()) + " " + nullToEmpty(customer.getLastName())).trim(),
                customer.getOrdersCount() == null ? 0 : customer.getOrdersCount(),
                CustomerSnapshotLoader.amount(customer.getTotalSpent()),
                toLocalDate(lastOrderByEmail.get(customer.getEmail()))
            ))
            .toList();
    }

    private List<String> flagsFor(RfmProfile profile) {
        List<String> flags = new ArrayList<>();
        if (profile == null) {
            return flags;
        }
        RfmSegment segment = profile.segment();
        if (segment == RfmSegment.CHAMPIONS) {
            flags.add("Champion");
        }
        if (segment == RfmSegment.LOYAL) {
            flags.add("Loyal");
        }
        if (RfmSegment.SLIPPING.contains(segment)) {
            flags.add("At Risk");
        }
        if (segment == RfmSegment.LOST) {
            flags.add("Churned");
        }
        if (profile.totalSpent() > properties.getHighValueThreshold()) {
            flags.add("High Value");
        }
        if (segment == RfmSegment.NEW_CUSTOMERS || segment == RfmSegment.PROMISING) {
            flags.add("New");
        }
        return flags;
    }

    private LocalDate toLocalDate(OffsetDateTime timestamp) {
        if (timestamp == null) {
            return null;
        }
        ZoneId zone = properties.zoneId();
        return timestamp.atZoneSameInstant(zone).toLocalDate();
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
