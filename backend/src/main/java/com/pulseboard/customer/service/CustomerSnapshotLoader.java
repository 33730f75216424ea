package com.pulseboard.customer.service;

import com.pulseboard.customer.analytics.CustomerIntelligenceProperties;
import com.pulseboard.customer.analytics.CustomerRecord;
import com.pulseboard.customer.analytics.CustomerSnapshot;
import com.pulseboard.customer.analytics.LineItemRecord;
import com.pulseboard.customer.analytics.OrderRecord;
import com.pulseboard.customer.entity.CustomerEntity;
import com.pulseboard.customer.entity.OrderEntity;
import com.pulseboard.customer.entity.OrderLineItemEntity;
import com.pulseboard.customer.repository.CustomerRepository;
import com.pulseboard.customer.repository.OrderLineItemRepository;
import com.pulseboard.customer.repository.OrderRepository;
import java.math.BigDecimal;
import java.time.Clock;
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
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.server.ResponseStatusException;

/**
 * Performs the bulk store read behind every customer computation. Nothing after this
 * touches the store; a failed read aborts the request.
 */
@Component
public class CustomerSnapshotLoader {

    private static final Logger log = LoggerFactory.getLogger(CustomerSnapshotLoader.class);

    private final CustomerRepository customerRepository;
    private final OrderRepository orderRepository;
    private final OrderLineItemRepository orderLineItemRepository;
    private final CustomerIntelligenceProperties properties;
    private final Clock clock;

    public CustomerSnapshotLoader(
        CustomerRepository customerRepository,
        OrderRepository orderRepository,
        OrderLineItemRepository orderLineItemRepository,
        CustomerIntelligenceProperties properties,
        Clock clock
    ) {
        this.customerRepository = customerRepository;
        this.orderRepository = orderRepository;
        this.orderLineItemRepository = orderLineItemRepository;
        this.properties = properties;
        this.clock = clock;
    }

    @Transactional(readOnly = true)
    public CustomerSnapshot load() {
        List<CustomerEntity> customers;
        List<OrderEntity> orders;
        List<OrderLineItemEntity> lineItems;
        long totalCustomers;
        long newThisMonth;
        List<OffsetDateTime> signupDates;
        try {
            customers = customerRepository.findByOrdersCountGreaterThan(0);
            orders = orderRepository.findAllWithCustomerEmail();
            lineItems = orderLineItemRepository.findAllForCustomerOrders();
            totalCustomers = customerRepository.count();
            newThisMonth = customerRepository.countByCreatedAtGreaterThanEqual(monthStart(0));
            signupDates = customerRepository.findCreatedAtSince(monthStart(properties.getAcquisitionMonths() - 1));
        } catch (DataAccessException exception) {
            log.warn("Customer snapshot read failed: {}", exception.getMessage());
            throw new ResponseStatusException(HttpStatus.SERVICE_UNAVAILABLE, "Customer store is unavailable", exception);
        }

        Map<Long, List<LineItemRecord>> itemsByOrderId = new HashMap<>();
        for (OrderLineItemEntity item : lineItems) {
            itemsByOrderId.computeIfAbsent(item.getShopifyOrderId(), key -> new ArrayList<>())
                .add(new LineItemRecord(item.getVendor(), item.getTitle(), item.getSku()));
        }

        List<OrderRecord> orderRecords = orders.stream()
            .map(order -> toRecord(order, itemsByOrderId.getOrDefault(order.getShopifyOrderId(), List.of())))
            .toList();

        return new CustomerSnapshot(
            customers.stream().map(CustomerSnapshotLoader::toRecord).toList(),
            orderRecords,
            totalCustomers,
            newThisMonth,
            signupDates.stream().filter(Objects::nonNull).toList()
        );
    }

    /** Start of the calendar month {@code monthsBack} months before the current one. */
    private OffsetDateTime monthStart(int monthsBack) {
        ZoneId zone = properties.zoneId();
        return LocalDate.now(clock.withZone(zone))
            .withDayOfMonth(1)
            .minusMonths(Math.max(0, monthsBack))
            .atStartOfDay(zone)
            .toOffsetDateTime();
    }

    static CustomerRecord toRecord(CustomerEntity customer) {
        return new CustomerRecord(
            safe(customer.getEmail()),
            safe(customer.getFirstName()),
            safe(customer.getLastName()),
            customer.getOrdersCount() == null ? 0 : customer.getOrdersCount(),
            amount(customer.getTotalSpent()),
            customer.getCreatedAt(),
            safe(customer.getCity()),
            safe(customer.getProvince()),
            safe(customer.getCountry())
        );
    }

    private static OrderRecord toRecord(OrderEntity order, List<LineItemRecord> lineItems) {
        return new OrderRecord(
            order.getShopifyOrderId(),
            order.getCustomerEmail(),
            order.getCreatedAt(),
            amount(order.getTotalPrice()),
            lineItems
        );
    }

    static double amount(BigDecimal value) {
        return value == null ? 0 : value.doubleValue();
    }

    private static String safe(String value) {
        return value == null ? "" : value;
    }
}
