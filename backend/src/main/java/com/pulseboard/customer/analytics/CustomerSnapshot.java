package com.pulseboard.customer.analytics;

import java.time.OffsetDateTime;
import java.util.List;

/**
 * Everything one dashboard computation reads from the store, materialized up front.
 *
 * @param customers customers with at least one order, in repository order
 * @param orders orders carrying a customer email, with their line items attached
 * @param totalCustomerCount every customer in the store, including those without orders
 * @param newThisMonthCount customers created since the start of the current month
 * @param signupDates creation times of every customer created inside the acquisition window,
 *     whether or not they have ordered
 */
public record CustomerSnapshot(
    List<CustomerRecord> customers,
    List<OrderRecord> orders,
    long totalCustomerCount,
    long newThisMonthCount,
    List<OffsetDateTime> signupDates
) {

    public CustomerSnapshot {
        customers = List.copyOf(customers);
        orders = List.copyOf(orders);
        signupDates = List.copyOf(signupDates);
    }
}
