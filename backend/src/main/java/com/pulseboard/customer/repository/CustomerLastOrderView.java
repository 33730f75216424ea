package com.pulseboard.customer.repository;

import java.time.OffsetDateTime;

public interface CustomerLastOrderView {

    String getCustomerEmail();

    OffsetDateTime getLastOrderAt();
}
