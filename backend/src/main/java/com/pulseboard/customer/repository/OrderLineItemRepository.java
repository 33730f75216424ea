package com.pulseboard.customer.repository;

import com.pulseboard.customer.entity.OrderLineItemEntity;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;

public interface OrderLineItemRepository extends JpaRepository<OrderLineItemEntity, Long> {

    @Query("""
        select i from OrderLineItemEntity i
        where i.shopifyOrderId in (
            select o.shopifyOrderId from OrderEntity o
            where o.customerEmail is not null and o.customerEmail <> ''
        )
        """)
    List<OrderLineItemEntity> findAllForCustomerOrders();
}
