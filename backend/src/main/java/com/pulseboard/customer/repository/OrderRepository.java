package com.pulseboard.customer.repository;

import com.pulseboard.customer.entity.OrderEntity;
import java.util.Collection;
import java.util.List;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface OrderRepository extends JpaRepository<OrderEntity, Long> {

    @Query("select o from OrderEntity o where o.customerEmail is not null and o.customerEmail <> ''")
    List<OrderEntity> findAllWithCustomerEmail();

    List<OrderEntity> findByCustomerEmailOrderByCreatedAtDesc(String customerEmail, Pageable pageable);

    @Query("""
        select o.customerEmail as customerEmail, max(o.createdAt) as lastOrderAt
        from OrderEntity o
        where o.customerEmail in :emails
        group by o.customerEmail
        """)
    List<CustomerLastOrderView> findLastOrderDates(@Param("emails") Collection<String> emails);
}
