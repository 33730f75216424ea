package com.pulseboard.customer.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.math.BigDecimal;
import java.time.OffsetDateTime;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

@Getter
@Entity
@Table(name = "shopify_orders")
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class OrderEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "shopify_order_id", nullable = false, unique = true)
    private Long shopifyOrderId;

    @Column(name = "order_number")
    private Integer orderNumber;

    @Column(name = "customer_email", length = 320)
    private String customerEmail;

    @Column(name = "total_price", precision = 10, scale = 2)
    private BigDecimal totalPrice;

    @Column(name = "financial_status", length = 40)
    private String financialStatus;

    @Column(name = "fulfillment_status", length = 40)
    private String fulfillmentStatus;

    @Column(name = "created_at")
    private OffsetDateTime createdAt;

    public OrderEntity(
        Long shopifyOrderId,
        Integer orderNumber,
        String customerEmail,
        BigDecimal totalPrice,
        String financialStatus,
        String fulfillmentStatus,
        OffsetDateTime createdAt
    ) {
        this.shopifyOrderId = shopifyOrderId;
        this.orderNumber = orderNumber;
        this.customerEmail = customerEmail;
        this.totalPrice = totalPrice;
        this.financialStatus = financialStatus;
        this.fulfillmentStatus = fulfillmentStatus;
        this.createdAt = createdAt;
    }
}
