package com.pulseboard.customer.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

@Getter
@Entity
@Table(name = "shopify_order_items")
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class OrderLineItemEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "shopify_order_id", nullable = false)
    private Long shopifyOrderId;

    private String title;

    @Column(length = 120)
    private String sku;

    @Column(length = 120)
    private String vendor;

    public OrderLineItemEntity(Long shopifyOrderId, String title, String sku, String vendor) {
        this.shopifyOrderId = shopifyOrderId;
        this.title = title;
        this.sku = sku;
        this.vendor = vendor;
    }
}
