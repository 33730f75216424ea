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
@Table(name = "shopify_customers")
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class CustomerEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "shopify_customer_id", nullable = false, unique = true)
    private Long shopifyCustomerId;

    @Column(length = 320)
    private String email;

    @Column(name = "first_name")
    private String firstName;

    @Column(name = "last_name")
    private String lastName;

    @Column(name = "orders_count")
    private Integer ordersCount;

    @Column(name = "total_spent", precision = 10, scale = 2)
    private BigDecimal totalSpent;

    @Column(name = "created_at")
    private OffsetDateTime createdAt;

    @Column(name = "default_address_city")
    private String city;

    @Column(name = "default_address_province")
    private String province;

    @Column(name = "default_address_country")
    private String country;

    public CustomerEntity(
        Long shopifyCustomerId,
        String email,
        String firstName,
        String lastName,
        Integer ordersCount,
        BigDecimal totalSpent,
        OffsetDateTime createdAt,
        String city,
        String province,
        String country
    ) {
        this.shopifyCustomerId = shopifyCustomerId;
        this.email = email;
        this.firstName = firstName;
        this.lastName = lastName;
        this.ordersCount = ordersCount;
        this.totalSpent = totalSpent;
        this.createdAt = createdAt;
        this.city = city;
        this.province = province;
        this.country = country;
    }
}
