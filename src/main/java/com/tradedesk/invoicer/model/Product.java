package com.tradedesk.invoicer.model;

import jakarta.persistence.*;
import lombok.Data;

import java.math.BigDecimal;
import java.time.LocalDateTime;

@Entity
@Table(name = "products", uniqueConstraints = @UniqueConstraint(name = "uk_products_name_weight", columnNames = {
        "product_name", "weight" }))
@Data
public class Product {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "product_name", nullable = false)
    private String name;

    @Column(nullable = false)
    private String weight = "";

    // Derived from name + weight, kept for lookups by display name
    @Column(unique = true, nullable = false)
    private String fullProductName;

    // Sellable stock
    @Column(nullable = false)
    private int quantity;

    // Held but not sellable
    @Column(nullable = false)
    private int damagedQuantity;

    @Column(nullable = false, precision = 12, scale = 2)
    private BigDecimal costPrice = BigDecimal.ZERO;

    @Column(nullable = false, precision = 12, scale = 2)
    private BigDecimal sellingPrice;

    @Version
    private Long version;

    @Column(updatable = false)
    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;

    public ProductKey key() {
        return ProductKey.of(name, weight);
    }

    public int totalStock() {
        return quantity + damagedQuantity;
    }

    @PrePersist
    protected void onCreate() {
        ProductKey key = key();
        name = key.name();
        weight = key.weight();
        fullProductName = key.fullProductName();
        createdAt = LocalDateTime.now();
        updatedAt = createdAt;
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = LocalDateTime.now();
    }
}
