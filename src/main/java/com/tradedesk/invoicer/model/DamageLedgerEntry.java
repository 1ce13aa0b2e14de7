package com.tradedesk.invoicer.model;

import jakarta.persistence.*;
import lombok.Data;

import java.time.LocalDateTime;

@Entity
@Table(name = "damage_ledger")
@Data
public class DamageLedgerEntry {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne
    @JoinColumn(name = "product_id", nullable = false)
    private Product product;

    @Enumerated(EnumType.STRING)
    @Column(name = "entry_type", nullable = false)
    private DamageEntryType type;

    @Column(nullable = false)
    private int quantity;

    // Stock levels right after this entry was applied
    private int quantityAfter;
    private int damagedQuantityAfter;

    private String username;

    @Column(updatable = false)
    private LocalDateTime createdAt;

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now();
    }
}
