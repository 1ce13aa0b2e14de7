package com.tradedesk.invoicer.model;

import jakarta.persistence.*;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.math.BigDecimal;

@Entity
@Table(name = "invoice_items")
@Data
public class InvoiceItem {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "invoice_id", nullable = false)
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private Invoice invoice;

    @ManyToOne
    @JoinColumn(name = "product_id", nullable = false)
    private Product product;

    // Display order within the invoice, starting at 1
    @Column(nullable = false)
    private int lineNumber;

    // Snapshot of the product identity at sale time
    @Column(nullable = false)
    private String productName;

    @Column(nullable = false)
    private String weight;

    @Column(nullable = false)
    private int quantity;

    // Prices captured at sale time, independent of later product edits
    @Column(nullable = false, precision = 12, scale = 2)
    private BigDecimal unitPrice;

    @Column(nullable = false, precision = 12, scale = 2)
    private BigDecimal unitCost;

    @Column(nullable = false, precision = 14, scale = 2)
    private BigDecimal lineTotal;

    public ProductKey productKey() {
        return ProductKey.of(productName, weight);
    }
}
