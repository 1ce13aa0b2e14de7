package com.tradedesk.invoicer.model;

import jakarta.persistence.*;
import lombok.Data;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

@Entity
@Table(name = "invoices")
@Data
public class Invoice {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(unique = true, nullable = false, updatable = false)
    private Long invoiceNumber;

    @Embedded
    private CustomerDetails customer;

    // Totals are frozen at creation time
    @Column(nullable = false, updatable = false, precision = 14, scale = 2)
    private BigDecimal subtotal;

    @Column(nullable = false, updatable = false, precision = 5, scale = 2)
    private BigDecimal gstRate;

    @Column(nullable = false, updatable = false, precision = 14, scale = 2)
    private BigDecimal cgstAmount;

    @Column(nullable = false, updatable = false, precision = 14, scale = 2)
    private BigDecimal sgstAmount;

    @Column(nullable = false, updatable = false, precision = 14, scale = 2)
    private BigDecimal totalAmount;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private InvoiceStatus status;

    private String createdBy;

    @Column(nullable = false, updatable = false)
    private LocalDateTime createdAt;

    private LocalDateTime voidedAt;

    @Column(length = 500)
    private String voidReason;

    @OneToMany(mappedBy = "invoice", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("lineNumber ASC")
    private List<InvoiceItem> items = new ArrayList<>();

    public void addItem(InvoiceItem item) {
        item.setInvoice(this);
        item.setLineNumber(items.size() + 1);
        items.add(item);
    }

    public boolean isVoided() {
        return status == InvoiceStatus.VOIDED;
    }

    @PrePersist
    protected void onCreate() {
        if (createdAt == null)
            createdAt = LocalDateTime.now();
        if (status == null)
            status = InvoiceStatus.ACTIVE;
    }
}
