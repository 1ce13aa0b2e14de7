package com.tradedesk.invoicer.model;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * One editable invoicing setting (seller details, GST rate), keyed by name.
 * A missing row means the {@code invoicing.*} property default applies.
 */
@Entity
@Table(name = "invoicing_settings")
@Data
@NoArgsConstructor
public class InvoicingSetting {
    @Id
    @Column(name = "setting_name", length = 64)
    private String name;

    @Column(name = "setting_value", nullable = false, length = 500)
    private String value;

    private LocalDateTime updatedAt;

    public InvoicingSetting(String name, String value) {
        this.name = name;
        this.value = value;
    }

    @PrePersist
    @PreUpdate
    void touch() {
        updatedAt = LocalDateTime.now();
    }
}
