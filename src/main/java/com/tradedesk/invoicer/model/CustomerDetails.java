package com.tradedesk.invoicer.model;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Free-text customer block printed on an invoice. Only the name is required.
 */
@Embeddable
@Data
@NoArgsConstructor
@AllArgsConstructor
public class CustomerDetails {

    @Column(name = "customer_name", nullable = false)
    private String name;

    @Column(name = "customer_phone")
    private String phone;

    @Column(name = "customer_address", length = 500)
    private String address;
}
