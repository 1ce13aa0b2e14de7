package com.tradedesk.invoicer.dto;

import java.math.BigDecimal;

/**
 * Administrative correction of a product. {@code null} fields are left as they are.
 */
public record ProductUpdate(Integer quantity, BigDecimal costPrice, BigDecimal sellingPrice) {

    public boolean isEmpty() {
        return quantity == null && costPrice == null && sellingPrice == null;
    }
}
