package com.tradedesk.invoicer.dto;

import java.math.BigDecimal;

/**
 * Per-product aggregate over active invoice items; produced by a JPQL
 * constructor expression.
 */
public record ProductSalesTotals(
        String productName,
        String weight,
        Long quantitySold,
        BigDecimal revenue,
        BigDecimal cost,
        Long lineCount,
        Long invoiceCount) {
}
