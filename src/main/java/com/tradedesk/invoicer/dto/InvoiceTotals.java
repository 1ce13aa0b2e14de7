package com.tradedesk.invoicer.dto;

import java.math.BigDecimal;

public record InvoiceTotals(
        BigDecimal gstRate,
        BigDecimal subtotal,
        BigDecimal cgstAmount,
        BigDecimal sgstAmount,
        BigDecimal totalAmount) {
}
