package com.tradedesk.invoicer.dto;

import java.math.BigDecimal;

public record ProductSalesRow(
        String productName,
        long totalQuantity,
        BigDecimal totalRevenue,
        long timesSold,
        BigDecimal averagePrice) {
}
