package com.tradedesk.invoicer.dto;

import java.math.BigDecimal;

public record ProductProfitRow(
        String productName,
        long totalSold,
        BigDecimal totalRevenue,
        BigDecimal totalCost,
        BigDecimal profit,
        BigDecimal profitMargin) {
}
