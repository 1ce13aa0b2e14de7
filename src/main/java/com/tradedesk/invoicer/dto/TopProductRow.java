package com.tradedesk.invoicer.dto;

import java.math.BigDecimal;

public record TopProductRow(
        String productName,
        long totalSold,
        BigDecimal totalRevenue,
        long timesOrdered,
        BigDecimal averageQuantityPerOrder) {
}
