package com.tradedesk.invoicer.dto;

import java.math.BigDecimal;

public record SummaryStats(
        long totalInvoices,
        BigDecimal totalRevenue,
        BigDecimal totalProfit,
        long totalProductsSold,
        long totalDamagedProducts,
        BigDecimal damagedValue,
        long uniqueCustomers) {
}
