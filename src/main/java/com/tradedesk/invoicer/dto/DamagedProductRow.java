package com.tradedesk.invoicer.dto;

import java.math.BigDecimal;
import java.time.LocalDateTime;

public record DamagedProductRow(
        String productName,
        String weight,
        String fullProductName,
        int availableQuantity,
        int damagedQuantity,
        BigDecimal costPrice,
        BigDecimal sellingPrice,
        BigDecimal valueLost,
        LocalDateTime updatedAt) {
}
