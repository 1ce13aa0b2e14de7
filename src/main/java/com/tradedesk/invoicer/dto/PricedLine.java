package com.tradedesk.invoicer.dto;

import com.tradedesk.invoicer.model.ProductKey;

import java.math.BigDecimal;

/**
 * One requested line after pricing: the selling and cost prices are the
 * product's values at the moment of pricing.
 */
public record PricedLine(
        ProductKey product,
        int quantity,
        BigDecimal unitPrice,
        BigDecimal unitCost,
        BigDecimal lineTotal) {
}
