package com.tradedesk.invoicer.service;

import com.tradedesk.invoicer.dto.InvoiceTotals;
import com.tradedesk.invoicer.dto.PricedLine;
import com.tradedesk.invoicer.model.Product;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;

/**
 * Invoice arithmetic. Line totals are kept exact; rounding to two places
 * (half-up) happens once, on the subtotal and on each tax half.
 */
@Component
public class InvoiceCalculator {

    static final int MONEY_SCALE = 2;
    private static final BigDecimal TWO_HUNDRED = BigDecimal.valueOf(200);

    private final SettingsService settingsService;

    public InvoiceCalculator(SettingsService settingsService) {
        this.settingsService = settingsService;
    }

    public PricedLine priceLine(Product product, int quantity) {
        BigDecimal unitPrice = product.getSellingPrice();
        BigDecimal unitCost = product.getCostPrice() != null ? product.getCostPrice() : BigDecimal.ZERO;
        return new PricedLine(product.key(), quantity, unitPrice, unitCost,
                unitPrice.multiply(BigDecimal.valueOf(quantity)));
    }

    public InvoiceTotals totals(List<PricedLine> lines) {
        return totals(lines, settingsService.getGstRate());
    }

    public InvoiceTotals totals(List<PricedLine> lines, BigDecimal gstRate) {
        BigDecimal subtotal = lines.stream()
                .map(PricedLine::lineTotal)
                .reduce(BigDecimal.ZERO, BigDecimal::add)
                .setScale(MONEY_SCALE, RoundingMode.HALF_UP);

        // Each half is gstRate / 2 percent of the subtotal
        BigDecimal half = subtotal.multiply(gstRate).divide(TWO_HUNDRED, MONEY_SCALE, RoundingMode.HALF_UP);

        BigDecimal total = subtotal.add(half).add(half);
        return new InvoiceTotals(gstRate, subtotal, half, half, total);
    }
}
