package com.tradedesk.invoicer.dto;

import com.tradedesk.invoicer.model.InvoiceItem;

import java.math.BigDecimal;

public record InvoiceLineResponse(
        int lineNumber,
        String productName,
        String weight,
        String fullProductName,
        int quantity,
        BigDecimal unitPrice,
        BigDecimal lineTotal) {

    public static InvoiceLineResponse from(InvoiceItem item) {
        return new InvoiceLineResponse(item.getLineNumber(), item.getProductName(), item.getWeight(),
                item.productKey().fullProductName(), item.getQuantity(), item.getUnitPrice(), item.getLineTotal());
    }
}
