package com.tradedesk.invoicer.dto;

import com.tradedesk.invoicer.model.Invoice;
import com.tradedesk.invoicer.model.InvoiceStatus;

import java.math.BigDecimal;
import java.time.LocalDateTime;

public record InvoiceSummaryRow(
        Long invoiceNumber,
        String displayNumber,
        InvoiceStatus status,
        String customerName,
        BigDecimal totalAmount,
        LocalDateTime createdAt) {

    public static InvoiceSummaryRow from(Invoice invoice, String displayNumber) {
        return new InvoiceSummaryRow(invoice.getInvoiceNumber(), displayNumber, invoice.getStatus(),
                invoice.getCustomer().getName(), invoice.getTotalAmount(), invoice.getCreatedAt());
    }
}
