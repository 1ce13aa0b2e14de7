package com.tradedesk.invoicer.dto;

import com.tradedesk.invoicer.model.Invoice;
import com.tradedesk.invoicer.model.InvoiceStatus;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Fully materialized invoice as handed to callers and document renderers.
 */
public record InvoiceResponse(
        Long invoiceNumber,
        String displayNumber,
        InvoiceStatus status,
        String customerName,
        String customerPhone,
        String customerAddress,
        LocalDateTime createdAt,
        BigDecimal gstRate,
        BigDecimal subtotal,
        BigDecimal cgstAmount,
        BigDecimal sgstAmount,
        BigDecimal totalAmount,
        List<InvoiceLineResponse> items,
        SellerDetails seller) {

    public static InvoiceResponse from(Invoice invoice, String displayNumber, SellerDetails seller) {
        return new InvoiceResponse(
                invoice.getInvoiceNumber(),
                displayNumber,
                invoice.getStatus(),
                invoice.getCustomer().getName(),
                invoice.getCustomer().getPhone(),
                invoice.getCustomer().getAddress(),
                invoice.getCreatedAt(),
                invoice.getGstRate(),
                invoice.getSubtotal(),
                invoice.getCgstAmount(),
                invoice.getSgstAmount(),
                invoice.getTotalAmount(),
                invoice.getItems().stream().map(InvoiceLineResponse::from).toList(),
                seller);
    }
}
