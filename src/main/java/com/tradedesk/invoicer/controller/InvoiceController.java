package com.tradedesk.invoicer.controller;

import com.tradedesk.invoicer.dto.CreateInvoiceRequest;
import com.tradedesk.invoicer.dto.InvoicePreview;
import com.tradedesk.invoicer.dto.InvoiceResponse;
import com.tradedesk.invoicer.dto.InvoiceSummaryRow;
import com.tradedesk.invoicer.dto.VoidInvoiceRequest;
import com.tradedesk.invoicer.model.Invoice;
import com.tradedesk.invoicer.service.InvoiceService;
import com.tradedesk.invoicer.service.SettingsService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/invoices")
public class InvoiceController {

    private final InvoiceService invoiceService;
    private final SettingsService settingsService;

    public InvoiceController(InvoiceService invoiceService, SettingsService settingsService) {
        this.invoiceService = invoiceService;
        this.settingsService = settingsService;
    }

    @PostMapping("/calculate")
    public InvoicePreview calculate(@RequestBody CreateInvoiceRequest request) {
        return invoiceService.preview(request.getItems());
    }

    @PostMapping
    public ResponseEntity<InvoiceResponse> create(@RequestBody CreateInvoiceRequest request) {
        Invoice invoice = invoiceService.createInvoice(request.toCustomer(), request.getItems());
        return ResponseEntity.status(HttpStatus.CREATED).body(toResponse(invoice));
    }

    @GetMapping
    public List<InvoiceSummaryRow> list() {
        return invoiceService.listRecent().stream()
                .map(inv -> InvoiceSummaryRow.from(inv, settingsService.formatInvoiceNumber(inv.getInvoiceNumber())))
                .toList();
    }

    @GetMapping("/{number}")
    public InvoiceResponse get(@PathVariable long number) {
        return toResponse(invoiceService.findByNumber(number));
    }

    @PostMapping("/{number}/void")
    public InvoiceResponse voidInvoice(@PathVariable long number,
            @RequestBody(required = false) VoidInvoiceRequest request) {
        String reason = request != null ? request.getReason() : null;
        return toResponse(invoiceService.voidInvoice(number, reason));
    }

    private InvoiceResponse toResponse(Invoice invoice) {
        return InvoiceResponse.from(invoice, settingsService.formatInvoiceNumber(invoice.getInvoiceNumber()),
                settingsService.getSellerDetails());
    }
}
