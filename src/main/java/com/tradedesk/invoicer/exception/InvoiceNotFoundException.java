package com.tradedesk.invoicer.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

import java.util.Map;

@ResponseStatus(HttpStatus.NOT_FOUND)
public class InvoiceNotFoundException extends InvoicingException {

    public InvoiceNotFoundException(long invoiceNumber) {
        super("INVOICE_NOT_FOUND", "Invoice " + invoiceNumber + " not found",
                Map.of("invoiceNumber", invoiceNumber));
    }
}
