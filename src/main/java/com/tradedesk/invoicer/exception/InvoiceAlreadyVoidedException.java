package com.tradedesk.invoicer.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

import java.util.Map;

@ResponseStatus(HttpStatus.CONFLICT)
public class InvoiceAlreadyVoidedException extends InvoicingException {

    public InvoiceAlreadyVoidedException(long invoiceNumber) {
        super("INVOICE_VOIDED", "Invoice " + invoiceNumber + " is already voided",
                Map.of("invoiceNumber", invoiceNumber));
    }
}
