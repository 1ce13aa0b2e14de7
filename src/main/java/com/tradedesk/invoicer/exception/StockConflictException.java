package com.tradedesk.invoicer.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

import java.util.Map;

/**
 * A concurrent update to the same stock rows kept winning, even after the
 * automatic retry.
 */
@ResponseStatus(HttpStatus.CONFLICT)
public class StockConflictException extends InvoicingException {

    public StockConflictException(String message, Throwable cause) {
        super("CONFLICT", message, Map.of(), cause);
    }
}
