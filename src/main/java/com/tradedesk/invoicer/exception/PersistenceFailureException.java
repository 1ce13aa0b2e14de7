package com.tradedesk.invoicer.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

import java.util.Map;

/**
 * The store rejected or could not take the write. Nothing was committed.
 */
@ResponseStatus(HttpStatus.SERVICE_UNAVAILABLE)
public class PersistenceFailureException extends InvoicingException {

    public PersistenceFailureException(String message, Throwable cause) {
        super("PERSISTENCE_FAILURE", message, Map.of(), cause);
    }
}
