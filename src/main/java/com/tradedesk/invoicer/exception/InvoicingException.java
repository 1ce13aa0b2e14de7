package com.tradedesk.invoicer.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Root of every domain failure raised by the catalog, the damage ledger and the
 * invoice transaction.
 * <p>
 * Each failure carries a stable {@code code} and a {@code details} map (product,
 * requested and available quantities and so on) so callers can render an
 * actionable message without parsing the text. None of these exceptions leave
 * stock or the invoice counter changed: they are raised before any mutation or
 * roll back the transaction they escape from.
 */
public abstract class InvoicingException extends RuntimeException {

    private final String code;
    private final Map<String, Object> details;

    protected InvoicingException(String code, String message, Map<String, Object> details) {
        this(code, message, details, null);
    }

    protected InvoicingException(String code, String message, Map<String, Object> details, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.details = details == null ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    public String getCode() {
        return code;
    }

    public Map<String, Object> getDetails() {
        return details;
    }
}
