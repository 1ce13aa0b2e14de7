package com.tradedesk.invoicer.exception;

import com.tradedesk.invoicer.model.ProductKey;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

import java.util.Map;

@ResponseStatus(HttpStatus.CONFLICT)
public class InsufficientStockException extends InvoicingException {

    private final ProductKey product;
    private final long requested;
    private final int available;

    public InsufficientStockException(ProductKey product, long requested, int available) {
        super("INSUFFICIENT_STOCK",
                "Insufficient stock for \"" + product.fullProductName() + "\": requested " + requested
                        + ", available " + available,
                Map.of("product", product.fullProductName(), "requested", requested, "available", available));
        this.product = product;
        this.requested = requested;
        this.available = available;
    }

    public ProductKey getProduct() {
        return product;
    }

    public long getRequested() {
        return requested;
    }

    public int getAvailable() {
        return available;
    }
}
