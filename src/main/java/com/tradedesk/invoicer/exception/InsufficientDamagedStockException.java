package com.tradedesk.invoicer.exception;

import com.tradedesk.invoicer.model.ProductKey;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

import java.util.Map;

@ResponseStatus(HttpStatus.CONFLICT)
public class InsufficientDamagedStockException extends InvoicingException {

    private final ProductKey product;
    private final int requested;
    private final int available;

    public InsufficientDamagedStockException(ProductKey product, int requested, int available) {
        super("INSUFFICIENT_DAMAGED_STOCK",
                "Not enough damaged stock of \"" + product.fullProductName() + "\" to restore: requested "
                        + requested + ", damaged " + available,
                Map.of("product", product.fullProductName(), "requested", requested, "available", available));
        this.product = product;
        this.requested = requested;
        this.available = available;
    }

    public ProductKey getProduct() {
        return product;
    }

    public int getRequested() {
        return requested;
    }

    public int getAvailable() {
        return available;
    }
}
