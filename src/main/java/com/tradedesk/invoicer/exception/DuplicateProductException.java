package com.tradedesk.invoicer.exception;

import com.tradedesk.invoicer.model.ProductKey;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

import java.util.Map;

@ResponseStatus(HttpStatus.CONFLICT)
public class DuplicateProductException extends InvoicingException {

    public DuplicateProductException(ProductKey product) {
        super("DUPLICATE_PRODUCT", "Product \"" + product.fullProductName() + "\" already exists",
                Map.of("product", product.fullProductName()));
    }
}
