package com.tradedesk.invoicer.exception;

import com.tradedesk.invoicer.model.ProductKey;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

import java.util.Map;

@ResponseStatus(HttpStatus.NOT_FOUND)
public class ProductNotFoundException extends InvoicingException {

    private final ProductKey product;

    public ProductNotFoundException(ProductKey product) {
        super("PRODUCT_NOT_FOUND", "Product \"" + product.fullProductName() + "\" not found",
                Map.of("product", product.fullProductName()));
        this.product = product;
    }

    public ProductKey getProduct() {
        return product;
    }
}
