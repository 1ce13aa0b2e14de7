package com.tradedesk.invoicer.exception;

import com.tradedesk.invoicer.model.ProductKey;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

import java.util.Map;

@ResponseStatus(HttpStatus.CONFLICT)
public class ProductInUseException extends InvoicingException {

    public ProductInUseException(ProductKey product, long invoiceLines, long ledgerEntries) {
        super("PRODUCT_IN_USE",
                "Cannot delete \"" + product.fullProductName() + "\". It is used in " + invoiceLines
                        + " invoice lines and " + ledgerEntries + " damage entries.",
                Map.of("product", product.fullProductName(), "invoiceLines", invoiceLines,
                        "ledgerEntries", ledgerEntries));
    }
}
