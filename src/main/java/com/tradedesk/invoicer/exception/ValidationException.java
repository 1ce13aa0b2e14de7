package com.tradedesk.invoicer.exception;

import com.tradedesk.invoicer.model.ProductKey;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Input rejected before anything was touched. Safe to retry once corrected.
 */
@ResponseStatus(HttpStatus.BAD_REQUEST)
public class ValidationException extends InvoicingException {

    private final ValidationFailure failure;

    public ValidationException(ValidationFailure failure, String message) {
        this(failure, message, Map.of());
    }

    public ValidationException(ValidationFailure failure, String message, Map<String, Object> details) {
        super(failure.name(), message, details);
        this.failure = failure;
    }

    public ValidationFailure getFailure() {
        return failure;
    }

    public static ValidationException emptyInvoice() {
        return new ValidationException(ValidationFailure.EMPTY_INVOICE, "Invoice must contain at least one item");
    }

    public static ValidationException invalidQuantity(ProductKey product, Integer quantity) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("product", product.fullProductName());
        details.put("quantity", quantity);
        return new ValidationException(ValidationFailure.INVALID_QUANTITY,
                "Quantity for \"" + product.fullProductName() + "\" must be a positive whole number (got "
                        + quantity + ")",
                details);
    }

    public static ValidationException unknownProduct(ProductKey product) {
        return new ValidationException(ValidationFailure.UNKNOWN_PRODUCT,
                "Product \"" + product.fullProductName() + "\" not found",
                Map.of("product", product.fullProductName()));
    }

    public static ValidationException missingCustomer() {
        return new ValidationException(ValidationFailure.MISSING_CUSTOMER, "Customer name is required");
    }
}
