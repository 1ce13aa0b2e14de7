package com.tradedesk.invoicer.service;

import com.tradedesk.invoicer.dto.LineItemRequest;
import com.tradedesk.invoicer.exception.InsufficientStockException;
import com.tradedesk.invoicer.exception.ValidationException;
import com.tradedesk.invoicer.model.CustomerDetails;
import com.tradedesk.invoicer.model.Product;
import com.tradedesk.invoicer.model.ProductKey;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Pure checks on an invoice request. Nothing here reads or writes the store.
 */
@Component
public class InvoiceValidator {

    public void validateCustomer(CustomerDetails customer) {
        if (customer == null || customer.getName() == null || customer.getName().isBlank()) {
            throw ValidationException.missingCustomer();
        }
    }

    /**
     * Rejects an empty request or a line whose quantity is not positive, then
     * sums the quantities per product. Lines naming the same product twice are
     * checked against stock together, summed as {@code long} so that several
     * large lines cannot wrap around. Iteration order is first appearance.
     */
    public Map<ProductKey, Long> requestedQuantities(List<LineItemRequest> items) {
        if (items == null || items.isEmpty()) {
            throw ValidationException.emptyInvoice();
        }
        Map<ProductKey, Long> requested = new LinkedHashMap<>();
        for (LineItemRequest item : items) {
            if (item == null) {
                throw ValidationException.emptyInvoice();
            }
            ProductKey key = item.toKey();
            if (key.name().isEmpty()) {
                throw ValidationException.unknownProduct(key);
            }
            Integer quantity = item.getQuantity();
            if (quantity == null || quantity <= 0) {
                throw ValidationException.invalidQuantity(key, quantity);
            }
            requested.merge(key, quantity.longValue(), Long::sum);
        }
        return requested;
    }

    /**
     * Fails on the first product whose sellable stock is short. The whole invoice
     * is rejected; partial fulfilment is never attempted.
     */
    public void checkAvailability(Map<ProductKey, Long> requested, Map<ProductKey, Product> products) {
        for (Map.Entry<ProductKey, Long> entry : requested.entrySet()) {
            Product product = products.get(entry.getKey());
            if (product == null) {
                throw ValidationException.unknownProduct(entry.getKey());
            }
            if (product.getQuantity() < entry.getValue()) {
                throw new InsufficientStockException(entry.getKey(), entry.getValue(), product.getQuantity());
            }
        }
    }
}
