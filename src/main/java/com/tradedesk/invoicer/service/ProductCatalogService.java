package com.tradedesk.invoicer.service;

import com.tradedesk.invoicer.dto.ProductUpdate;
import com.tradedesk.invoicer.exception.DuplicateProductException;
import com.tradedesk.invoicer.exception.InsufficientStockException;
import com.tradedesk.invoicer.exception.ProductInUseException;
import com.tradedesk.invoicer.exception.ProductNotFoundException;
import com.tradedesk.invoicer.exception.ValidationException;
import com.tradedesk.invoicer.exception.ValidationFailure;
import com.tradedesk.invoicer.model.Product;
import com.tradedesk.invoicer.model.ProductKey;
import com.tradedesk.invoicer.repository.DamageLedgerRepository;
import com.tradedesk.invoicer.repository.InvoiceItemRepository;
import com.tradedesk.invoicer.repository.ProductRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.List;

/**
 * Owner of per-product stock levels and prices.
 * <p>
 * Every method that changes {@code quantity} or {@code damagedQuantity} reads the
 * row through {@link #lockForUpdate(ProductKey)}, so reservations, damage moves and
 * administrative corrections on one product are serialized by the store.
 */
@Service
public class ProductCatalogService {

    private static final Logger logger = LoggerFactory.getLogger(ProductCatalogService.class);

    private final ProductRepository productRepository;
    private final InvoiceItemRepository invoiceItemRepository;
    private final DamageLedgerRepository damageLedgerRepository;
    private final AuditService auditService;

    public ProductCatalogService(ProductRepository productRepository, InvoiceItemRepository invoiceItemRepository,
            DamageLedgerRepository damageLedgerRepository, AuditService auditService) {
        this.productRepository = productRepository;
        this.invoiceItemRepository = invoiceItemRepository;
        this.damageLedgerRepository = damageLedgerRepository;
        this.auditService = auditService;
    }

    @Transactional(readOnly = true)
    public Product get(ProductKey key) {
        return productRepository.findByNameAndWeight(key.name(), key.weight())
                .orElseThrow(() -> new ProductNotFoundException(key));
    }

    @Transactional(readOnly = true)
    public Product findByFullProductName(String fullProductName) {
        String name = fullProductName == null ? "" : fullProductName.trim();
        return productRepository.findByFullProductName(name)
                .orElseThrow(() -> new ProductNotFoundException(ProductKey.of(name, null)));
    }

    @Transactional(readOnly = true)
    public List<Product> list() {
        return productRepository.findAllByOrderByNameAscWeightAsc();
    }

    /**
     * Loads the product holding its row lock for the rest of the caller's
     * transaction.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public Product lockForUpdate(ProductKey key) {
        return productRepository.findByKeyForUpdate(key.name(), key.weight())
                .orElseThrow(() -> new ProductNotFoundException(key));
    }

    /**
     * Takes {@code qty} units out of sellable stock. Only runs as one step of a
     * larger transaction: the decrement commits or rolls back with it.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public Product reserve(ProductKey key, int qty) {
        if (qty <= 0) {
            throw ValidationException.invalidQuantity(key, qty);
        }
        Product product = lockForUpdate(key);
        if (qty > product.getQuantity()) {
            throw new InsufficientStockException(key, qty, product.getQuantity());
        }
        product.setQuantity(product.getQuantity() - qty);
        logger.debug("Reserved {} x {}, {} left", qty, key, product.getQuantity());
        return product;
    }

    /**
     * Puts {@code qty} units back into sellable stock, e.g. when an invoice is voided.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public Product release(ProductKey key, int qty) {
        if (qty <= 0) {
            throw ValidationException.invalidQuantity(key, qty);
        }
        Product product = lockForUpdate(key);
        product.setQuantity(product.getQuantity() + qty);
        logger.debug("Released {} x {}, {} available", qty, key, product.getQuantity());
        return product;
    }

    @Transactional
    public Product add(Product product) {
        ProductKey key = product.key();
        if (key.name().isEmpty()) {
            throw new ValidationException(ValidationFailure.INVALID_PRODUCT, "Product name is required");
        }
        if (product.getQuantity() < 0 || product.getDamagedQuantity() < 0) {
            throw ValidationException.invalidQuantity(key, Math.min(product.getQuantity(),
                    product.getDamagedQuantity()));
        }
        if (product.getCostPrice() == null) {
            product.setCostPrice(BigDecimal.ZERO);
        }
        requireNonNegative(key, "Cost price", product.getCostPrice());
        if (product.getSellingPrice() == null || product.getSellingPrice().signum() <= 0) {
            throw new ValidationException(ValidationFailure.INVALID_PRICE,
                    "Selling price must be greater than 0 for \"" + key.fullProductName() + "\"");
        }
        if (productRepository.existsByNameAndWeight(key.name(), key.weight())) {
            throw new DuplicateProductException(key);
        }

        product.setId(null);
        product.setName(key.name());
        product.setWeight(key.weight());
        Product saved;
        try {
            saved = productRepository.saveAndFlush(product);
        } catch (DataIntegrityViolationException e) {
            // Lost a race with a concurrent add of the same key
            throw new DuplicateProductException(key);
        }
        logger.info("Added product {} (qty {}, price {})", key, saved.getQuantity(), saved.getSellingPrice());
        auditService.log("PRODUCT_ADDED", "Product: " + key + ", Qty: " + saved.getQuantity()
                + ", Price: " + saved.getSellingPrice());
        return saved;
    }

    /**
     * Administrative correction of stock and prices. Bypasses {@link #reserve} but
     * takes the same row lock.
     */
    @Transactional
    public Product update(ProductKey key, ProductUpdate fields) {
        if (fields == null || fields.isEmpty()) {
            throw new ValidationException(ValidationFailure.INVALID_PRODUCT,
                    "Nothing to update for \"" + key.fullProductName() + "\"");
        }
        if (fields.quantity() != null && fields.quantity() < 0) {
            throw ValidationException.invalidQuantity(key, fields.quantity());
        }
        if (fields.costPrice() != null) {
            requireNonNegative(key, "Cost price", fields.costPrice());
        }
        if (fields.sellingPrice() != null && fields.sellingPrice().signum() <= 0) {
            throw new ValidationException(ValidationFailure.INVALID_PRICE,
                    "Selling price must be greater than 0 for \"" + key.fullProductName() + "\"");
        }

        Product product = lockForUpdate(key);
        StringBuilder changes = new StringBuilder("Product: ").append(key);
        if (fields.quantity() != null) {
            changes.append(", Qty: ").append(product.getQuantity()).append(" -> ").append(fields.quantity());
            product.setQuantity(fields.quantity());
        }
        if (fields.costPrice() != null) {
            changes.append(", Cost: ").append(product.getCostPrice()).append(" -> ").append(fields.costPrice());
            product.setCostPrice(fields.costPrice());
        }
        if (fields.sellingPrice() != null) {
            changes.append(", Price: ").append(product.getSellingPrice()).append(" -> ")
                    .append(fields.sellingPrice());
            product.setSellingPrice(fields.sellingPrice());
        }
        Product saved = productRepository.save(product);
        logger.info("Updated {}", changes);
        auditService.log("PRODUCT_UPDATED", changes.toString());
        return saved;
    }

    /**
     * Deletes a product nothing refers to. Products on historical invoices or in
     * the damage ledger stay.
     */
    @Transactional
    public void remove(ProductKey key) {
        Product product = lockForUpdate(key);
        long invoiceLines = invoiceItemRepository.countByProductId(product.getId());
        long ledgerEntries = damageLedgerRepository.countByProductId(product.getId());
        if (invoiceLines > 0 || ledgerEntries > 0) {
            throw new ProductInUseException(key, invoiceLines, ledgerEntries);
        }
        productRepository.delete(product);
        logger.info("Removed product {}", key);
        auditService.log("PRODUCT_REMOVED", "Product: " + key);
    }

    private static void requireNonNegative(ProductKey key, String label, BigDecimal value) {
        if (value.signum() < 0) {
            throw new ValidationException(ValidationFailure.INVALID_PRICE,
                    label + " cannot be negative for \"" + key.fullProductName() + "\"");
        }
    }
}
