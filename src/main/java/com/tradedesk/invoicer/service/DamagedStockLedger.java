package com.tradedesk.invoicer.service;

import com.tradedesk.invoicer.dto.DamagedProductRow;
import com.tradedesk.invoicer.exception.InsufficientDamagedStockException;
import com.tradedesk.invoicer.exception.InsufficientStockException;
import com.tradedesk.invoicer.exception.ValidationException;
import com.tradedesk.invoicer.model.DamageEntryType;
import com.tradedesk.invoicer.model.DamageLedgerEntry;
import com.tradedesk.invoicer.model.Product;
import com.tradedesk.invoicer.model.ProductKey;
import com.tradedesk.invoicer.repository.DamageLedgerRepository;
import com.tradedesk.invoicer.repository.ProductRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.List;

/**
 * Moves units between sellable and damaged stock of one product. Total physical
 * stock ({@code quantity + damagedQuantity}) never changes here.
 */
@Service
public class DamagedStockLedger {

    private static final Logger logger = LoggerFactory.getLogger(DamagedStockLedger.class);

    private final ProductCatalogService catalog;
    private final ProductRepository productRepository;
    private final DamageLedgerRepository ledgerRepository;
    private final AuditService auditService;

    public DamagedStockLedger(ProductCatalogService catalog, ProductRepository productRepository,
            DamageLedgerRepository ledgerRepository, AuditService auditService) {
        this.catalog = catalog;
        this.productRepository = productRepository;
        this.ledgerRepository = ledgerRepository;
        this.auditService = auditService;
    }

    @Transactional
    public Product markDamaged(ProductKey key, int qty) {
        requirePositive(key, qty);
        Product product = catalog.lockForUpdate(key);
        if (qty > product.getQuantity()) {
            throw new InsufficientStockException(key, qty, product.getQuantity());
        }
        product.setQuantity(product.getQuantity() - qty);
        product.setDamagedQuantity(product.getDamagedQuantity() + qty);
        record(product, DamageEntryType.MARKED_DAMAGED, qty);

        logger.info("Marked {} x {} as damaged. Available: {}, Damaged: {}", qty, key, product.getQuantity(),
                product.getDamagedQuantity());
        auditService.log("MARK_DAMAGED", "Product: " + key + ", Qty: " + qty);
        return product;
    }

    @Transactional
    public Product restore(ProductKey key, int qty) {
        requirePositive(key, qty);
        Product product = catalog.lockForUpdate(key);
        if (qty > product.getDamagedQuantity()) {
            throw new InsufficientDamagedStockException(key, qty, product.getDamagedQuantity());
        }
        product.setDamagedQuantity(product.getDamagedQuantity() - qty);
        product.setQuantity(product.getQuantity() + qty);
        record(product, DamageEntryType.RESTORED, qty);

        logger.info("Restored {} x {} from damaged. Available: {}, Damaged: {}", qty, key, product.getQuantity(),
                product.getDamagedQuantity());
        auditService.log("RESTORE_DAMAGED", "Product: " + key + ", Qty: " + qty);
        return product;
    }

    @Transactional(readOnly = true)
    public List<DamagedProductRow> damagedReport() {
        return productRepository.findByDamagedQuantityGreaterThanOrderByDamagedQuantityDescNameAsc(0).stream()
                .map(p -> new DamagedProductRow(
                        p.getName(),
                        p.getWeight(),
                        p.getFullProductName(),
                        p.getQuantity(),
                        p.getDamagedQuantity(),
                        p.getCostPrice(),
                        p.getSellingPrice(),
                        p.getCostPrice().multiply(BigDecimal.valueOf(p.getDamagedQuantity())),
                        p.getUpdatedAt()))
                .toList();
    }

    @Transactional(readOnly = true)
    public List<DamageLedgerEntry> history(ProductKey key) {
        Product product = catalog.get(key);
        return ledgerRepository.findByProductIdOrderByIdAsc(product.getId());
    }

    private void record(Product product, DamageEntryType type, int qty) {
        DamageLedgerEntry entry = new DamageLedgerEntry();
        entry.setProduct(product);
        entry.setType(type);
        entry.setQuantity(qty);
        entry.setQuantityAfter(product.getQuantity());
        entry.setDamagedQuantityAfter(product.getDamagedQuantity());
        entry.setUsername(auditService.currentUsername());
        ledgerRepository.save(entry);
    }

    private static void requirePositive(ProductKey key, int qty) {
        if (qty <= 0) {
            throw ValidationException.invalidQuantity(key, qty);
        }
    }
}
