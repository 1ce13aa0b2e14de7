package com.tradedesk.invoicer.service;

import com.tradedesk.invoicer.dto.InvoiceTotals;
import com.tradedesk.invoicer.dto.LineItemRequest;
import com.tradedesk.invoicer.dto.PricedLine;
import com.tradedesk.invoicer.exception.InvoicingException;
import com.tradedesk.invoicer.exception.PersistenceFailureException;
import com.tradedesk.invoicer.exception.ProductNotFoundException;
import com.tradedesk.invoicer.exception.ValidationException;
import com.tradedesk.invoicer.model.CustomerDetails;
import com.tradedesk.invoicer.model.Invoice;
import com.tradedesk.invoicer.model.InvoiceItem;
import com.tradedesk.invoicer.model.InvoiceStatus;
import com.tradedesk.invoicer.model.Product;
import com.tradedesk.invoicer.model.ProductKey;
import com.tradedesk.invoicer.repository.InvoiceRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Creates one invoice as a single unit of work: validate the requested lines
 * against sellable stock, price them, decrement stock, take the next invoice
 * number and persist header and lines.
 * <p>
 * The product rows are locked up front, in key order, so two invoices touching
 * the same products queue behind each other instead of both passing the
 * availability check. Everything runs in one transaction; any failure rolls all
 * of it back. The invoice number is the exception: it comes from a database
 * sequence, so a number drawn by an aborted attempt is skipped.
 * <p>
 * Callers should go through {@link InvoiceService#createInvoice}, which adds the
 * single retry on lock conflicts.
 */
@Service
public class InvoiceTransaction {

    private static final Logger logger = LoggerFactory.getLogger(InvoiceTransaction.class);

    private final ProductCatalogService catalog;
    private final InvoiceValidator validator;
    private final InvoiceCalculator calculator;
    private final InvoiceSequencer sequencer;
    private final InvoiceRepository invoiceRepository;
    private final AuditService auditService;

    public InvoiceTransaction(ProductCatalogService catalog, InvoiceValidator validator,
            InvoiceCalculator calculator, InvoiceSequencer sequencer, InvoiceRepository invoiceRepository,
            AuditService auditService) {
        this.catalog = catalog;
        this.validator = validator;
        this.calculator = calculator;
        this.sequencer = sequencer;
        this.invoiceRepository = invoiceRepository;
        this.auditService = auditService;
    }

    @Transactional
    public Invoice create(CustomerDetails customer, List<LineItemRequest> requestedItems) {
        InvoiceStage stage = InvoiceStage.VALIDATING;
        try {
            validator.validateCustomer(customer);
            Map<ProductKey, Long> requested = validator.requestedQuantities(requestedItems);
            Map<ProductKey, Product> products = lockProducts(requested.keySet());
            validator.checkAvailability(requested, products);

            stage = InvoiceStage.PRICING;
            List<PricedLine> lines = new ArrayList<>(requestedItems.size());
            for (LineItemRequest item : requestedItems) {
                ProductKey key = item.toKey();
                lines.add(calculator.priceLine(products.get(key), item.getQuantity()));
            }
            InvoiceTotals totals = calculator.totals(lines);

            stage = InvoiceStage.RESERVING;
            for (Map.Entry<ProductKey, Long> entry : requested.entrySet()) {
                // Fits in an int once it has passed the availability check
                catalog.reserve(entry.getKey(), Math.toIntExact(entry.getValue()));
            }

            stage = InvoiceStage.NUMBERING;
            long invoiceNumber = sequencer.next();

            stage = InvoiceStage.PERSISTING;
            Invoice invoice = buildInvoice(invoiceNumber, customer, lines, totals, products);
            Invoice saved = invoiceRepository.saveAndFlush(invoice);

            stage = InvoiceStage.COMMITTED;
            logger.info("Invoice {} for '{}' created: {} lines, subtotal {}, total {}", invoiceNumber,
                    customer.getName(), lines.size(), totals.subtotal(), totals.totalAmount());
            return saved;
        } catch (InvoicingException e) {
            logger.warn("Invoice for '{}' {} at {}: {}", customerName(customer), InvoiceStage.REJECTED, stage,
                    e.getMessage());
            throw e;
        } catch (ConcurrencyFailureException e) {
            // Lock timeout or version clash; the caller decides whether to retry
            logger.warn("Invoice for '{}' hit a concurrent update at {}: {}", customerName(customer), stage,
                    e.getMessage());
            throw e;
        } catch (DataAccessException e) {
            logger.error("Invoice for '{}' failed to persist at {}", customerName(customer), stage, e);
            throw new PersistenceFailureException("Invoice could not be saved; nothing was committed", e);
        }
    }

    // Locks in sorted key order so concurrent invoices cannot deadlock each other
    private Map<ProductKey, Product> lockProducts(Iterable<ProductKey> keys) {
        Map<ProductKey, Product> products = new HashMap<>();
        TreeSet<ProductKey> ordered = new TreeSet<>();
        keys.forEach(ordered::add);
        for (ProductKey key : ordered) {
            try {
                products.put(key, catalog.lockForUpdate(key));
            } catch (ProductNotFoundException e) {
                throw ValidationException.unknownProduct(key);
            }
        }
        return products;
    }

    private Invoice buildInvoice(long invoiceNumber, CustomerDetails customer, List<PricedLine> lines,
            InvoiceTotals totals, Map<ProductKey, Product> products) {
        Invoice invoice = new Invoice();
        invoice.setInvoiceNumber(invoiceNumber);
        invoice.setCustomer(customer);
        invoice.setStatus(InvoiceStatus.ACTIVE);
        invoice.setGstRate(totals.gstRate());
        invoice.setSubtotal(totals.subtotal());
        invoice.setCgstAmount(totals.cgstAmount());
        invoice.setSgstAmount(totals.sgstAmount());
        invoice.setTotalAmount(totals.totalAmount());
        invoice.setCreatedBy(auditService.currentUsername());

        for (PricedLine line : lines) {
            InvoiceItem item = new InvoiceItem();
            item.setProduct(products.get(line.product()));
            item.setProductName(line.product().name());
            item.setWeight(line.product().weight());
            item.setQuantity(line.quantity());
            item.setUnitPrice(line.unitPrice());
            item.setUnitCost(line.unitCost());
            item.setLineTotal(line.lineTotal());
            invoice.addItem(item);
        }
        return invoice;
    }

    private static String customerName(CustomerDetails customer) {
        return customer != null ? customer.getName() : null;
    }
}
