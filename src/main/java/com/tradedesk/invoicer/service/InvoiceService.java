package com.tradedesk.invoicer.service;

import com.tradedesk.invoicer.dto.InvoicePreview;
import com.tradedesk.invoicer.dto.LineItemRequest;
import com.tradedesk.invoicer.dto.PricedLine;
import com.tradedesk.invoicer.exception.InvoiceAlreadyVoidedException;
import com.tradedesk.invoicer.exception.InvoiceNotFoundException;
import com.tradedesk.invoicer.exception.PersistenceFailureException;
import com.tradedesk.invoicer.exception.ProductNotFoundException;
import com.tradedesk.invoicer.exception.StockConflictException;
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
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

@Service
public class InvoiceService {

    private static final Logger logger = LoggerFactory.getLogger(InvoiceService.class);

    private final InvoiceTransaction invoiceTransaction;
    private final InvoiceRepository invoiceRepository;
    private final ProductCatalogService catalog;
    private final InvoiceValidator validator;
    private final InvoiceCalculator calculator;
    private final AuditService auditService;

    public InvoiceService(InvoiceTransaction invoiceTransaction, InvoiceRepository invoiceRepository,
            ProductCatalogService catalog, InvoiceValidator validator, InvoiceCalculator calculator,
            AuditService auditService) {
        this.invoiceTransaction = invoiceTransaction;
        this.invoiceRepository = invoiceRepository;
        this.catalog = catalog;
        this.validator = validator;
        this.calculator = calculator;
        this.auditService = auditService;
    }

    /**
     * Creates and commits an invoice. A lock conflict on the first attempt is
     * retried once from validation onwards; a second conflict surfaces as
     * {@link StockConflictException}.
     */
    public Invoice createInvoice(CustomerDetails customer, List<LineItemRequest> items) {
        Invoice invoice;
        try {
            invoice = attempt(customer, items);
        } catch (ConcurrencyFailureException first) {
            logger.warn("Concurrent stock update while invoicing '{}', retrying once", customer.getName());
            try {
                invoice = attempt(customer, items);
            } catch (ConcurrencyFailureException second) {
                throw new StockConflictException(
                        "Stock for this invoice is being changed concurrently, please try again", second);
            }
        }
        auditService.log("INVOICE_CREATED", "Invoice: " + invoice.getInvoiceNumber() + ", Customer: "
                + customer.getName() + ", Total: " + invoice.getTotalAmount());
        return invoice;
    }

    private Invoice attempt(CustomerDetails customer, List<LineItemRequest> items) {
        try {
            return invoiceTransaction.create(customer, items);
        } catch (ConcurrencyFailureException e) {
            throw e;
        } catch (DataAccessException | TransactionException e) {
            // Commit-time failures surface here rather than inside the transaction
            logger.error("Invoice for '{}' could not be committed", customer.getName(), e);
            throw new PersistenceFailureException("Invoice could not be saved; nothing was committed", e);
        }
    }

    /**
     * Validates and prices a request without locking or changing anything.
     * Availability is checked against the current snapshot only.
     */
    @Transactional(readOnly = true)
    public InvoicePreview preview(List<LineItemRequest> items) {
        Map<ProductKey, Long> requested = validator.requestedQuantities(items);
        Map<ProductKey, Product> products = new HashMap<>();
        for (ProductKey key : requested.keySet()) {
            try {
                products.put(key, catalog.get(key));
            } catch (ProductNotFoundException e) {
                throw ValidationException.unknownProduct(key);
            }
        }
        validator.checkAvailability(requested, products);

        List<PricedLine> lines = items.stream()
                .map(item -> calculator.priceLine(products.get(item.toKey()), item.getQuantity()))
                .toList();
        return new InvoicePreview(lines, calculator.totals(lines));
    }

    @Transactional(readOnly = true)
    public Invoice findByNumber(long invoiceNumber) {
        return invoiceRepository.findWithItemsByInvoiceNumber(invoiceNumber)
                .orElseThrow(() -> new InvoiceNotFoundException(invoiceNumber));
    }

    @Transactional(readOnly = true)
    public List<Invoice> listRecent() {
        return invoiceRepository.findTop50ByOrderByInvoiceNumberDesc();
    }

    /**
     * Voids an active invoice and returns its quantities to sellable stock. The
     * number, lines and totals stay as they were.
     */
    @Transactional
    public Invoice voidInvoice(long invoiceNumber, String reason) {
        Invoice invoice = invoiceRepository.findByInvoiceNumberForUpdate(invoiceNumber)
                .orElseThrow(() -> new InvoiceNotFoundException(invoiceNumber));
        if (invoice.isVoided()) {
            throw new InvoiceAlreadyVoidedException(invoiceNumber);
        }

        // Same lock order as invoice creation
        Map<ProductKey, Integer> returned = new TreeMap<>();
        for (InvoiceItem item : invoice.getItems()) {
            returned.merge(item.getProduct().key(), item.getQuantity(), Integer::sum);
        }
        returned.forEach(catalog::release);

        invoice.setStatus(InvoiceStatus.VOIDED);
        invoice.setVoidedAt(LocalDateTime.now());
        invoice.setVoidReason(reason);
        Invoice saved = invoiceRepository.save(invoice);

        logger.info("Invoice {} voided, {} products restocked", invoiceNumber, returned.size());
        auditService.log("INVOICE_VOIDED", "Invoice: " + invoiceNumber + ", Reason: " + reason);
        return saved;
    }
}
