package com.tradedesk.invoicer.service;

import com.tradedesk.invoicer.repository.InvoiceRepository;
import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Hands out invoice numbers from a database sequence.
 * <p>
 * {@link #next()} draws from the sequence on the caller's own connection, inside
 * the invoice transaction it numbers. A sequence value is never returned twice
 * and is not given back on rollback, so numbering may have gaps but never
 * duplicates.
 */
@Service
public class InvoiceSequencer {

    private static final Logger logger = LoggerFactory.getLogger(InvoiceSequencer.class);

    static final String SEQUENCE_NAME = "invoice_number_seq";

    @PersistenceContext
    private EntityManager entityManager;

    private final InvoiceRepository invoiceRepository;

    public InvoiceSequencer(InvoiceRepository invoiceRepository) {
        this.invoiceRepository = invoiceRepository;
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public long next() {
        Number value = (Number) entityManager
                .createNativeQuery("SELECT NEXT VALUE FOR " + SEQUENCE_NAME)
                .getSingleResult();
        logger.debug("Allocated invoice number {}", value);
        return value.longValue();
    }

    /**
     * Creates the sequence if it is missing, starting above the highest stored
     * invoice. Called once at startup.
     */
    @Transactional
    public void ensureSequence() {
        Long highest = invoiceRepository.findMaxInvoiceNumber();
        long start = (highest != null ? highest : 0L) + 1;
        entityManager.createNativeQuery("CREATE SEQUENCE IF NOT EXISTS " + SEQUENCE_NAME + " START WITH " + start)
                .executeUpdate();
        logger.info("Invoice number sequence ready, first new number at least {}", start);
    }
}
