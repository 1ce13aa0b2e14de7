package com.tradedesk.invoicer.repository;

import com.tradedesk.invoicer.model.Invoice;
import com.tradedesk.invoicer.model.InvoiceStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

public interface InvoiceRepository extends JpaRepository<Invoice, Long> {
    @EntityGraph(attributePaths = "items")
    @Query("SELECT i FROM Invoice i WHERE i.invoiceNumber = :invoiceNumber")
    Optional<Invoice> findWithItemsByInvoiceNumber(@Param("invoiceNumber") Long invoiceNumber);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT i FROM Invoice i WHERE i.invoiceNumber = :invoiceNumber")
    Optional<Invoice> findByInvoiceNumberForUpdate(@Param("invoiceNumber") Long invoiceNumber);

    List<Invoice> findTop50ByOrderByInvoiceNumberDesc();

    @Query("SELECT MAX(i.invoiceNumber) FROM Invoice i")
    Long findMaxInvoiceNumber();

    long countByStatusAndCreatedAtGreaterThanEqual(InvoiceStatus status, LocalDateTime from);

    @Query("SELECT COALESCE(SUM(i.totalAmount), 0) FROM Invoice i WHERE i.status = :status AND i.createdAt >= :from")
    BigDecimal sumTotalAmount(@Param("status") InvoiceStatus status, @Param("from") LocalDateTime from);

    @Query("SELECT COUNT(DISTINCT i.customer.name) FROM Invoice i WHERE i.status = :status AND i.createdAt >= :from")
    long countDistinctCustomers(@Param("status") InvoiceStatus status, @Param("from") LocalDateTime from);
}
