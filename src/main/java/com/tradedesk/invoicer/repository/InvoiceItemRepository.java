package com.tradedesk.invoicer.repository;

import com.tradedesk.invoicer.dto.ProductSalesTotals;
import com.tradedesk.invoicer.model.InvoiceItem;
import com.tradedesk.invoicer.model.InvoiceStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;

public interface InvoiceItemRepository extends JpaRepository<InvoiceItem, Long> {

    long countByProductId(Long productId);

    @Query("SELECT new com.tradedesk.invoicer.dto.ProductSalesTotals(ii.productName, ii.weight, SUM(ii.quantity), "
            + "SUM(ii.lineTotal), SUM(ii.quantity * ii.unitCost), COUNT(ii), COUNT(DISTINCT ii.invoice.id)) "
            + "FROM InvoiceItem ii WHERE ii.invoice.status = :status AND ii.invoice.createdAt >= :from "
            + "GROUP BY ii.productName, ii.weight")
    List<ProductSalesTotals> aggregateByProduct(@Param("status") InvoiceStatus status,
            @Param("from") LocalDateTime from);

    @Query("SELECT COALESCE(SUM(ii.quantity), 0) FROM InvoiceItem ii "
            + "WHERE ii.invoice.status = :status AND ii.invoice.createdAt >= :from")
    long sumQuantitySold(@Param("status") InvoiceStatus status, @Param("from") LocalDateTime from);

    @Query("SELECT COALESCE(SUM(ii.lineTotal - ii.quantity * ii.unitCost), 0) FROM InvoiceItem ii "
            + "WHERE ii.invoice.status = :status AND ii.invoice.createdAt >= :from")
    BigDecimal sumProfit(@Param("status") InvoiceStatus status, @Param("from") LocalDateTime from);
}
