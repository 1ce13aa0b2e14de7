package com.tradedesk.invoicer.service;

import com.tradedesk.invoicer.dto.ProductProfitRow;
import com.tradedesk.invoicer.dto.ProductSalesRow;
import com.tradedesk.invoicer.dto.ProductSalesTotals;
import com.tradedesk.invoicer.dto.SummaryStats;
import com.tradedesk.invoicer.dto.TopProductRow;
import com.tradedesk.invoicer.model.InvoiceStatus;
import com.tradedesk.invoicer.model.ProductKey;
import com.tradedesk.invoicer.repository.InvoiceItemRepository;
import com.tradedesk.invoicer.repository.InvoiceRepository;
import com.tradedesk.invoicer.repository.ProductRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Comparator;
import java.util.List;

/**
 * Read-only summaries over committed, non-voided invoices and current stock.
 * Runs without locks, so figures may trail in-flight invoices slightly.
 */
@Service
@Transactional(readOnly = true)
public class ReportService {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final InvoiceRepository invoiceRepository;
    private final InvoiceItemRepository invoiceItemRepository;
    private final ProductRepository productRepository;

    public ReportService(InvoiceRepository invoiceRepository, InvoiceItemRepository invoiceItemRepository,
            ProductRepository productRepository) {
        this.invoiceRepository = invoiceRepository;
        this.invoiceItemRepository = invoiceItemRepository;
        this.productRepository = productRepository;
    }

    public SummaryStats summary(ReportPeriod period) {
        LocalDateTime from = period.since(LocalDate.now());
        return new SummaryStats(
                invoiceRepository.countByStatusAndCreatedAtGreaterThanEqual(InvoiceStatus.ACTIVE, from),
                money(invoiceRepository.sumTotalAmount(InvoiceStatus.ACTIVE, from)),
                money(invoiceItemRepository.sumProfit(InvoiceStatus.ACTIVE, from)),
                invoiceItemRepository.sumQuantitySold(InvoiceStatus.ACTIVE, from),
                productRepository.sumDamagedQuantity(),
                money(productRepository.sumDamagedValue()),
                invoiceRepository.countDistinctCustomers(InvoiceStatus.ACTIVE, from));
    }

    /**
     * Units and revenue per product, best sellers first.
     */
    public List<ProductSalesRow> salesByProduct(ReportPeriod period) {
        return totals(period).stream()
                .map(t -> new ProductSalesRow(
                        displayName(t),
                        t.quantitySold(),
                        money(t.revenue()),
                        t.lineCount(),
                        t.quantitySold() > 0
                                ? t.revenue().divide(BigDecimal.valueOf(t.quantitySold()), 2, RoundingMode.HALF_UP)
                                : BigDecimal.ZERO))
                .sorted(Comparator.comparingLong(ProductSalesRow::totalQuantity).reversed()
                        .thenComparing(ProductSalesRow::productName))
                .toList();
    }

    /**
     * Profit per product from the cost captured on each invoice line, most
     * profitable first.
     */
    public List<ProductProfitRow> profit(ReportPeriod period) {
        return totals(period).stream()
                .map(t -> {
                    BigDecimal revenue = money(t.revenue());
                    BigDecimal cost = money(t.cost());
                    BigDecimal profit = revenue.subtract(cost);
                    BigDecimal margin = revenue.signum() > 0
                            ? profit.multiply(HUNDRED).divide(revenue, 2, RoundingMode.HALF_UP)
                            : BigDecimal.ZERO;
                    return new ProductProfitRow(displayName(t), t.quantitySold(), revenue, cost, profit, margin);
                })
                .sorted(Comparator.comparing(ProductProfitRow::profit).reversed()
                        .thenComparing(ProductProfitRow::productName))
                .toList();
    }

    public List<TopProductRow> topProducts(ReportPeriod period, int limit) {
        return totals(period).stream()
                .sorted(Comparator.comparing(ProductSalesTotals::quantitySold).reversed()
                        .thenComparing(ProductSalesTotals::productName))
                .limit(Math.max(limit, 0))
                .map(t -> new TopProductRow(
                        displayName(t),
                        t.quantitySold(),
                        money(t.revenue()),
                        t.invoiceCount(),
                        t.invoiceCount() > 0
                                ? BigDecimal.valueOf(t.quantitySold()).divide(BigDecimal.valueOf(t.invoiceCount()),
                                        2, RoundingMode.HALF_UP)
                                : BigDecimal.ZERO))
                .toList();
    }

    private List<ProductSalesTotals> totals(ReportPeriod period) {
        return invoiceItemRepository.aggregateByProduct(InvoiceStatus.ACTIVE, period.since(LocalDate.now()));
    }

    private static String displayName(ProductSalesTotals totals) {
        return ProductKey.of(totals.productName(), totals.weight()).fullProductName();
    }

    private static BigDecimal money(BigDecimal value) {
        return (value != null ? value : BigDecimal.ZERO).setScale(2, RoundingMode.HALF_UP);
    }
}
