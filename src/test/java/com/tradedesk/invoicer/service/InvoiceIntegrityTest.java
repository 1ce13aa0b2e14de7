package com.tradedesk.invoicer.service;

import com.tradedesk.invoicer.dto.LineItemRequest;
import com.tradedesk.invoicer.dto.SummaryStats;
import com.tradedesk.invoicer.dto.TopProductRow;
import com.tradedesk.invoicer.exception.InsufficientStockException;
import com.tradedesk.invoicer.exception.PersistenceFailureException;
import com.tradedesk.invoicer.exception.ValidationException;
import com.tradedesk.invoicer.model.CustomerDetails;
import com.tradedesk.invoicer.model.Invoice;
import com.tradedesk.invoicer.model.InvoiceStatus;
import com.tradedesk.invoicer.model.Product;
import com.tradedesk.invoicer.model.ProductKey;
import com.tradedesk.invoicer.repository.AuditLogRepository;
import com.tradedesk.invoicer.repository.DamageLedgerRepository;
import com.tradedesk.invoicer.repository.InvoiceRepository;
import com.tradedesk.invoicer.repository.ProductRepository;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.math.BigDecimal;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs invoices against the real store, outside a test transaction, so that
 * commits and rollbacks behave as they do in production.
 */
@SpringBootTest
class InvoiceIntegrityTest {

    @Autowired
    private InvoiceService invoiceService;
    @Autowired
    private ProductCatalogService catalog;
    @Autowired
    private DamagedStockLedger damagedStockLedger;
    @Autowired
    private ReportService reportService;

    @Autowired
    private ProductRepository productRepository;
    @Autowired
    private InvoiceRepository invoiceRepository;
    @Autowired
    private DamageLedgerRepository damageLedgerRepository;
    @Autowired
    private AuditLogRepository auditLogRepository;

    private final ProductKey rice = ProductKey.of("Rice", "5kg");
    private final ProductKey soap = ProductKey.of("Soap", null);

    @BeforeEach
    void setUp() {
        catalog.add(product("Rice", "5kg", 10, "400.00", "500.00"));
        catalog.add(product("Soap", null, 100, "20.00", "25.00"));
    }

    @AfterEach
    void tearDown() {
        invoiceRepository.deleteAll();
        damageLedgerRepository.deleteAll();
        productRepository.deleteAll();
        auditLogRepository.deleteAll();
    }

    @Test
    void createInvoice_ShouldComputeGstAndDecrementStock() {
        Invoice invoice = invoiceService.createInvoice(customer("A"),
                List.of(line("Rice", "5kg", 2), line("Soap", null, 20)));

        assertNotNull(invoice.getInvoiceNumber());
        assertEquals(new BigDecimal("1500.00"), invoice.getSubtotal());
        assertEquals(new BigDecimal("135.00"), invoice.getCgstAmount());
        assertEquals(new BigDecimal("135.00"), invoice.getSgstAmount());
        assertEquals(new BigDecimal("1770.00"), invoice.getTotalAmount());
        assertEquals(8, catalog.get(rice).getQuantity());
        assertEquals(80, catalog.get(soap).getQuantity());

        Invoice stored = invoiceService.findByNumber(invoice.getInvoiceNumber());
        assertEquals(2, stored.getItems().size());
        assertEquals("Rice", stored.getItems().get(0).getProductName());
        assertEquals(0, new BigDecimal("500.00").compareTo(stored.getItems().get(0).getUnitPrice()));
        assertEquals(1, auditLogRepository.findByActionOrderByIdDesc("INVOICE_CREATED").size());
    }

    @Test
    void createInvoice_ShouldChangeNothing_WhenOneLineIsShort() {
        Invoice first = invoiceService.createInvoice(customer("A"), List.of(line("Soap", null, 1)));

        InsufficientStockException ex = assertThrows(InsufficientStockException.class,
                () -> invoiceService.createInvoice(customer("B"),
                        List.of(line("Soap", null, 5), line("Rice", "5kg", 11))));

        assertEquals(rice, ex.getProduct());
        assertEquals(11, ex.getRequested());
        assertEquals(10, ex.getAvailable());
        assertEquals(10, catalog.get(rice).getQuantity());
        assertEquals(99, catalog.get(soap).getQuantity());
        assertEquals(1, invoiceRepository.count());

        // Rejected before numbering, so no number was consumed
        Invoice next = invoiceService.createInvoice(customer("C"), List.of(line("Soap", null, 1)));
        assertEquals(first.getInvoiceNumber() + 1, next.getInvoiceNumber());
    }

    @Test
    void createInvoice_ShouldRejectEmptyInvoice() {
        assertThrows(ValidationException.class, () -> invoiceService.createInvoice(customer("A"), List.of()));
        assertEquals(0, invoiceRepository.count());
    }

    @Test
    void createInvoice_ShouldRollBackStockAndSkipNumber_WhenPersistingFails() {
        Invoice first = invoiceService.createInvoice(customer("A"), List.of(line("Rice", "5kg", 1)));

        // Longer than the customer_name column, so the insert fails after numbering
        String tooLong = "X".repeat(300);
        assertThrows(PersistenceFailureException.class,
                () -> invoiceService.createInvoice(customer(tooLong), List.of(line("Rice", "5kg", 2))));
        assertEquals(9, catalog.get(rice).getQuantity());
        assertEquals(1, invoiceRepository.count());

        Invoice next = invoiceService.createInvoice(customer("B"), List.of(line("Rice", "5kg", 1)));
        assertEquals(first.getInvoiceNumber() + 2, next.getInvoiceNumber());
        assertEquals(8, catalog.get(rice).getQuantity());
    }

    @Test
    void createInvoice_ShouldAllowExactRemainingStock() {
        invoiceService.createInvoice(customer("A"), List.of(line("Rice", "5kg", 10)));

        assertEquals(0, catalog.get(rice).getQuantity());
        assertThrows(InsufficientStockException.class,
                () -> invoiceService.createInvoice(customer("B"), List.of(line("Rice", "5kg", 1))));
    }

    @Test
    void createInvoice_ShouldRespectDamagedStock() {
        damagedStockLedger.markDamaged(rice, 3);

        InsufficientStockException ex = assertThrows(InsufficientStockException.class,
                () -> invoiceService.createInvoice(customer("A"), List.of(line("Rice", "5kg", 8))));
        assertEquals(7, ex.getAvailable());

        Product product = catalog.get(rice);
        assertEquals(7, product.getQuantity());
        assertEquals(3, product.getDamagedQuantity());
        assertEquals(1, damagedStockLedger.history(rice).size());
    }

    @Test
    void voidInvoice_ShouldRestockAndDropOutOfReports() {
        Invoice invoice = invoiceService.createInvoice(customer("A"),
                List.of(line("Rice", "5kg", 2), line("Soap", null, 20)));
        invoiceService.createInvoice(customer("B"), List.of(line("Soap", null, 4)));

        SummaryStats beforeVoid = reportService.summary(ReportPeriod.DAILY);
        assertEquals(2, beforeVoid.totalInvoices());
        assertEquals(26, beforeVoid.totalProductsSold());
        assertEquals(2, beforeVoid.uniqueCustomers());

        Invoice voided = invoiceService.voidInvoice(invoice.getInvoiceNumber(), "Entered twice");

        assertEquals(InvoiceStatus.VOIDED, voided.getStatus());
        assertEquals(new BigDecimal("1770.00"), voided.getTotalAmount());
        assertEquals(10, catalog.get(rice).getQuantity());
        assertEquals(96, catalog.get(soap).getQuantity());

        SummaryStats afterVoid = reportService.summary(ReportPeriod.DAILY);
        assertEquals(1, afterVoid.totalInvoices());
        assertEquals(4, afterVoid.totalProductsSold());
        // 4 * 25.00 = 100.00, plus 18% GST
        assertEquals(new BigDecimal("118.00"), afterVoid.totalRevenue());
        // 4 * (25.00 - 20.00)
        assertEquals(new BigDecimal("20.00"), afterVoid.totalProfit());
    }

    @Test
    void topProducts_ShouldRankByQuantitySold() {
        invoiceService.createInvoice(customer("A"), List.of(line("Rice", "5kg", 2), line("Soap", null, 20)));
        invoiceService.createInvoice(customer("B"), List.of(line("Soap", null, 5)));

        List<TopProductRow> top = reportService.topProducts(ReportPeriod.WEEKLY, 10);

        assertEquals(2, top.size());
        assertEquals("Soap", top.get(0).productName());
        assertEquals(25, top.get(0).totalSold());
        assertEquals(2, top.get(0).timesOrdered());
        assertEquals("Rice (5kg)", top.get(1).productName());
    }

    private static CustomerDetails customer(String name) {
        return new CustomerDetails(name, null, null);
    }

    private static LineItemRequest line(String name, String weight, int qty) {
        return LineItemRequest.builder().productName(name).weight(weight).quantity(qty).build();
    }

    private static Product product(String name, String weight, int qty, String cost, String price) {
        Product p = new Product();
        p.setName(name);
        p.setWeight(weight);
        p.setQuantity(qty);
        p.setCostPrice(new BigDecimal(cost));
        p.setSellingPrice(new BigDecimal(price));
        return p;
    }
}
