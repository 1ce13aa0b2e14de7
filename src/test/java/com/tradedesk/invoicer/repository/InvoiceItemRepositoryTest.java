package com.tradedesk.invoicer.repository;

import com.tradedesk.invoicer.dto.ProductSalesTotals;
import com.tradedesk.invoicer.model.CustomerDetails;
import com.tradedesk.invoicer.model.Invoice;
import com.tradedesk.invoicer.model.InvoiceItem;
import com.tradedesk.invoicer.model.InvoiceStatus;
import com.tradedesk.invoicer.model.Product;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DataJpaTest
class InvoiceItemRepositoryTest {

    @Autowired
    private InvoiceItemRepository invoiceItemRepository;

    @Autowired
    private InvoiceRepository invoiceRepository;

    @Autowired
    private ProductRepository productRepository;

    private Product rice;
    private LocalDateTime startOfToday;

    @BeforeEach
    void setUp() {
        rice = new Product();
        rice.setName("Rice");
        rice.setWeight("5kg");
        rice.setQuantity(100);
        rice.setCostPrice(new BigDecimal("400.00"));
        rice.setSellingPrice(new BigDecimal("500.00"));
        productRepository.save(rice);
        startOfToday = LocalDate.now().atStartOfDay();
    }

    @Test
    void aggregateByProduct_ShouldSkipVoidedInvoices() {
        invoiceRepository.save(invoice(1L, "A", InvoiceStatus.ACTIVE, 2));
        invoiceRepository.save(invoice(2L, "B", InvoiceStatus.ACTIVE, 1));
        invoiceRepository.save(invoice(3L, "C", InvoiceStatus.VOIDED, 5));
        invoiceRepository.flush();

        List<ProductSalesTotals> totals = invoiceItemRepository.aggregateByProduct(InvoiceStatus.ACTIVE,
                startOfToday);

        assertEquals(1, totals.size());
        ProductSalesTotals row = totals.get(0);
        assertEquals("Rice", row.productName());
        assertEquals(3L, row.quantitySold());
        assertEquals(0, new BigDecimal("1500.00").compareTo(row.revenue()));
        assertEquals(0, new BigDecimal("1200.00").compareTo(row.cost()));
        assertEquals(2L, row.invoiceCount());
    }

    @Test
    void sums_ShouldUseSnapshottedCost() {
        invoiceRepository.save(invoice(10L, "A", InvoiceStatus.ACTIVE, 2));
        invoiceRepository.flush();

        assertEquals(2L, invoiceItemRepository.sumQuantitySold(InvoiceStatus.ACTIVE, startOfToday));
        assertEquals(0, new BigDecimal("200.00")
                .compareTo(invoiceItemRepository.sumProfit(InvoiceStatus.ACTIVE, startOfToday)));
        assertEquals(1L, invoiceItemRepository.countByProductId(rice.getId()));
    }

    @Test
    void invoiceQueries_ShouldFindByNumberAndMax() {
        invoiceRepository.save(invoice(4L, "A", InvoiceStatus.ACTIVE, 1));
        invoiceRepository.save(invoice(7L, "A", InvoiceStatus.ACTIVE, 1));
        invoiceRepository.flush();

        assertEquals(7L, invoiceRepository.findMaxInvoiceNumber());
        assertTrue(invoiceRepository.findWithItemsByInvoiceNumber(4L).isPresent());
        assertEquals(1L, invoiceRepository.countDistinctCustomers(InvoiceStatus.ACTIVE, startOfToday));
        assertEquals(List.of(7L, 4L), invoiceRepository.findTop50ByOrderByInvoiceNumberDesc().stream()
                .map(Invoice::getInvoiceNumber).toList());
    }

    private Invoice invoice(Long number, String customer, InvoiceStatus status, int qty) {
        BigDecimal lineTotal = new BigDecimal("500.00").multiply(BigDecimal.valueOf(qty));
        Invoice invoice = new Invoice();
        invoice.setInvoiceNumber(number);
        invoice.setCustomer(new CustomerDetails(customer, null, null));
        invoice.setStatus(status);
        invoice.setGstRate(new BigDecimal("18"));
        invoice.setSubtotal(lineTotal);
        invoice.setCgstAmount(BigDecimal.ZERO);
        invoice.setSgstAmount(BigDecimal.ZERO);
        invoice.setTotalAmount(lineTotal);

        InvoiceItem item = new InvoiceItem();
        item.setProduct(rice);
        item.setProductName("Rice");
        item.setWeight("5kg");
        item.setQuantity(qty);
        item.setUnitPrice(new BigDecimal("500.00"));
        item.setUnitCost(new BigDecimal("400.00"));
        item.setLineTotal(lineTotal);
        invoice.addItem(item);
        return invoice;
    }
}
