package com.tradedesk.invoicer.controller;

import com.tradedesk.invoicer.dto.ProductProfitRow;
import com.tradedesk.invoicer.dto.ProductSalesRow;
import com.tradedesk.invoicer.dto.SummaryStats;
import com.tradedesk.invoicer.dto.TopProductRow;
import com.tradedesk.invoicer.service.ReportPeriod;
import com.tradedesk.invoicer.service.ReportService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/reports")
public class ReportController {

    private final ReportService reportService;

    public ReportController(ReportService reportService) {
        this.reportService = reportService;
    }

    @GetMapping("/summary/{period}")
    public SummaryStats summary(@PathVariable String period) {
        return reportService.summary(ReportPeriod.fromPath(period));
    }

    @GetMapping("/sales/{period}")
    public List<ProductSalesRow> sales(@PathVariable String period) {
        return reportService.salesByProduct(ReportPeriod.fromPath(period));
    }

    @GetMapping("/profit/{period}")
    public List<ProductProfitRow> profit(@PathVariable String period) {
        return reportService.profit(ReportPeriod.fromPath(period));
    }

    @GetMapping("/top-products/{period}")
    public List<TopProductRow> topProducts(@PathVariable String period,
            @RequestParam(defaultValue = "10") int limit) {
        return reportService.topProducts(ReportPeriod.fromPath(period), limit);
    }
}
