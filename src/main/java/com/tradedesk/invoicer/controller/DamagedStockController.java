package com.tradedesk.invoicer.controller;

import com.tradedesk.invoicer.dto.DamagedProductRow;
import com.tradedesk.invoicer.dto.StockAdjustmentRequest;
import com.tradedesk.invoicer.model.Product;
import com.tradedesk.invoicer.service.DamagedStockLedger;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Moves units between sellable and damaged stock.
 */
@RestController
@RequestMapping("/api/products")
public class DamagedStockController {

    private final DamagedStockLedger ledger;

    public DamagedStockController(DamagedStockLedger ledger) {
        this.ledger = ledger;
    }

    @PutMapping("/damaged")
    public Product markDamaged(@Valid @RequestBody StockAdjustmentRequest request) {
        return ledger.markDamaged(request.toKey(), request.getQuantity());
    }

    @PutMapping("/restore")
    public Product restore(@Valid @RequestBody StockAdjustmentRequest request) {
        return ledger.restore(request.toKey(), request.getQuantity());
    }

    @GetMapping("/damaged-report")
    public List<DamagedProductRow> damagedReport() {
        return ledger.damagedReport();
    }
}
