package com.tradedesk.invoicer.dto;

import java.util.List;

public record InvoicePreview(List<PricedLine> lines, InvoiceTotals totals) {
}
