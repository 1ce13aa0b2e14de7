package com.tradedesk.invoicer.dto;

import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
public class VoidInvoiceRequest {
    private String reason;
}
