package com.tradedesk.invoicer.dto;

import java.math.BigDecimal;

public record SettingsResponse(
        String companyName,
        String companyPhone,
        String companyAddress,
        BigDecimal gstRate,
        String currencySymbol) {
}
