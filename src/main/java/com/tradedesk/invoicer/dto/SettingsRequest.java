package com.tradedesk.invoicer.dto;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@NoArgsConstructor
public class SettingsRequest {
    private String companyName;
    private String companyPhone;
    private String companyAddress;
    private BigDecimal gstRate;
}
