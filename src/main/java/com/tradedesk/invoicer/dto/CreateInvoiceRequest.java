package com.tradedesk.invoicer.dto;

import com.tradedesk.invoicer.model.CustomerDetails;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateInvoiceRequest {
    private String customerName;
    private String customerPhone;
    private String customerAddress;

    @Builder.Default
    private List<LineItemRequest> items = new ArrayList<>();

    public CustomerDetails toCustomer() {
        return new CustomerDetails(trimToNull(customerName), trimToNull(customerPhone),
                trimToNull(customerAddress));
    }

    private static String trimToNull(String value) {
        if (value == null)
            return null;
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
