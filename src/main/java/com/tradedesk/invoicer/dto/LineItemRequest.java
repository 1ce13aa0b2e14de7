package com.tradedesk.invoicer.dto;

import com.tradedesk.invoicer.model.ProductKey;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LineItemRequest {
    private String productName;
    private String weight;
    // Checked by the invoice validator so the rejection names the product
    private Integer quantity;

    public ProductKey toKey() {
        return ProductKey.of(productName, weight);
    }
}
