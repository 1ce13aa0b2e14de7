package com.tradedesk.invoicer.dto;

import com.tradedesk.invoicer.model.ProductKey;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Body of the mark-damaged and restore calls.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StockAdjustmentRequest {
    @NotBlank(message = "Product name is required")
    private String productName;

    private String weight;

    @NotNull(message = "Quantity is required")
    private Integer quantity;

    public ProductKey toKey() {
        return ProductKey.of(productName, weight);
    }
}
