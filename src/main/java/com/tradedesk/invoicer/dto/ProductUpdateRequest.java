package com.tradedesk.invoicer.dto;

import com.tradedesk.invoicer.model.ProductKey;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProductUpdateRequest {
    @NotBlank(message = "Product name is required")
    private String productName;

    private String weight;

    private Integer quantity;
    private BigDecimal costPrice;
    private BigDecimal sellingPrice;

    public ProductKey toKey() {
        return ProductKey.of(productName, weight);
    }

    public ProductUpdate toUpdate() {
        return new ProductUpdate(quantity, costPrice, sellingPrice);
    }
}
