package com.tradedesk.invoicer.dto;

import com.tradedesk.invoicer.model.Product;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProductRequest {
    @NotBlank(message = "Product name is required")
    private String productName;

    private String weight;

    @NotNull(message = "Quantity is required")
    @PositiveOrZero(message = "Quantity cannot be negative")
    private Integer quantity;

    @PositiveOrZero(message = "Cost price cannot be negative")
    private BigDecimal costPrice;

    @NotNull(message = "Selling price is required")
    @Positive(message = "Selling price must be greater than 0")
    private BigDecimal sellingPrice;

    public Product toProduct() {
        Product product = new Product();
        product.setName(productName);
        product.setWeight(weight);
        product.setQuantity(quantity != null ? quantity : 0);
        product.setCostPrice(costPrice != null ? costPrice : BigDecimal.ZERO);
        product.setSellingPrice(sellingPrice);
        return product;
    }
}
