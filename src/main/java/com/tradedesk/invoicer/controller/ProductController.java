package com.tradedesk.invoicer.controller;

import com.tradedesk.invoicer.dto.ProductRequest;
import com.tradedesk.invoicer.dto.ProductUpdateRequest;
import com.tradedesk.invoicer.model.Product;
import com.tradedesk.invoicer.model.ProductKey;
import com.tradedesk.invoicer.service.ProductCatalogService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/products")
public class ProductController {

    private final ProductCatalogService catalog;

    public ProductController(ProductCatalogService catalog) {
        this.catalog = catalog;
    }

    @GetMapping
    public List<Product> list() {
        return catalog.list();
    }

    // Either name (+ weight) or the display name, e.g. "Rice (5kg)"
    @GetMapping("/lookup")
    public Product lookup(@RequestParam(required = false) String name,
            @RequestParam(required = false) String weight,
            @RequestParam(required = false) String fullName) {
        if (fullName != null && !fullName.isBlank()) {
            return catalog.findByFullProductName(fullName);
        }
        return catalog.get(ProductKey.of(name, weight));
    }

    @PostMapping
    public ResponseEntity<Product> add(@Valid @RequestBody ProductRequest request) {
        Product created = catalog.add(request.toProduct());
        return ResponseEntity.status(HttpStatus.CREATED).body(created);
    }

    @PutMapping
    public Product update(@Valid @RequestBody ProductUpdateRequest request) {
        return catalog.update(request.toKey(), request.toUpdate());
    }

    @DeleteMapping
    public ResponseEntity<Void> remove(@RequestParam String name, @RequestParam(required = false) String weight) {
        catalog.remove(ProductKey.of(name, weight));
        return ResponseEntity.noContent().build();
    }
}
