package com.tradedesk.invoicer.repository;

import com.tradedesk.invoicer.model.Product;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.dao.DataIntegrityViolationException;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

@DataJpaTest
class ProductRepositoryTest {

    @Autowired
    private ProductRepository productRepository;

    @Test
    void findByKeyForUpdate_ShouldReturnProduct() {
        productRepository.save(product("Rice", "5kg", 10, 0));

        Optional<Product> result = productRepository.findByKeyForUpdate("Rice", "5kg");

        assertTrue(result.isPresent());
        assertEquals("Rice (5kg)", result.get().getFullProductName());
        assertEquals(10, result.get().getQuantity());
    }

    @Test
    void save_ShouldNormalizeKeyAndDeriveFullName() {
        Product saved = productRepository.saveAndFlush(product("  Soap ", null, 5, 0));

        assertEquals("Soap", saved.getName());
        assertEquals("", saved.getWeight());
        assertEquals("Soap", saved.getFullProductName());
        assertTrue(productRepository.findByNameAndWeight("Soap", "").isPresent());
    }

    @Test
    void save_ShouldRejectDuplicateNameAndWeight() {
        productRepository.saveAndFlush(product("Rice", "5kg", 10, 0));

        assertThrows(DataIntegrityViolationException.class,
                () -> productRepository.saveAndFlush(product("Rice", "5kg", 3, 0)));
    }

    @Test
    void sameNameDifferentWeight_ShouldBeSeparateProducts() {
        productRepository.saveAndFlush(product("Rice", "5kg", 10, 0));
        productRepository.saveAndFlush(product("Rice", "10kg", 4, 0));

        List<Product> all = productRepository.findAllByOrderByNameAscWeightAsc();

        assertEquals(2, all.size());
        assertEquals("Rice (10kg)", all.get(0).getFullProductName());
    }

    @Test
    void damagedQueries_ShouldSumAndOrder() {
        productRepository.save(product("Rice", "5kg", 7, 3));
        productRepository.save(product("Sugar", "1kg", 5, 5));
        productRepository.save(product("Soap", null, 9, 0));

        List<Product> damaged = productRepository
                .findByDamagedQuantityGreaterThanOrderByDamagedQuantityDescNameAsc(0);

        assertEquals(2, damaged.size());
        assertEquals("Sugar", damaged.get(0).getName());
        assertEquals(8, productRepository.sumDamagedQuantity());
        // 3 * 10.00 + 5 * 10.00
        assertEquals(0, new BigDecimal("80.00").compareTo(productRepository.sumDamagedValue()));
    }

    private static Product product(String name, String weight, int qty, int damaged) {
        Product p = new Product();
        p.setName(name);
        p.setWeight(weight);
        p.setQuantity(qty);
        p.setDamagedQuantity(damaged);
        p.setCostPrice(BigDecimal.TEN);
        p.setSellingPrice(new BigDecimal("15.00"));
        return p;
    }
}
