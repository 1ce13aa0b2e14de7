package com.tradedesk.invoicer.repository;

import com.tradedesk.invoicer.model.Product;
import jakarta.persistence.LockModeType;
import jakarta.persistence.QueryHint;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.jpa.repository.QueryHints;
import org.springframework.data.repository.query.Param;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

public interface ProductRepository extends JpaRepository<Product, Long> {
    Optional<Product> findByNameAndWeight(String name, String weight);

    Optional<Product> findByFullProductName(String fullProductName);

    boolean existsByNameAndWeight(String name, String weight);

    List<Product> findAllByOrderByNameAscWeightAsc();

    /**
     * Loads the product row with a write lock held until the surrounding
     * transaction ends. Every stock mutation goes through this.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @QueryHints(@QueryHint(name = "jakarta.persistence.lock.timeout", value = "5000"))
    @Query("SELECT p FROM Product p WHERE p.name = :name AND p.weight = :weight")
    Optional<Product> findByKeyForUpdate(@Param("name") String name, @Param("weight") String weight);

    List<Product> findByDamagedQuantityGreaterThanOrderByDamagedQuantityDescNameAsc(int damagedQuantity);

    @Query("SELECT COALESCE(SUM(p.damagedQuantity), 0) FROM Product p")
    long sumDamagedQuantity();

    @Query("SELECT COALESCE(SUM(p.damagedQuantity * p.costPrice), 0) FROM Product p WHERE p.damagedQuantity > 0")
    BigDecimal sumDamagedValue();
}
