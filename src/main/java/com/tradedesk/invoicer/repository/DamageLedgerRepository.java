package com.tradedesk.invoicer.repository;

import com.tradedesk.invoicer.model.DamageLedgerEntry;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface DamageLedgerRepository extends JpaRepository<DamageLedgerEntry, Long> {
    List<DamageLedgerEntry> findByProductIdOrderByIdAsc(Long productId);

    long countByProductId(Long productId);
}
