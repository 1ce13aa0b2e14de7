package com.tradedesk.invoicer.repository;

import com.tradedesk.invoicer.model.InvoicingSetting;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Collection;
import java.util.List;

public interface InvoicingSettingRepository extends JpaRepository<InvoicingSetting, String> {

    List<InvoicingSetting> findByNameIn(Collection<String> names);
}
