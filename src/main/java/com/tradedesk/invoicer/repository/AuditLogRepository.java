package com.tradedesk.invoicer.repository;

import com.tradedesk.invoicer.model.AuditLog;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface AuditLogRepository extends JpaRepository<AuditLog, Long> {
    List<AuditLog> findByActionOrderByIdDesc(String action);
}
