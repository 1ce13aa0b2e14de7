package com.tradedesk.invoicer.service;

import com.tradedesk.invoicer.model.AuditLog;
import com.tradedesk.invoicer.repository.AuditLogRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

@Service
public class AuditService {

    private static final Logger logger = LoggerFactory.getLogger(AuditService.class);

    public static final String SYSTEM_USER = "SYSTEM";

    private final AuditLogRepository auditLogRepository;

    public AuditService(AuditLogRepository auditLogRepository) {
        this.auditLogRepository = auditLogRepository;
    }

    /**
     * Records an action in its own transaction. Audit failures are logged and
     * never propagate to the business operation.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void log(String action, String details) {
        try {
            AuditLog log = new AuditLog();
            log.setAction(action);
            log.setDetails(details);
            log.setUsername(currentUsername());
            auditLogRepository.save(log);
        } catch (RuntimeException e) {
            logger.error("Failed to write audit log {} ({}): {}", action, details, e.getMessage());
        }
    }

    public String currentUsername() {
        Authentication auth = SecurityContextHolder.getContext().getAuthentication();
        if (auth != null && auth.getName() != null) {
            return auth.getName();
        }
        return SYSTEM_USER;
    }
}
