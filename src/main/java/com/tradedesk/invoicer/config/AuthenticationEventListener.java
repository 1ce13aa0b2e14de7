package com.tradedesk.invoicer.config;

import com.tradedesk.invoicer.repository.AppUserRepository;
import com.tradedesk.invoicer.service.AuditService;
import org.springframework.context.event.EventListener;
import org.springframework.security.authentication.event.AbstractAuthenticationFailureEvent;
import org.springframework.security.authentication.event.AuthenticationSuccessEvent;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;

@Component
public class AuthenticationEventListener {

    private final AuditService auditService;
    private final AppUserRepository userRepository;

    public AuthenticationEventListener(AuditService auditService, AppUserRepository userRepository) {
        this.auditService = auditService;
        this.userRepository = userRepository;
    }

    @EventListener
    @Transactional
    public void onSuccess(AuthenticationSuccessEvent event) {
        String username = event.getAuthentication().getName();
        userRepository.findByUsername(username).ifPresent(user -> {
            user.setLastLogin(LocalDateTime.now());
            userRepository.save(user);
        });
    }

    @EventListener
    public void onFailure(AbstractAuthenticationFailureEvent event) {
        Object principal = event.getAuthentication().getPrincipal();
        String username = principal instanceof String ? (String) principal : "Unknown";
        String error = event.getException().getMessage();
        auditService.log("LOGIN_FAILURE", "Failed login for: " + username + " - " + error);
    }
}
