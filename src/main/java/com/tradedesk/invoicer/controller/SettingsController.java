package com.tradedesk.invoicer.controller;

import com.tradedesk.invoicer.dto.SettingsRequest;
import com.tradedesk.invoicer.dto.SettingsResponse;
import com.tradedesk.invoicer.service.AuditService;
import com.tradedesk.invoicer.service.SettingsService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/settings")
public class SettingsController {

    private final SettingsService settingsService;
    private final AuditService auditService;

    public SettingsController(SettingsService settingsService, AuditService auditService) {
        this.settingsService = settingsService;
        this.auditService = auditService;
    }

    @GetMapping
    public SettingsResponse get() {
        return settingsService.getSettings();
    }

    @PutMapping
    public SettingsResponse update(@RequestBody SettingsRequest request) {
        SettingsResponse updated = settingsService.applySettings(request);
        auditService.log("SETTINGS_UPDATED", "GST rate: " + updated.gstRate());
        return updated;
    }
}
