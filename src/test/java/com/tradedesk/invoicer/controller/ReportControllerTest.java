package com.tradedesk.invoicer.controller;

import com.tradedesk.invoicer.dto.SettingsRequest;
import com.tradedesk.invoicer.dto.SettingsResponse;
import com.tradedesk.invoicer.dto.SummaryStats;
import com.tradedesk.invoicer.dto.TopProductRow;
import com.tradedesk.invoicer.service.AuditService;
import com.tradedesk.invoicer.service.ReportPeriod;
import com.tradedesk.invoicer.service.ReportService;
import com.tradedesk.invoicer.service.SettingsService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.security.test.context.support.WithMockUser;
import org.springframework.test.web.servlet.MockMvc;

import java.math.BigDecimal;
import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@SpringBootTest
@AutoConfigureMockMvc
class ReportControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private ReportService reportService;
    @MockBean
    private SettingsService settingsService;
    @MockBean
    private AuditService auditService;

    @Test
    @WithMockUser(roles = "CLERK")
    void summary_ShouldAcceptPeriodInAnyCase() throws Exception {
        when(reportService.summary(ReportPeriod.WEEKLY)).thenReturn(new SummaryStats(3, new BigDecimal("1770.00"),
                new BigDecimal("200.00"), 22, 1, new BigDecimal("400.00"), 2));

        mockMvc.perform(get("/api/reports/summary/Weekly"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalInvoices").value(3))
                .andExpect(jsonPath("$.uniqueCustomers").value(2));
    }

    @Test
    @WithMockUser(roles = "CLERK")
    void summary_ShouldRejectUnknownPeriod() throws Exception {
        mockMvc.perform(get("/api/reports/summary/yearly"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_PERIOD"));

        verifyNoInteractions(reportService);
    }

    @Test
    @WithMockUser(roles = "CLERK")
    void topProducts_ShouldPassLimit() throws Exception {
        when(reportService.topProducts(ReportPeriod.MONTHLY, 5)).thenReturn(List.of(
                new TopProductRow("Soap", 25, new BigDecimal("625.00"), 2, new BigDecimal("12.50"))));

        mockMvc.perform(get("/api/reports/top-products/monthly").param("limit", "5"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].productName").value("Soap"))
                .andExpect(jsonPath("$[0].timesOrdered").value(2));
    }

    @Test
    void reports_ShouldRequireAuthentication() throws Exception {
        mockMvc.perform(get("/api/reports/sales/daily"))
                .andExpect(status().isUnauthorized());
    }

    @Test
    @WithMockUser(roles = "CLERK")
    void settings_ShouldBeReadableByClerk() throws Exception {
        when(settingsService.getSettings())
                .thenReturn(new SettingsResponse("Acme Traders", null, null, new BigDecimal("18"), "₹"));

        mockMvc.perform(get("/api/settings"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.gstRate").value(18));
    }

    @Test
    @WithMockUser(roles = "CLERK")
    void updateSettings_ShouldBeForbiddenForClerk() throws Exception {
        mockMvc.perform(put("/api/settings").contentType(MediaType.APPLICATION_JSON).content("{\"gstRate\": 5}"))
                .andExpect(status().isForbidden());

        verify(settingsService, never()).applySettings(any());
    }

    @Test
    @WithMockUser(roles = "ADMIN")
    void updateSettings_ShouldApplyForAdmin() throws Exception {
        when(settingsService.applySettings(any(SettingsRequest.class)))
                .thenReturn(new SettingsResponse("Acme Traders", null, null, new BigDecimal("5"), "₹"));

        mockMvc.perform(put("/api/settings").contentType(MediaType.APPLICATION_JSON).content("{\"gstRate\": 5}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.gstRate").value(5));
    }
}
