package com.payment.observability.alert.api;

import com.payment.observability.alert.domain.AlertEvent;
import com.payment.observability.alert.domain.AlertSeverity;
import com.payment.observability.alert.domain.AlertSummary;
import com.payment.observability.alert.domain.AlertType;
import com.payment.observability.alert.engine.AlertMonitoringService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(controllers = AlertController.class)
class AlertControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private AlertMonitoringService monitoringService;

    private static AlertEvent providerFailure() {
        return AlertEvent.builder()
                .alertId("a-1")
                .severity(AlertSeverity.CRITICAL)
                .type(AlertType.PROVIDER_FAILURE)
                .title("Provider stripe failing")
                .provider("stripe")
                .successRate(45.0)
                .windowStart(Instant.parse("2024-05-01T11:00:00Z"))
                .windowEnd(Instant.parse("2024-05-01T12:00:00Z"))
                .build();
    }

    @Test
    void detectReturnsSummary() throws Exception {
        AlertSummary summary = AlertSummary.builder()
                .windowHours(6)
                .generatedAt(Instant.parse("2024-05-01T12:00:00Z"))
                .totalAlerts(1)
                .bySeverity(Map.of("critical", 1L))
                .byType(Map.of("provider_failure", 1L))
                .alerts(List.of(providerFailure()))
                .build();
        when(monitoringService.detect(6, AlertSeverity.CRITICAL, true)).thenReturn(summary);

        mockMvc.perform(get("/api/v1/alerts")
                        .param("windowHours", "6")
                        .param("severity", "critical")
                        .param("notify", "true"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalAlerts").value(1))
                .andExpect(jsonPath("$.bySeverity.critical").value(1))
                .andExpect(jsonPath("$.alerts[0].severity").value("critical"))
                .andExpect(jsonPath("$.alerts[0].type").value("provider_failure"))
                .andExpect(jsonPath("$.alerts[0].countryAnalysis").doesNotExist());
    }

    @Test
    void defaultsToOneHourWithoutFilter() throws Exception {
        when(monitoringService.detect(1, null, false)).thenReturn(AlertSummary.builder()
                .windowHours(1).totalAlerts(0).alerts(List.of()).build());

        mockMvc.perform(get("/api/v1/alerts")).andExpect(status().isOk());

        verify(monitoringService).detect(1, null, false);
    }

    @Test
    void outOfRangeWindowIsBadRequest() throws Exception {
        when(monitoringService.detect(anyInt(), isNull(), anyBoolean()))
                .thenThrow(new IllegalArgumentException("windowHours must be between 1 and 168, got 500"));

        mockMvc.perform(get("/api/v1/alerts").param("windowHours", "500"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("BAD_REQUEST"));
    }

    @Test
    void unknownSeverityIsBadRequest() throws Exception {
        mockMvc.perform(get("/api/v1/alerts").param("severity", "urgent"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void topIssuesAndRecent() throws Exception {
        when(monitoringService.topIssues(24, 3)).thenReturn(List.of(providerFailure()));
        when(monitoringService.recent(50)).thenReturn(List.of(providerFailure()));

        mockMvc.perform(get("/api/v1/alerts/top-issues").param("windowHours", "24").param("limit", "3"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].provider").value("stripe"));
        mockMvc.perform(get("/api/v1/alerts/recent"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].alertId").value("a-1"));
    }
}
