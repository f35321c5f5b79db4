package com.structurescout.unit.controller;

import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.structurescout.api.controller.DecisionLogController;
import com.structurescout.config.ApiResponseAdvice;
import com.structurescout.domain.enums.DecisionOutcome;
import com.structurescout.domain.enums.DecisionSeverity;
import com.structurescout.domain.enums.DecisionSource;
import com.structurescout.domain.enums.DecisionType;
import com.structurescout.domain.model.DecisionRecord;
import com.structurescout.exception.GlobalExceptionHandler;
import com.structurescout.observability.DecisionArchiveService;
import com.structurescout.observability.DecisionLogger;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@ExtendWith(MockitoExtension.class)
class DecisionLogControllerTest {

    private MockMvc mockMvc;

    @Mock
    private DecisionLogger decisionLogger;

    @Mock
    private DecisionArchiveService decisionArchiveService;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new DecisionLogController(decisionLogger, decisionArchiveService))
                .setControllerAdvice(new GlobalExceptionHandler(), new ApiResponseAdvice())
                .build();
    }

    private static DecisionRecord rejection(String correlationId) {
        return DecisionRecord.builder()
                .source(DecisionSource.RISK_GATE)
                .sourceId(correlationId)
                .decisionType(DecisionType.CANDIDATE_REJECTED)
                .outcome(DecisionOutcome.REJECTED)
                .reasoning("Rejected: [NEWS_BLACKOUT]")
                .severity(DecisionSeverity.INFO)
                .build();
    }

    @Test
    @DisplayName("GET /api/decisions/recent clamps the count and filters by source")
    void recentBySource() throws Exception {
        when(decisionLogger.getRecentDecisions(1000, DecisionSource.RISK_GATE)).thenReturn(List.of(rejection("c-1")));

        mockMvc.perform(get("/api/decisions/recent").param("count", "5000").param("source", "RISK_GATE"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data[0].sourceId").value("c-1"))
                .andExpect(jsonPath("$.data[0].outcome").value("REJECTED"));
    }

    @Test
    @DisplayName("GET /api/decisions/{sourceId} returns the decisions for one candidate")
    void bySourceId() throws Exception {
        when(decisionLogger.getDecisionsFor("c-9")).thenReturn(List.of(rejection("c-9")));

        mockMvc.perform(get("/api/decisions/c-9"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data[0].reasoning").value("Rejected: [NEWS_BLACKOUT]"));
    }

    @Test
    @DisplayName("Unknown source filter is a 400")
    void badSource() throws Exception {
        mockMvc.perform(get("/api/decisions/recent").param("source", "NOPE"))
                .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("Archive status reports the breaker and queue")
    void archiveStatus() throws Exception {
        when(decisionArchiveService.getPendingCount()).thenReturn(4);
        when(decisionArchiveService.isCircuitOpen()).thenReturn(true);
        when(decisionArchiveService.getConsecutiveFailures()).thenReturn(3);

        mockMvc.perform(get("/api/decisions/archive"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.pending").value(4))
                .andExpect(jsonPath("$.data.circuitOpen").value(true))
                .andExpect(jsonPath("$.data.consecutiveFailures").value(3));
    }

    @Test
    @DisplayName("Persist-debug toggle and forced flush reach the archive service")
    void archiveControls() throws Exception {
        mockMvc.perform(put("/api/decisions/archive/persist-debug").param("enabled", "true"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.persistDebug").value(true));
        mockMvc.perform(post("/api/decisions/archive/flush")).andExpect(status().isOk());

        verify(decisionArchiveService).setPersistDebug(true);
        verify(decisionArchiveService).forceFlush();
    }
}
