package com.structurescout.unit.controller;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.structurescout.api.controller.RiskGateController;
import com.structurescout.config.ApiResponseAdvice;
import com.structurescout.domain.enums.OperatingPhase;
import com.structurescout.domain.enums.ReasonCode;
import com.structurescout.domain.model.AdmissionDecision;
import com.structurescout.domain.model.OutcomeRecordResult;
import com.structurescout.domain.model.SetupCandidate;
import com.structurescout.domain.model.TradeOutcome;
import com.structurescout.exception.GlobalExceptionHandler;
import com.structurescout.risk.RiskGate;
import com.structurescout.risk.RiskViolation;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

/**
 * Standalone MockMvc tests for the RiskGateController.
 */
@ExtendWith(MockitoExtension.class)
class RiskGateControllerTest {

    private static final Instant NOW = Instant.parse("2026-03-10T14:00:00Z");

    private MockMvc mockMvc;

    @Mock
    private RiskGate riskGate;

    @BeforeEach
    void setUp() {
        RiskGateController controller = new RiskGateController(riskGate, Clock.fixed(NOW, ZoneOffset.UTC));
        mockMvc = MockMvcBuilders.standaloneSetup(controller)
                .setControllerAdvice(new GlobalExceptionHandler(), new ApiResponseAdvice())
                .build();
    }

    @Test
    @DisplayName("POST /api/gate/evaluate returns the admitted size")
    void evaluateAdmitted() throws Exception {
        when(riskGate.evaluate(any(SetupCandidate.class), eq(NOW)))
                .thenReturn(AdmissionDecision.admitted(2, List.of(), "c-1", OperatingPhase.MICRO_LIVE, NOW));

        mockMvc.perform(post("/api/gate/evaluate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {
                                  "timestamp": "2026-03-10T14:00:00Z",
                                  "direction": "LONG",
                                  "confidence": 0.8,
                                  "rewardRiskRatio": 2.0,
                                  "stopDistance": 20.0,
                                  "setupType": "SWEEP",
                                  "correlationId": "c-1"
                                }
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.data.admitted").value(true))
                .andExpect(jsonPath("$.data.size").value(2))
                .andExpect(jsonPath("$.data.phase").value("MICRO_LIVE"));

        ArgumentCaptor<SetupCandidate> captor = ArgumentCaptor.forClass(SetupCandidate.class);
        verify(riskGate).evaluate(captor.capture(), eq(NOW));
        assertThat(captor.getValue().getCorrelationId()).isEqualTo("c-1");
    }

    @Test
    @DisplayName("A rejection is a normal 200 carrying every reason code in order")
    void evaluateRejected() throws Exception {
        when(riskGate.evaluate(any(SetupCandidate.class), eq(NOW)))
                .thenReturn(AdmissionDecision.rejected(
                        List.of(
                                RiskViolation.of(ReasonCode.DAILY_TRADE_CAP_REACHED, "3 of 3 trades today"),
                                RiskViolation.of(ReasonCode.MAX_OPEN_POSITIONS_REACHED, "3 of 3 open")),
                        "c-4",
                        OperatingPhase.MICRO_LIVE,
                        NOW));

        mockMvc.perform(post("/api/gate/evaluate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"correlationId\": \"c-4\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.admitted").value(false))
                .andExpect(jsonPath("$.data.size").value(0))
                .andExpect(jsonPath("$.data.reasonCodes[0]").value("DAILY_TRADE_CAP_REACHED"))
                .andExpect(jsonPath("$.data.reasonCodes[1]").value("MAX_OPEN_POSITIONS_REACHED"))
                .andExpect(jsonPath("$.data.messages[0]").value("3 of 3 trades today"));
    }

    @Test
    @DisplayName("Unparseable body is a 400")
    void evaluateUnreadable() throws Exception {
        mockMvc.perform(post("/api/gate/evaluate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{ not json"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.error.code").value("BAD_REQUEST"));
    }

    @Test
    @DisplayName("POST /api/gate/outcomes returns the ledger sequence")
    void recordOutcome() throws Exception {
        when(riskGate.recordOutcome(any(TradeOutcome.class), eq(NOW)))
                .thenReturn(OutcomeRecordResult.recorded("c-1", 7L));

        mockMvc.perform(post("/api/gate/outcomes")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {
                                  "correlationId": "c-1",
                                  "pnlFraction": -0.012,
                                  "realizedR": -1.0,
                                  "closedAt": "2026-03-10T15:00:00Z"
                                }
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.status").value("RECORDED"))
                .andExpect(jsonPath("$.data.sequence").value(7));
    }

    @Test
    @DisplayName("Duplicate outcome is a 409")
    void duplicateOutcome() throws Exception {
        when(riskGate.recordOutcome(any(TradeOutcome.class), eq(NOW)))
                .thenReturn(OutcomeRecordResult.duplicate("c-1"));

        mockMvc.perform(post("/api/gate/outcomes")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"correlationId\": \"c-1\", \"pnlFraction\": 0.01}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error.code").value("CONFLICT"))
                .andExpect(jsonPath("$.error.details.correlationId").value("c-1"));
    }

    @Test
    @DisplayName("Malformed outcome is a 400")
    void malformedOutcome() throws Exception {
        when(riskGate.recordOutcome(any(TradeOutcome.class), eq(NOW)))
                .thenReturn(OutcomeRecordResult.malformed(null, "correlationId is required"));

        mockMvc.perform(post("/api/gate/outcomes")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"pnlFraction\": 0.01}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.code").value("VALIDATION_ERROR"));
    }
}
