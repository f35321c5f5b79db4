package com.structurescout.api.controller;

import com.structurescout.api.dto.request.CandidateRequest;
import com.structurescout.api.dto.request.OutcomeRequest;
import com.structurescout.api.dto.response.AdmissionDecisionResponse;
import com.structurescout.domain.model.AdmissionDecision;
import com.structurescout.domain.model.OutcomeRecordResult;
import com.structurescout.exception.BusinessException;
import com.structurescout.exception.ErrorCode;
import com.structurescout.risk.RiskGate;
import jakarta.validation.Valid;
import java.time.Clock;
import java.util.Map;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST endpoints for the gate: candidate evaluation and outcome reporting.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>POST /api/gate/evaluate -- evaluate a setup candidate; rejections are a normal 200</li>
 *   <li>POST /api/gate/outcomes -- report a realized outcome (409 on duplicate, 400 on malformed)</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/gate")
public class RiskGateController {

    private final RiskGate riskGate;
    private final Clock clock;

    public RiskGateController(RiskGate riskGate, Clock clock) {
        this.riskGate = riskGate;
        this.clock = clock;
    }

    @PostMapping("/evaluate")
    public ResponseEntity<AdmissionDecisionResponse> evaluate(@Valid @RequestBody CandidateRequest request) {
        AdmissionDecision decision = riskGate.evaluate(request.toCandidate(), clock.instant());
        return ResponseEntity.ok(AdmissionDecisionResponse.from(decision));
    }

    @PostMapping("/outcomes")
    public ResponseEntity<OutcomeRecordResult> recordOutcome(@Valid @RequestBody OutcomeRequest request) {
        OutcomeRecordResult result = riskGate.recordOutcome(request.toOutcome(), clock.instant());
        if (result.getStatus() == OutcomeRecordResult.Status.DUPLICATE_OUTCOME) {
            throw new BusinessException(
                    ErrorCode.CONFLICT, result.getMessage(), Map.of("correlationId", result.getCorrelationId()));
        }
        if (result.getStatus() == OutcomeRecordResult.Status.MALFORMED_INPUT) {
            throw new BusinessException(ErrorCode.VALIDATION_ERROR, result.getMessage());
        }
        return ResponseEntity.ok(result);
    }
}
