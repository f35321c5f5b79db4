package com.structurescout.api.controller;

import com.structurescout.api.dto.request.DowngradeRequest;
import com.structurescout.api.dto.response.PhaseStatusResponse;
import com.structurescout.domain.enums.OperatingPhase;
import com.structurescout.domain.model.AdvancementEvaluation;
import com.structurescout.domain.model.PhaseTransition;
import com.structurescout.domain.model.PhaseTransitionResult;
import com.structurescout.exception.BusinessException;
import com.structurescout.exception.ErrorCode;
import com.structurescout.exception.UnauthorizedException;
import com.structurescout.phase.PhaseController;
import jakarta.validation.Valid;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST endpoints for the operating phase.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>GET /api/phase -- current phase and its milestone evaluation</li>
 *   <li>GET /api/phase/evaluation -- milestone evaluation only</li>
 *   <li>POST /api/phase/eligibility-report -- evaluate and notify the approval collaborator</li>
 *   <li>POST /api/phase/advance -- advance one phase (phase:advance token)</li>
 *   <li>POST /api/phase/downgrade -- administrative downgrade (phase:downgrade token)</li>
 *   <li>GET /api/phase/history -- transitions, newest first</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/phase")
public class OperatingPhaseController {

    private final PhaseController phaseController;
    private final Clock clock;

    public OperatingPhaseController(PhaseController phaseController, Clock clock) {
        this.phaseController = phaseController;
        this.clock = clock;
    }

    @GetMapping
    public ResponseEntity<PhaseStatusResponse> getPhase() {
        OperatingPhase phase = phaseController.getCurrentPhase();
        return ResponseEntity.ok(PhaseStatusResponse.builder()
                .phase(phase)
                .capitalAtRisk(phase.capitalAtRisk())
                .evaluation(phaseController.evaluateAdvancement(clock.instant()))
                .build());
    }

    @GetMapping("/evaluation")
    public ResponseEntity<AdvancementEvaluation> getEvaluation() {
        return ResponseEntity.ok(phaseController.evaluateAdvancement(clock.instant()));
    }

    @PostMapping("/eligibility-report")
    public ResponseEntity<AdvancementEvaluation> publishEligibilityReport() {
        return ResponseEntity.ok(phaseController.publishEligibilityReport(clock.instant()));
    }

    @PostMapping("/advance")
    public ResponseEntity<PhaseTransition> advance(
            @RequestHeader(value = RiskController.TOKEN_HEADER, required = false) String token) {
        return ResponseEntity.ok(unwrap(phaseController.advance(token, clock.instant())));
    }

    @PostMapping("/downgrade")
    public ResponseEntity<PhaseTransition> downgrade(
            @RequestHeader(value = RiskController.TOKEN_HEADER, required = false) String token,
            @Valid @RequestBody DowngradeRequest request) {
        return ResponseEntity.ok(unwrap(phaseController.downgrade(
                request.getTargetPhase(), token, request.getReason(), clock.instant())));
    }

    @GetMapping("/history")
    public ResponseEntity<List<PhaseTransition>> getHistory() {
        return ResponseEntity.ok(phaseController.getHistory());
    }

    private static PhaseTransition unwrap(PhaseTransitionResult result) {
        return switch (result.getStatus()) {
            case TRANSITIONED -> result.getTransition();
            case UNAUTHORIZED -> throw new UnauthorizedException(result.getMessage());
            case NOT_ELIGIBLE -> throw new BusinessException(
                    ErrorCode.NOT_ELIGIBLE,
                    result.getMessage(),
                    Map.of("unmetCriteria", result.getEvaluation().getUnmetCriteria()));
            case INVALID_TARGET -> throw new BusinessException(ErrorCode.BAD_REQUEST, result.getMessage());
        };
    }
}
