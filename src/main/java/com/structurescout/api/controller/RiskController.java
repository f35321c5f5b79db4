package com.structurescout.api.controller;

import com.structurescout.account.AccountStateService;
import com.structurescout.api.dto.request.EquityRequest;
import com.structurescout.api.dto.request.HaltRequest;
import com.structurescout.domain.model.AccountState;
import com.structurescout.domain.model.Admission;
import com.structurescout.domain.model.RiskLedgerState;
import com.structurescout.domain.model.RiskStatus;
import com.structurescout.exception.BusinessException;
import com.structurescout.exception.ErrorCode;
import com.structurescout.risk.AdmissionRegistry;
import com.structurescout.risk.RiskGate;
import com.structurescout.risk.RiskLedger;
import com.structurescout.risk.TradingHaltService;
import jakarta.validation.Valid;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST endpoints for risk state: status, ledger, open admissions, halt/resume, equity.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>GET /api/risk/status -- aggregates, limit usage, halt state, can-trade flag</li>
 *   <li>GET /api/risk/ledger -- ledger snapshot including archived period summaries</li>
 *   <li>GET /api/risk/admissions -- open admissions</li>
 *   <li>POST /api/risk/halt -- halt trading (requires "CONFIRM" text)</li>
 *   <li>POST /api/risk/resume -- resume trading (requires a halt:resume operator token)</li>
 *   <li>PUT /api/risk/equity -- update account equity</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/risk")
public class RiskController {

    private static final Logger log = LoggerFactory.getLogger(RiskController.class);

    static final String TOKEN_HEADER = "X-Operator-Token";

    private final RiskGate riskGate;
    private final RiskLedger riskLedger;
    private final AdmissionRegistry admissionRegistry;
    private final TradingHaltService tradingHaltService;
    private final AccountStateService accountStateService;
    private final Clock clock;

    public RiskController(
            RiskGate riskGate,
            RiskLedger riskLedger,
            AdmissionRegistry admissionRegistry,
            TradingHaltService tradingHaltService,
            AccountStateService accountStateService,
            Clock clock) {
        this.riskGate = riskGate;
        this.riskLedger = riskLedger;
        this.admissionRegistry = admissionRegistry;
        this.tradingHaltService = tradingHaltService;
        this.accountStateService = accountStateService;
        this.clock = clock;
    }

    @GetMapping("/status")
    public ResponseEntity<RiskStatus> getRiskStatus() {
        return ResponseEntity.ok(riskGate.getStatus(clock.instant()));
    }

    @GetMapping("/ledger")
    public ResponseEntity<RiskLedgerState> getLedger() {
        return ResponseEntity.ok(riskLedger.snapshot());
    }

    @GetMapping("/admissions")
    public ResponseEntity<List<Admission>> getOpenAdmissions() {
        return ResponseEntity.ok(admissionRegistry.getOpenAdmissions());
    }

    /**
     * Halts trading. Requires "confirm": "CONFIRM" in the request body to prevent accidental
     * activation.
     */
    @PostMapping("/halt")
    public ResponseEntity<Map<String, Object>> halt(@Valid @RequestBody HaltRequest request) {
        if (!"CONFIRM".equals(request.getConfirm())) {
            throw new BusinessException(ErrorCode.BAD_REQUEST, "Halt requires 'confirm': 'CONFIRM' in request body");
        }
        String reason = request.getReason() != null ? request.getReason() : "Manual halt via API";
        log.error("TRADING HALT REQUESTED: {}", reason);

        boolean changed = tradingHaltService.halt(reason, clock.instant());
        return ResponseEntity.ok(Map.of("halted", true, "changed", changed));
    }

    @PostMapping("/resume")
    public ResponseEntity<Map<String, Object>> resume(@RequestHeader(value = TOKEN_HEADER, required = false) String token) {
        boolean changed = tradingHaltService.resume(token, clock.instant());
        return ResponseEntity.ok(Map.of("halted", false, "changed", changed));
    }

    @PutMapping("/equity")
    public ResponseEntity<AccountState> updateEquity(@Valid @RequestBody EquityRequest request) {
        log.info("Equity update requested: {}", request.getEquity());
        return ResponseEntity.ok(accountStateService.updateEquity(request.getEquity(), clock.instant()));
    }
}
