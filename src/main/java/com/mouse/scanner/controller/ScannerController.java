package com.mouse.scanner.controller;

import com.mouse.scanner.config.ScannerConfig;
import com.mouse.scanner.entity.Opportunity;
import com.mouse.scanner.logservice.ScanLogService;
import com.mouse.scanner.manager.ScanOrchestrator;
import com.mouse.scanner.model.Horizon;
import com.mouse.scanner.model.LeaderboardSummary;
import com.mouse.scanner.model.OpportunityFilter;
import com.mouse.scanner.service.BacktestService;
import com.mouse.scanner.service.OpportunityService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

@Slf4j
@RestController
@RequiredArgsConstructor
@RequestMapping("/api")
public class ScannerController {

    private final OpportunityService opportunityService;
    private final BacktestService backtestService;
    private final ScanOrchestrator scanOrchestrator;
    private final ScanLogService scanLogService;
    private final ScannerConfig scannerConfig;
    private final Clock clock;

    /**
     * Stored opportunities, newest first.
     *
     * @param from inclusive lower bound on detection time
     * @param to   exclusive upper bound on detection time
     */
    @GetMapping("/opportunities")
    public ResponseEntity<Map<String, Object>> getOpportunities(
            @RequestParam(required = false) String symbol,
            @RequestParam(required = false) String alertType,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant from,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant to
    ) {
        log.info("GET /api/opportunities - symbol={}, alertType={}, from={}, to={}", symbol, alertType, from, to);

        if (from != null && to != null && !from.isBefore(to)) {
            return badRequest("'from' must be before 'to'");
        }

        List<Opportunity> opportunities = opportunityService.query(OpportunityFilter.builder()
                .symbol(symbol)
                .alertType(alertType)
                .from(from)
                .to(to)
                .build());

        Map<String, Object> response = new HashMap<>();
        response.put("opportunities", opportunities);
        response.put("count", opportunities.size());
        response.put("timestamp", clock.instant());
        return ResponseEntity.ok(response);
    }

    @GetMapping("/leaderboard")
    public ResponseEntity<Map<String, Object>> getLeaderboard(
            @RequestParam(required = false) String horizon,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant since
    ) {
        log.info("GET /api/leaderboard - horizon={}, since={}", horizon, since);

        Horizon ranking;
        try {
            ranking = horizon == null ? scannerConfig.getRankingHorizonValue() : scannerConfig.matchHorizon(horizon);
        } catch (IllegalArgumentException e) {
            return badRequest(e.getMessage());
        }

        LeaderboardSummary summary = backtestService.buildLeaderboard(ranking, since);
        Map<String, Object> response = new HashMap<>();
        response.put("leaderboard", summary);
        response.put("timestamp", clock.instant());
        return ResponseEntity.ok(response);
    }

    /**
     * Backtests whatever has matured now instead of waiting for the hourly job.
     */
    @PostMapping("/backtest/run")
    public ResponseEntity<Map<String, Object>> runBacktest() {
        log.info("POST /api/backtest/run");
        int saved = backtestService.runPendingBacktests();

        Map<String, Object> response = new HashMap<>();
        response.put("evaluated", saved);
        response.put("timestamp", clock.instant());
        return ResponseEntity.ok(response);
    }

    @GetMapping("/scanner/status")
    public ResponseEntity<Map<String, Object>> getStatus() {
        Map<String, Object> status = new HashMap<>();
        status.put("status", "UP");
        status.put("cycleRunning", scanOrchestrator.isCycleRunning());
        status.put("symbols", scanOrchestrator.getSymbolStates());
        scanOrchestrator.getLastReport().ifPresent(report -> status.put("lastCycle", report));
        status.put("counters", scanLogService.snapshot());
        status.put("timestamp", clock.instant());
        return ResponseEntity.ok(status);
    }

    private static ResponseEntity<Map<String, Object>> badRequest(String message) {
        Map<String, Object> body = new HashMap<>();
        body.put("error", message);
        return ResponseEntity.badRequest().body(body);
    }
}
