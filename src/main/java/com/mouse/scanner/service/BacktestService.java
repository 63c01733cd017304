package com.mouse.scanner.service;

import com.mouse.scanner.config.ScannerConfig;
import com.mouse.scanner.entity.BacktestResult;
import com.mouse.scanner.entity.Opportunity;
import com.mouse.scanner.logservice.ScanLogService;
import com.mouse.scanner.model.Horizon;
import com.mouse.scanner.model.LeaderboardSummary;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Ties the backtest engine and the aggregator to storage: backtests matured opportunities and builds
 * the leaderboard from the stored results.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BacktestService {

    private final OpportunityService opportunityService;
    private final BacktestEngine backtestEngine;
    private final PerformanceAggregator performanceAggregator;
    private final ScannerConfig scannerConfig;
    private final ScanLogService scanLogService;
    private final Clock clock;

    /**
     * Backtests every stored opportunity whose longest horizon has already elapsed and that has no result.
     * <p>
     * A result missing some horizons is held back while the opportunity is younger than
     * {@code backtest.retry-window-hours}, so a lagging provider gets another pass. Past that age it is
     * saved as it is.
     * @return number of results saved
     */
    public int runPendingBacktests() {
        List<Horizon> horizons = scannerConfig.getHorizons();
        Instant now = clock.instant();
        Instant maturedBefore = now.minus(horizons.get(horizons.size() - 1).getDuration());
        Instant retryUntil = now.minus(scannerConfig.getBacktestRetryWindow());

        List<Opportunity> pending = opportunityService.findAwaitingBacktest(maturedBefore);
        if (pending.isEmpty()) {
            log.info("No opportunities awaiting backtest");
            return 0;
        }

        log.info("Backtesting {} opportunities detected before {}", pending.size(), maturedBefore);
        List<BacktestResult> results = backtestEngine.evaluateAll(pending);

        int saved = 0;
        int deferred = 0;
        for (BacktestResult result : results) {
            if (isIncomplete(result, horizons) && isAfter(result.getDetectedAt(), retryUntil)) {
                log.debug("Deferring backtest of opportunity {} | horizons={} of {}",
                        result.getOpportunityId(), result.getHorizonReturns().keySet(), horizons.size());
                deferred++;
                continue;
            }
            try {
                opportunityService.saveResult(result);
                saved++;
            } catch (Exception e) {
                scanLogService.logError("Could not save backtest result for opportunity " + result.getOpportunityId(), e);
            }
        }
        log.info("Backtest pass done | pending={} evaluated={} saved={} deferred={}",
                pending.size(), results.size(), saved, deferred);
        return saved;
    }

    private static boolean isIncomplete(BacktestResult result, List<Horizon> horizons) {
        return horizons.stream().anyMatch(h -> result.returnAt(h.getLabel()).isEmpty());
    }

    private static boolean isAfter(Instant detectedAt, Instant cutoff) {
        return detectedAt != null && detectedAt.isAfter(cutoff);
    }

    public LeaderboardSummary buildLeaderboard(Horizon rankingHorizon, Instant since) {
        return performanceAggregator.build(
                opportunityService.findResults(since),
                scannerConfig.getHorizons(),
                rankingHorizon,
                scannerConfig.getLeaderboardTopSize(),
                clock.instant());
    }

    public LeaderboardSummary buildLeaderboard() {
        return buildLeaderboard(scannerConfig.getRankingHorizonValue(), null);
    }
}
