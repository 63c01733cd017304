package com.mouse.scanner.tasks;

import com.mouse.scanner.model.LeaderboardSummary;
import com.mouse.scanner.service.AlertMessageFormatter;
import com.mouse.scanner.service.BacktestService;
import com.mouse.scanner.service.NotificationService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodically backtests matured opportunities and publishes the leaderboard.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "scanner.scheduling.enabled", havingValue = "true", matchIfMissing = true)
public class PerformanceReportJob {

    private final BacktestService backtestService;
    private final AlertMessageFormatter alertMessageFormatter;
    private final NotificationService notificationService;

    @Scheduled(fixedDelayString = "${performance.report-interval-ms:3600000}",
            initialDelayString = "${performance.initial-delay-ms:60000}")
    public void report() {
        try {
            int evaluated = backtestService.runPendingBacktests();
            LeaderboardSummary summary = backtestService.buildLeaderboard();
            log.info("📊 Performance report | newlyEvaluated={} totalEvaluated={} winRate={}",
                    evaluated, summary.getTotalOpportunities(), summary.getWinRate());

            if (summary.getTotalOpportunities() > 0 && notificationService.hasChannels()) {
                notificationService.broadcast(alertMessageFormatter.formatLeaderboard(summary));
            }
        } catch (Exception e) {
            log.error("Performance report failed", e);
        }
    }
}
