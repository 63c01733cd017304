package com.mouse.scanner.service;

import com.mouse.scanner.config.ScannerConfig;
import com.mouse.scanner.entity.BacktestResult;
import com.mouse.scanner.entity.Opportunity;
import com.mouse.scanner.enums.PriceBasis;
import com.mouse.scanner.exception.DataUnavailableException;
import com.mouse.scanner.interfaces.MarketDataClient;
import com.mouse.scanner.logservice.ScanLogService;
import com.mouse.scanner.model.HistoricalBar;
import com.mouse.scanner.model.Horizon;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * Replays the price history that followed an opportunity and measures the realized return at each
 * configured horizon: {@code (price_at(detection + horizon) - entry) / entry * 100}.
 * <p>
 * Each horizon stands on its own. When the data stops before a horizon, that horizon is left out of the
 * result while the shorter ones are still reported.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BacktestEngine {

    private final MarketDataClient marketDataClient;
    private final ScannerConfig scannerConfig;
    private final ScanLogService scanLogService;
    private final Clock clock;

    private final AtomicInteger threadCounter = new AtomicInteger();
    private ExecutorService backtestExecutor;

    @PostConstruct
    public void init() {
        backtestExecutor = Executors.newFixedThreadPool(scannerConfig.getBacktestThreads(), runnable -> {
            Thread thread = new Thread(runnable, "backtest-worker-" + threadCounter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Evaluates one opportunity. Transient fetch errors propagate to the caller; missing data yields a
     * result without horizons.
     */
    public BacktestResult evaluate(Opportunity opportunity) {
        PriceBasis basis = scannerConfig.getPriceBasis();
        List<Horizon> horizons = scannerConfig.getHorizons();
        double entryPrice = basis == PriceBasis.UNDERLYING ? opportunity.getUnderlyingPrice() : opportunity.getPrice();

        BacktestResult result = BacktestResult.builder()
                .opportunity(opportunity)
                .opportunityId(opportunity.getId())
                .priceBasis(basis)
                .entryPrice(entryPrice)
                .evaluatedAt(clock.instant())
                .build();

        if (!(entryPrice > 0) || horizons.isEmpty()) {
            log.debug("No usable entry price for {} on {} basis", opportunity.contractKey(), basis);
            return result;
        }

        Instant detectedAt = opportunity.getDetectedAt();
        // one bar past the longest target so the last horizon can resolve
        Instant end = detectedAt.plus(horizons.get(horizons.size() - 1).getDuration())
                .plus(scannerConfig.getBacktestGranularity());

        List<HistoricalBar> bars;
        try {
            bars = fetchBars(opportunity, basis, detectedAt, end);
        } catch (DataUnavailableException e) {
            scanLogService.logNoData("backtest " + opportunity.contractKey(), e.getMessage());
            return result;
        }

        result.setHorizonReturns(computeReturns(entryPrice, detectedAt, bars, horizons));
        return result;
    }

    /**
     * Evaluates many opportunities in parallel. A failing opportunity is logged and left out; results
     * keep the input order.
     */
    public List<BacktestResult> evaluateAll(Collection<Opportunity> opportunities) {
        List<CompletableFuture<BacktestResult>> futures = opportunities.stream()
                .map(opportunity -> CompletableFuture.supplyAsync(() -> evaluateSafely(opportunity), backtestExecutor))
                .collect(Collectors.toList());

        return futures.stream()
                .map(CompletableFuture::join)
                .filter(Objects::nonNull)
                .collect(Collectors.toList());
    }

    private BacktestResult evaluateSafely(Opportunity opportunity) {
        try {
            return evaluate(opportunity);
        } catch (Exception e) {
            scanLogService.logError("Backtest failed for opportunity " + opportunity.getId()
                    + " (" + opportunity.contractKey() + ")", e);
            return null;
        }
    }

    private List<HistoricalBar> fetchBars(Opportunity opportunity, PriceBasis basis, Instant start, Instant end) {
        if (basis == PriceBasis.UNDERLYING) {
            return marketDataClient.getHistoricalStockBars(opportunity.getSymbol(), start, end,
                    scannerConfig.getBacktestGranularity());
        }
        return marketDataClient.getHistoricalBars(opportunity.contractKey(), start, end,
                scannerConfig.getBacktestGranularity());
    }

    static Map<String, Double> computeReturns(double entryPrice, Instant detectedAt,
                                              List<HistoricalBar> bars, List<Horizon> horizons) {
        Map<String, Double> returns = new LinkedHashMap<>();
        if (bars == null || bars.isEmpty()) {
            return returns;
        }

        List<HistoricalBar> sorted = new ArrayList<>(bars);
        sorted.sort(Comparator.comparing(HistoricalBar::getTimestamp));

        for (Horizon horizon : horizons) {
            Instant target = detectedAt.plus(horizon.getDuration());
            priceAt(sorted, target).ifPresent(price ->
                    returns.put(horizon.getLabel(), (price - entryPrice) / entryPrice * 100.0));
        }
        return returns;
    }

    /**
     * Price of the last bar at or before {@code target}. Empty when the data does not reach the target
     * or no bar precedes it.
     */
    static OptionalDouble priceAt(List<HistoricalBar> sortedBars, Instant target) {
        HistoricalBar last = sortedBars.get(sortedBars.size() - 1);
        if (last.getTimestamp().isBefore(target)) {
            return OptionalDouble.empty();
        }
        HistoricalBar match = null;
        for (HistoricalBar bar : sortedBars) {
            if (bar.getTimestamp().isAfter(target)) {
                break;
            }
            if (bar.getPrice() > 0) {
                match = bar;
            }
        }
        return match == null ? OptionalDouble.empty() : OptionalDouble.of(match.getPrice());
    }

    @PreDestroy
    public void shutdown() {
        if (backtestExecutor == null) {
            return;
        }
        backtestExecutor.shutdown();
        try {
            if (!backtestExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                backtestExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            backtestExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
