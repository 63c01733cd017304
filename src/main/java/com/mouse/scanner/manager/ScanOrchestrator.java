package com.mouse.scanner.manager;

import com.mouse.scanner.config.ScannerConfig;
import com.mouse.scanner.entity.Opportunity;
import com.mouse.scanner.enums.ScanState;
import com.mouse.scanner.exception.DataUnavailableException;
import com.mouse.scanner.interfaces.Detector;
import com.mouse.scanner.interfaces.MarketDataClient;
import com.mouse.scanner.logservice.ScanLogService;
import com.mouse.scanner.model.OptionSnapshot;
import com.mouse.scanner.model.ScanCycle;
import com.mouse.scanner.model.ScanCycleReport;
import com.mouse.scanner.service.AlertMessageFormatter;
import com.mouse.scanner.service.BaselineVolumeService;
import com.mouse.scanner.service.NotificationService;
import com.mouse.scanner.service.OpportunityDeduplicator;
import com.mouse.scanner.service.OpportunityService;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * Runs one scan cycle over the watchlist.
 * <p>
 * Symbols are fetched concurrently on a pool sized to the provider's rate limit, every contract of a
 * chain is evaluated by every detector on a separate detection pool, and the merged results are
 * de-duplicated, saved and announced on the calling thread. A failure on one symbol or one contract is
 * logged and skipped; the rest of the cycle carries on. A cycle requested while another is running is
 * skipped, never queued.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ScanOrchestrator {

    private final MarketDataClient marketDataClient;
    private final List<Detector> detectors;
    private final BaselineVolumeService baselineVolumeService;
    private final OpportunityDeduplicator deduplicator;
    private final OpportunityService opportunityService;
    private final NotificationService notificationService;
    private final AlertMessageFormatter alertMessageFormatter;
    private final ScanLogService scanLogService;
    private final ScannerConfig scannerConfig;
    private final Clock clock;

    private final AtomicBoolean cycleRunning = new AtomicBoolean(false);
    private final AtomicLong cycleCounter = new AtomicLong();
    private final Map<String, ScanState> symbolStates = new ConcurrentHashMap<>();

    private ExecutorService fetchExecutor;
    private ExecutorService detectionExecutor;
    private volatile ScanCycleReport lastReport;

    @PostConstruct
    public void init() {
        fetchExecutor = Executors.newFixedThreadPool(scannerConfig.getMaxConcurrentFetches(), namedThreads("chain-fetch"));
        detectionExecutor = Executors.newFixedThreadPool(scannerConfig.getDetectionThreads(), namedThreads("detect"));
        scannerConfig.getSymbols().forEach(symbol -> symbolStates.put(symbol, ScanState.IDLE));
        log.info("ScanOrchestrator started | detectors={} fetchThreads={} detectionThreads={}",
                detectors.stream().map(Detector::getAlertType).collect(Collectors.toList()),
                scannerConfig.getMaxConcurrentFetches(), scannerConfig.getDetectionThreads());
    }

    /**
     * @return the cycle report, or empty when the cycle was skipped because the previous one is still running
     */
    public Optional<ScanCycleReport> runCycle() {
        long cycleId = cycleCounter.incrementAndGet();
        if (!cycleRunning.compareAndSet(false, true)) {
            scanLogService.logCycleSkipped(cycleId);
            return Optional.empty();
        }
        try {
            ScanCycleReport report = executeCycle(cycleId);
            lastReport = report;
            scanLogService.logCycle(report);
            return Optional.of(report);
        } finally {
            cycleRunning.set(false);
        }
    }

    private ScanCycleReport executeCycle(long cycleId) {
        Instant startedAt = clock.instant();
        ScanCycle cycle = new ScanCycle(cycleId, startedAt, baselineVolumeService.newCycleCache(startedAt));
        List<String> symbols = scannerConfig.getSymbols();

        log.info("🔍 Scan cycle {} started | symbols={}", cycleId, symbols.size());

        List<CompletableFuture<SymbolScan>> futures = new ArrayList<>();
        for (String symbol : symbols) {
            futures.add(CompletableFuture.supplyAsync(() -> scanSymbol(cycle, symbol), fetchExecutor));
        }

        List<SymbolScan> scans = new ArrayList<>();
        for (int i = 0; i < futures.size(); i++) {
            try {
                scans.add(futures.get(i).join());
            } catch (CompletionException e) {
                String symbol = symbols.get(i);
                scanLogService.logError("Scan of " + symbol + " aborted", e.getCause());
                symbolStates.put(symbol, ScanState.IDLE);
                scans.add(SymbolScan.failed(symbol));
            }
        }

        List<Opportunity> detected = scans.stream()
                .flatMap(scan -> scan.opportunities.stream())
                .sorted(Comparator.comparing(Opportunity::getSymbol)
                        .thenComparing(Opportunity::getAlertType)
                        .thenComparing(Opportunity::getOptionType)
                        .thenComparingDouble(Opportunity::getStrike)
                        .thenComparing(Opportunity::getExpiration))
                .collect(Collectors.toList());

        DispatchOutcome outcome = dispatch(detected);
        scans.forEach(scan -> symbolStates.put(scan.symbol, ScanState.IDLE));
        deduplicator.evictExpired(clock.instant());

        return ScanCycleReport.builder()
                .cycleId(cycleId)
                .startedAt(startedAt)
                .finishedAt(clock.instant())
                .symbolsScanned(symbols.size())
                .symbolsFailed((int) scans.stream().filter(scan -> scan.failed).count())
                .contractsEvaluated(scans.stream().mapToInt(scan -> scan.contractsEvaluated).sum())
                .evaluationFailures(scans.stream().mapToInt(scan -> scan.evaluationFailures).sum())
                .opportunitiesDetected(detected.size())
                .duplicatesSuppressed(outcome.duplicates)
                .persistedIds(outcome.persistedIds)
                .build();
    }

    /**
     * FETCHING then DETECTING for one watchlist symbol. Never throws.
     */
    SymbolScan scanSymbol(ScanCycle cycle, String symbol) {
        symbolStates.put(symbol, ScanState.FETCHING);
        List<OptionSnapshot> chain;
        try {
            chain = marketDataClient.getOptionChain(symbol);
        } catch (DataUnavailableException e) {
            scanLogService.logNoData("option chain " + symbol, e.getMessage());
            symbolStates.put(symbol, ScanState.IDLE);
            return SymbolScan.empty(symbol);
        } catch (Exception e) {
            scanLogService.logError("Failed to fetch option chain for " + symbol, e);
            symbolStates.put(symbol, ScanState.IDLE);
            return SymbolScan.failed(symbol);
        }

        if (chain == null || chain.isEmpty()) {
            symbolStates.put(symbol, ScanState.IDLE);
            return SymbolScan.empty(symbol);
        }

        symbolStates.put(symbol, ScanState.DETECTING);
        AtomicInteger failures = new AtomicInteger();
        List<CompletableFuture<List<Opportunity>>> evaluations = new ArrayList<>(chain.size());
        for (OptionSnapshot snapshot : chain) {
            evaluations.add(CompletableFuture.supplyAsync(
                    () -> evaluateContract(cycle, symbol, snapshot, failures), detectionExecutor));
        }

        List<Opportunity> found = new ArrayList<>();
        for (CompletableFuture<List<Opportunity>> evaluation : evaluations) {
            found.addAll(evaluation.join());
        }

        symbolStates.put(symbol, found.isEmpty() ? ScanState.IDLE : ScanState.DISPATCHING);
        log.debug("{}: {} contracts, {} candidates, {} evaluation failures", symbol, chain.size(), found.size(), failures.get());
        return new SymbolScan(symbol, found, chain.size(), failures.get(), false);
    }

    private List<Opportunity> evaluateContract(ScanCycle cycle, String symbol, OptionSnapshot snapshot, AtomicInteger failures) {
        List<Opportunity> found = new ArrayList<>(1);
        for (Detector detector : detectors) {
            try {
                detector.evaluate(cycle, symbol, snapshot).ifPresent(found::add);
            } catch (Exception e) {
                failures.incrementAndGet();
                scanLogService.logError("Detector " + detector.getAlertType() + " failed on " + snapshot.contractKey(), e);
            }
        }
        return found;
    }

    private DispatchOutcome dispatch(List<Opportunity> detected) {
        DispatchOutcome outcome = new DispatchOutcome();
        Set<String> seenThisCycle = new HashSet<>();

        for (Opportunity opportunity : detected) {
            Instant now = clock.instant();
            if (!seenThisCycle.add(opportunity.dedupKey()) || deduplicator.isDuplicate(opportunity, now)) {
                scanLogService.logDuplicate(opportunity);
                outcome.duplicates++;
                continue;
            }

            try {
                scanLogService.logOpportunity(opportunity);
                Long id = opportunityService.save(opportunity);
                deduplicator.markReported(opportunity, now);
                outcome.persistedIds.add(id);
                scanLogService.logPersisted(opportunity);
            } catch (Exception e) {
                scanLogService.logError("Could not save opportunity " + opportunity.dedupKey(), e);
                continue;
            }

            try {
                notificationService.broadcast(alertMessageFormatter.formatOpportunity(opportunity));
            } catch (Exception e) {
                scanLogService.logError("Could not send alert for opportunity " + opportunity.getId(), e);
            }
        }
        return outcome;
    }

    public boolean isCycleRunning() {
        return cycleRunning.get();
    }

    public Map<String, ScanState> getSymbolStates() {
        return new TreeMap<>(symbolStates);
    }

    public Optional<ScanCycleReport> getLastReport() {
        return Optional.ofNullable(lastReport);
    }

    @PreDestroy
    public void shutdown() {
        log.info("Shutting down ScanOrchestrator...");
        shutdownQuietly(fetchExecutor);
        shutdownQuietly(detectionExecutor);
        log.info("ScanOrchestrator shutdown complete");
    }

    private static void shutdownQuietly(ExecutorService executor) {
        if (executor == null) {
            return;
        }
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    static final class SymbolScan {
        final String symbol;
        final List<Opportunity> opportunities;
        final int contractsEvaluated;
        final int evaluationFailures;
        final boolean failed;

        SymbolScan(String symbol, List<Opportunity> opportunities, int contractsEvaluated, int evaluationFailures, boolean failed) {
            this.symbol = symbol;
            this.opportunities = opportunities;
            this.contractsEvaluated = contractsEvaluated;
            this.evaluationFailures = evaluationFailures;
            this.failed = failed;
        }

        static SymbolScan empty(String symbol) {
            return new SymbolScan(symbol, List.of(), 0, 0, false);
        }

        static SymbolScan failed(String symbol) {
            return new SymbolScan(symbol, List.of(), 0, 0, true);
        }
    }

    private static final class DispatchOutcome {
        int duplicates;
        final List<Long> persistedIds = new ArrayList<>();
    }
}
