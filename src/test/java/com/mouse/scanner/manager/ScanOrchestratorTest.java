package com.mouse.scanner.manager;

import com.mouse.scanner.config.ScannerConfig;
import com.mouse.scanner.entity.Opportunity;
import com.mouse.scanner.enums.OptionType;
import com.mouse.scanner.enums.ScanState;
import com.mouse.scanner.exception.DataUnavailableException;
import com.mouse.scanner.exception.TransientFetchException;
import com.mouse.scanner.interfaces.Detector;
import com.mouse.scanner.interfaces.MarketDataClient;
import com.mouse.scanner.logservice.ScanLogService;
import com.mouse.scanner.model.BaselineVolume;
import com.mouse.scanner.model.OptionSnapshot;
import com.mouse.scanner.model.ScanCycle;
import com.mouse.scanner.model.ScanCycleReport;
import com.mouse.scanner.service.*;
import com.mouse.scanner.tasks.ScanScheduler;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Predicate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class ScanOrchestratorTest {

    private static final Instant NOW = Instant.parse("2024-03-15T15:00:00Z");

    @Mock
    private MarketDataClient marketDataClient;

    @Mock
    private BaselineVolumeService baselineVolumeService;

    @Mock
    private OpportunityService opportunityService;

    @Mock
    private NotificationService notificationService;

    @Mock
    private AlertMessageFormatter alertMessageFormatter;

    @Mock
    private ScanLogService scanLogService;

    private ScannerConfig config;
    private OpportunityDeduplicator deduplicator;
    private ScanOrchestrator orchestrator;
    private final AtomicLong ids = new AtomicLong();

    @BeforeEach
    void setUp() {
        config = new ScannerConfig();
        config.setWatchlist(List.of("SPY", "QQQ"));
        config.setMaxConcurrentFetches(2);
        config.setDetectionThreads(2);
        config.setDedupWindowSeconds(3600);
        deduplicator = new OpportunityDeduplicator(config);

        when(baselineVolumeService.newCycleCache(any())).thenAnswer(inv -> new BaselineCache(k -> BaselineVolume.UNKNOWN));
        when(opportunityService.save(any(Opportunity.class))).thenAnswer(inv -> {
            Opportunity opportunity = inv.getArgument(0);
            opportunity.setId(ids.incrementAndGet());
            return opportunity.getId();
        });
        when(alertMessageFormatter.formatOpportunity(any())).thenReturn("alert");
    }

    @AfterEach
    void tearDown() {
        if (orchestrator != null) {
            orchestrator.shutdown();
        }
    }

    // ================ Dedup ================

    @Test
    void runCycle_sameAnomalyTwoCycles_persistedOnce() {
        orchestrator = orchestrator(List.of(flagging(s -> s.getVolume() >= 1_000)));
        when(marketDataClient.getOptionChain("SPY")).thenReturn(List.of(snapshot("SPY", 450.0, 5_000)));
        when(marketDataClient.getOptionChain("QQQ")).thenReturn(List.of());

        ScanCycleReport first = orchestrator.runCycle().orElseThrow();
        ScanCycleReport second = orchestrator.runCycle().orElseThrow();

        assertThat(first.getPersistedIds()).hasSize(1);
        assertThat(second.getPersistedIds()).isEmpty();
        assertThat(second.getDuplicatesSuppressed()).isEqualTo(1);
        verify(opportunityService, times(1)).save(any());
        verify(notificationService, times(1)).broadcast("alert");
    }

    @Test
    void runCycle_twoDetectorsOnSameContract_bothReported() {
        orchestrator = orchestrator(List.of(
                flagging("whale_activity", s -> true),
                flagging("day_trading", s -> true)));
        when(marketDataClient.getOptionChain("SPY")).thenReturn(List.of(snapshot("SPY", 450.0, 5_000)));
        when(marketDataClient.getOptionChain("QQQ")).thenReturn(List.of());

        ScanCycleReport report = orchestrator.runCycle().orElseThrow();

        assertThat(report.getPersistedIds()).hasSize(2);
        assertThat(report.getDuplicatesSuppressed()).isZero();
    }

    // ================ Failure isolation ================

    @Test
    void runCycle_oneSymbolFetchFails_otherSymbolStillProcessed() {
        orchestrator = orchestrator(List.of(flagging(s -> true)));
        when(marketDataClient.getOptionChain("SPY")).thenThrow(new TransientFetchException("HTTP 503"));
        when(marketDataClient.getOptionChain("QQQ")).thenReturn(List.of(snapshot("QQQ", 440.0, 2_000)));

        ScanCycleReport report = orchestrator.runCycle().orElseThrow();

        assertThat(report.getSymbolsFailed()).isEqualTo(1);
        assertThat(report.getPersistedIds()).hasSize(1);
        verify(scanLogService).logError(contains("SPY"), any(TransientFetchException.class));
    }

    @Test
    void runCycle_noDataForSymbol_isNotAFailure() {
        orchestrator = orchestrator(List.of(flagging(s -> true)));
        when(marketDataClient.getOptionChain("SPY")).thenThrow(new DataUnavailableException("market closed"));
        when(marketDataClient.getOptionChain("QQQ")).thenReturn(List.of());

        ScanCycleReport report = orchestrator.runCycle().orElseThrow();

        assertThat(report.getSymbolsFailed()).isZero();
        verify(scanLogService).logNoData(contains("SPY"), eq("market closed"));
    }

    @Test
    void runCycle_detectorThrowsOnOneContract_restOfChainEvaluated() {
        Detector exploding = flagging(s -> {
            if (s.getStrike() == 445.0) {
                throw new IllegalStateException("bad greeks");
            }
            return true;
        });
        orchestrator = orchestrator(List.of(exploding));
        when(marketDataClient.getOptionChain("SPY")).thenReturn(List.of(
                snapshot("SPY", 445.0, 1_000), snapshot("SPY", 450.0, 1_000), snapshot("SPY", 455.0, 1_000)));
        when(marketDataClient.getOptionChain("QQQ")).thenReturn(List.of());

        ScanCycleReport report = orchestrator.runCycle().orElseThrow();

        assertThat(report.getContractsEvaluated()).isEqualTo(3);
        assertThat(report.getEvaluationFailures()).isEqualTo(1);
        assertThat(report.getPersistedIds()).hasSize(2);
    }

    @Test
    void runCycle_saveFails_notMarkedReportedAndRetriedNextCycle() {
        orchestrator = orchestrator(List.of(flagging(s -> true)));
        when(marketDataClient.getOptionChain("SPY")).thenReturn(List.of(snapshot("SPY", 450.0, 1_000)));
        when(marketDataClient.getOptionChain("QQQ")).thenReturn(List.of());
        when(opportunityService.save(any(Opportunity.class)))
                .thenThrow(new IllegalStateException("db down"))
                .thenReturn(99L);

        assertThat(orchestrator.runCycle().orElseThrow().getPersistedIds()).isEmpty();
        assertThat(orchestrator.runCycle().orElseThrow().getPersistedIds()).containsExactly(99L);
    }

    @Test
    void runCycle_notificationFails_opportunityStillPersisted() {
        orchestrator = orchestrator(List.of(flagging(s -> true)));
        when(marketDataClient.getOptionChain("SPY")).thenReturn(List.of(snapshot("SPY", 450.0, 1_000)));
        when(marketDataClient.getOptionChain("QQQ")).thenReturn(List.of());
        when(notificationService.broadcast(anyString())).thenThrow(new IllegalStateException("telegram down"));

        ScanCycleReport report = orchestrator.runCycle().orElseThrow();

        assertThat(report.getPersistedIds()).hasSize(1);
        assertThat(deduplicator.size()).isEqualTo(1);
    }

    // ================ Overlap ================

    @Test
    void runCycle_whilePreviousStillRunning_isSkipped() throws Exception {
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        orchestrator = orchestrator(List.of(flagging(s -> true)));
        when(marketDataClient.getOptionChain("SPY")).thenAnswer(inv -> {
            entered.countDown();
            release.await(5, TimeUnit.SECONDS);
            return List.of();
        });
        when(marketDataClient.getOptionChain("QQQ")).thenReturn(List.of());

        ExecutorService runner = Executors.newSingleThreadExecutor();
        try {
            Future<Optional<ScanCycleReport>> first = runner.submit(orchestrator::runCycle);
            assertThat(entered.await(5, TimeUnit.SECONDS)).isTrue();
            assertThat(orchestrator.isCycleRunning()).isTrue();
            assertThat(orchestrator.getSymbolStates()).containsEntry("SPY", ScanState.FETCHING);

            Optional<ScanCycleReport> second = orchestrator.runCycle();

            assertThat(second).isEmpty();
            verify(scanLogService).logCycleSkipped(anyLong());

            release.countDown();
            assertThat(first.get(5, TimeUnit.SECONDS)).isPresent();
        } finally {
            release.countDown();
            runner.shutdownNow();
        }
        assertThat(orchestrator.isCycleRunning()).isFalse();
        assertThat(orchestrator.getSymbolStates()).containsEntry("SPY", ScanState.IDLE);
    }

    @Test
    void scheduledSlots_cycleOverrunsInterval_nextSlotIsSkippedNotQueued() throws Exception {
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        orchestrator = orchestrator(List.of(flagging(s -> true)));
        when(marketDataClient.getOptionChain("SPY")).thenAnswer(inv -> {
            entered.countDown();
            release.await(5, TimeUnit.SECONDS);
            return List.of();
        });
        when(marketDataClient.getOptionChain("QQQ")).thenReturn(List.of());

        ScanScheduler scheduler = new ScanScheduler(orchestrator);
        scheduler.init();
        try {
            scheduler.scheduledScan();
            assertThat(entered.await(5, TimeUnit.SECONDS)).isTrue();

            scheduler.scheduledScan();

            verify(scanLogService, timeout(2000)).logCycleSkipped(anyLong());
            release.countDown();
            verify(scanLogService, timeout(2000).times(1)).logCycle(any());
        } finally {
            release.countDown();
            scheduler.shutdown();
        }
        verify(marketDataClient, times(1)).getOptionChain("SPY");
    }

    @Test
    void runCycle_eachCycleGetsFreshBaselineCache() {
        orchestrator = orchestrator(List.of(flagging(s -> false)));
        when(marketDataClient.getOptionChain(anyString())).thenReturn(List.of());

        orchestrator.runCycle();
        orchestrator.runCycle();

        verify(baselineVolumeService, times(2)).newCycleCache(NOW);
        assertThat(orchestrator.getLastReport()).isPresent();
    }

    // ================ Helpers ================

    private ScanOrchestrator orchestrator(List<Detector> detectors) {
        ScanOrchestrator created = new ScanOrchestrator(marketDataClient, detectors, baselineVolumeService, deduplicator,
                opportunityService, notificationService, alertMessageFormatter, scanLogService, config,
                Clock.fixed(NOW, ZoneOffset.UTC));
        created.init();
        return created;
    }

    private static Detector flagging(Predicate<OptionSnapshot> rule) {
        return flagging("whale_activity", rule);
    }

    private static Detector flagging(String alertType, Predicate<OptionSnapshot> rule) {
        return new Detector() {
            @Override
            public String getAlertType() {
                return alertType;
            }

            @Override
            public Optional<Opportunity> evaluate(ScanCycle cycle, String symbol, OptionSnapshot snapshot) {
                if (!rule.test(snapshot)) {
                    return Optional.empty();
                }
                cycle.getBaselines().get(snapshot.contractKey());
                return Optional.of(Opportunity.builder()
                        .symbol(symbol)
                        .optionType(snapshot.getOptionType())
                        .strike(snapshot.getStrike())
                        .expiration(snapshot.getExpiration())
                        .detectedAt(cycle.getStartedAt())
                        .price(snapshot.getPrice())
                        .volume(snapshot.getVolume())
                        .alertType(alertType)
                        .build());
            }
        };
    }

    private static OptionSnapshot snapshot(String symbol, double strike, long volume) {
        return OptionSnapshot.builder()
                .symbol(symbol)
                .optionType(OptionType.CALL)
                .strike(strike)
                .expiration(LocalDate.of(2024, 4, 19))
                .lastPrice(25.0)
                .volume(volume)
                .openInterest(1_000)
                .underlyingPrice(strike)
                .timestamp(NOW)
                .build();
    }
}
