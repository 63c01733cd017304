package com.mouse.scanner.service;

import com.mouse.scanner.config.ScannerConfig;
import com.mouse.scanner.entity.BacktestResult;
import com.mouse.scanner.entity.Opportunity;
import com.mouse.scanner.enums.OptionType;
import com.mouse.scanner.enums.PriceBasis;
import com.mouse.scanner.exception.DataUnavailableException;
import com.mouse.scanner.exception.TransientFetchException;
import com.mouse.scanner.interfaces.MarketDataClient;
import com.mouse.scanner.logservice.ScanLogService;
import com.mouse.scanner.model.HistoricalBar;
import com.mouse.scanner.model.Horizon;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.*;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class BacktestEngineTest {

    private static final Instant DETECTED = Instant.parse("2024-03-15T15:00:00Z");
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-03-15T17:00:00Z"), ZoneOffset.UTC);

    @Mock
    private MarketDataClient marketDataClient;

    @Mock
    private ScanLogService scanLogService;

    private ScannerConfig config;
    private BacktestEngine engine;

    @BeforeEach
    void setUp() {
        config = new ScannerConfig();
        config.setHorizonMinutes(List.of(1L, 5L, 10L, 15L, 20L));
        config.setPriceBasis(PriceBasis.OPTION);
        config.setBacktestThreads(2);
        engine = new BacktestEngine(marketDataClient, config, scanLogService, CLOCK);
        engine.init();
    }

    @AfterEach
    void tearDown() {
        engine.shutdown();
    }

    // ================ evaluate ================

    @Test
    void evaluate_priceUpTenPercentAtFiveMinutes_reportsTenPercent() {
        Opportunity opportunity = opportunity(1L, 2.00);
        when(marketDataClient.getHistoricalBars(eq(opportunity.contractKey()), eq(DETECTED),
                eq(DETECTED.plus(Duration.ofMinutes(21))), eq(Duration.ofMinutes(1))))
                .thenReturn(List.of(bar(0, 2.00), bar(1, 2.05), bar(5, 2.20), bar(10, 1.90), bar(15, 2.00), bar(20, 2.50)));

        BacktestResult result = engine.evaluate(opportunity);

        assertThat(result.getOpportunityId()).isEqualTo(1L);
        assertThat(result.getEntryPrice()).isEqualTo(2.00);
        assertThat(result.getPriceBasis()).isEqualTo(PriceBasis.OPTION);
        assertThat(result.returnAt("5m").orElseThrow()).isCloseTo(10.0, within(1e-9));
        assertThat(result.returnAt("1m").orElseThrow()).isCloseTo(2.5, within(1e-9));
        assertThat(result.returnAt("10m").orElseThrow()).isCloseTo(-5.0, within(1e-9));
        assertThat(result.returnAt("20m").orElseThrow()).isCloseTo(25.0, within(1e-9));
        assertThat(result.getHorizonReturns()).containsOnlyKeys("1m", "5m", "10m", "15m", "20m");
    }

    @Test
    void evaluate_detectionBetweenMinuteBars_stillResolvesLongestHorizon() {
        Instant detectedAt = DETECTED.plusSeconds(30);
        Opportunity opportunity = opportunity(9L, 2.00).toBuilder().detectedAt(detectedAt).build();
        List<HistoricalBar> minuteBars = new ArrayList<>();
        for (int minute = 0; minute <= 21; minute++) {
            minuteBars.add(bar(minute, 2.00 + 0.1 * minute));
        }
        when(marketDataClient.getHistoricalBars(eq(opportunity.contractKey()), eq(detectedAt),
                eq(detectedAt.plus(Duration.ofMinutes(21))), eq(Duration.ofMinutes(1))))
                .thenReturn(minuteBars);

        BacktestResult result = engine.evaluate(opportunity);

        assertThat(result.getHorizonReturns()).containsOnlyKeys("1m", "5m", "10m", "15m", "20m");
        assertThat(result.returnAt("1m").orElseThrow()).isCloseTo(5.0, within(1e-9));
        assertThat(result.returnAt("20m").orElseThrow()).isCloseTo(100.0, within(1e-9));
    }

    @Test
    void evaluate_dataStopsBeforeLongHorizons_omitsThemInsteadOfZero() {
        Opportunity opportunity = opportunity(2L, 2.00);
        when(marketDataClient.getHistoricalBars(any(), any(), any(), any()))
                .thenReturn(List.of(bar(0, 2.00), bar(5, 2.20), bar(8, 2.30)));

        BacktestResult result = engine.evaluate(opportunity);

        assertThat(result.getHorizonReturns()).containsOnlyKeys("1m", "5m");
        assertThat(result.returnAt("15m")).isEmpty();
    }

    @Test
    void evaluate_noHistory_returnsEmptyHorizons() {
        when(marketDataClient.getHistoricalBars(any(), any(), any(), any()))
                .thenThrow(new DataUnavailableException("no trades"));

        BacktestResult result = engine.evaluate(opportunity(3L, 2.00));

        assertThat(result.getHorizonReturns()).isEmpty();
        verify(scanLogService).logNoData(anyString(), eq("no trades"));
    }

    @Test
    void evaluate_zeroEntryPrice_skipsFetch() {
        BacktestResult result = engine.evaluate(opportunity(4L, 0.0));

        assertThat(result.getHorizonReturns()).isEmpty();
        verifyNoInteractions(marketDataClient);
    }

    @Test
    void evaluate_underlyingBasis_usesStockBarsAndUnderlyingEntry() {
        config.setPriceBasis(PriceBasis.UNDERLYING);
        Opportunity opportunity = opportunity(5L, 2.00);
        when(marketDataClient.getHistoricalStockBars(eq("SPY"), any(), any(), any()))
                .thenReturn(List.of(bar(0, 500.0), bar(20, 505.0)));

        BacktestResult result = engine.evaluate(opportunity);

        assertThat(result.getEntryPrice()).isEqualTo(500.0);
        assertThat(result.returnAt("20m").orElseThrow()).isCloseTo(1.0, within(1e-9));
        verify(marketDataClient, never()).getHistoricalBars(any(), any(), any(), any());
    }

    @Test
    void evaluate_sameInputTwice_givesSameReturns() {
        Opportunity opportunity = opportunity(6L, 2.00);
        when(marketDataClient.getHistoricalBars(any(), any(), any(), any()))
                .thenReturn(List.of(bar(0, 2.00), bar(5, 2.20), bar(20, 2.40)));

        Map<String, Double> first = engine.evaluate(opportunity).getHorizonReturns();
        Map<String, Double> second = engine.evaluate(opportunity).getHorizonReturns();

        assertThat(second).isEqualTo(first);
    }

    // ================ evaluateAll ================

    @Test
    void evaluateAll_oneFailure_othersStillEvaluated() {
        Opportunity good = opportunity(7L, 2.00);
        Opportunity bad = opportunity(8L, 2.00).toBuilder().symbol("QQQ").build();
        when(marketDataClient.getHistoricalBars(argThat(key -> key != null && "SPY".equals(key.getSymbol())), any(), any(), any()))
                .thenReturn(List.of(bar(0, 2.00), bar(20, 2.20)));
        when(marketDataClient.getHistoricalBars(argThat(key -> key != null && "QQQ".equals(key.getSymbol())), any(), any(), any()))
                .thenThrow(new TransientFetchException("HTTP 503"));

        List<BacktestResult> results = engine.evaluateAll(List.of(good, bad));

        assertThat(results).extracting(BacktestResult::getOpportunityId).containsExactly(7L);
        verify(scanLogService).logError(contains("8"), any(TransientFetchException.class));
    }

    // ================ priceAt ================

    @Test
    void priceAt_betweenBars_usesLastBarAtOrBeforeTarget() {
        List<HistoricalBar> bars = List.of(bar(0, 1.0), bar(4, 1.5), bar(7, 2.0));

        OptionalDouble price = BacktestEngine.priceAt(bars, DETECTED.plus(Duration.ofMinutes(5)));

        assertThat(price).hasValue(1.5);
    }

    @Test
    void priceAt_targetAfterLastBar_isEmpty() {
        List<HistoricalBar> bars = List.of(bar(0, 1.0), bar(4, 1.5));

        assertThat(BacktestEngine.priceAt(bars, DETECTED.plus(Duration.ofMinutes(5)))).isEmpty();
    }

    @Test
    void computeReturns_unsortedBars_areSortedFirst() {
        List<HistoricalBar> bars = List.of(bar(5, 2.20), bar(0, 2.00), bar(1, 2.10));

        Map<String, Double> returns = BacktestEngine.computeReturns(2.00, DETECTED, bars,
                List.of(Horizon.ofMinutes(1), Horizon.ofMinutes(5)));

        assertThat(returns.get("1m")).isCloseTo(5.0, within(1e-9));
        assertThat(returns.get("5m")).isCloseTo(10.0, within(1e-9));
    }

    private static Opportunity opportunity(Long id, double price) {
        return Opportunity.builder()
                .id(id)
                .symbol("SPY")
                .optionType(OptionType.CALL)
                .strike(500.0)
                .expiration(LocalDate.of(2024, 3, 15))
                .detectedAt(DETECTED)
                .price(price)
                .underlyingPrice(500.0)
                .volume(1_000)
                .alertType("whale_activity")
                .build();
    }

    private static HistoricalBar bar(int minutesAfterDetection, double price) {
        return new HistoricalBar(DETECTED.plus(Duration.ofMinutes(minutesAfterDetection)), 10, price);
    }
}
