package com.mouse.scanner.config;

import com.mouse.scanner.enums.PriceBasis;
import com.mouse.scanner.exception.ConfigurationException;
import com.mouse.scanner.model.Horizon;
import jakarta.annotation.PostConstruct;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

@Slf4j
@Component
@Data
public class ScannerConfig {

    // ==================== WATCHLIST & CYCLE ====================

    @Value("${scanner.watchlist:SPY,QQQ,AAPL,MSFT,AMZN,GOOGL,TSLA,META,NVDA,AMD}")
    private List<String> watchlist = new ArrayList<>(Arrays.asList(
            "SPY", "QQQ", "AAPL", "MSFT", "AMZN", "GOOGL", "TSLA", "META", "NVDA", "AMD"));

    @Value("${scanner.scan-interval-seconds:300}")
    private long scanIntervalSeconds = 300;

    @Value("${scanner.dedup-window-seconds:3600}")
    private long dedupWindowSeconds = 3600;

    @Value("${scanner.max-concurrent-fetches:4}")
    private int maxConcurrentFetches = 4;

    @Value("${scanner.detection-threads:8}")
    private int detectionThreads = 8;

    // ==================== WHALE ACTIVITY ====================

    @Value("${scanner.whale.min-notional-value:1000000}")
    private double minNotionalValue = 1_000_000;

    @Value("${scanner.whale.unusual-volume-multiplier:3.0}")
    private double unusualVolumeMultiplier = 3.0;

    @Value("${scanner.whale.min-trade-size:100}")
    private long minTradeSize = 100;

    // ==================== DAY TRADING ====================

    @Value("${scanner.day-trading.min-volume:100}")
    private long dayTradingMinVolume = 100;

    @Value("${scanner.day-trading.min-open-interest:500}")
    private long dayTradingMinOpenInterest = 500;

    @Value("${scanner.day-trading.min-iv-percentile:70}")
    private double dayTradingMinIvPercentile = 70;

    // ==================== VOLUME / OPEN INTEREST ====================

    @Value("${scanner.volume-oi.min-ratio:3.0}")
    private double volumeOpenInterestMinRatio = 3.0;

    // ==================== BASELINE ====================

    @Value("${scanner.baseline.lookback-days:30}")
    private int baselineLookbackDays = 30;

    @Value("${scanner.baseline.granularity-minutes:30}")
    private int baselineGranularityMinutes = 30;

    // ==================== BACKTEST ====================

    @Value("${backtest.horizons-minutes:1,5,10,15,20}")
    private List<Long> horizonMinutes = new ArrayList<>(Arrays.asList(1L, 5L, 10L, 15L, 20L));

    @Value("${backtest.price-basis:OPTION}")
    private PriceBasis priceBasis = PriceBasis.OPTION;

    @Value("${backtest.bar-granularity-minutes:1}")
    private int backtestGranularityMinutes = 1;

    @Value("${backtest.threads:4}")
    private int backtestThreads = 4;

    // incomplete results are re-evaluated until the opportunity is this old
    @Value("${backtest.retry-window-hours:24}")
    private long backtestRetryWindowHours = 24;

    // ==================== LEADERBOARD ====================

    @Value("${leaderboard.ranking-horizon:5m}")
    private String rankingHorizon = "5m";

    @Value("${leaderboard.top-size:10}")
    private int leaderboardTopSize = 10;

    /**
     * Fails startup on settings the scanner cannot run with.
     */
    @PostConstruct
    public void validate() {
        List<String> errors = new ArrayList<>();

        if (getSymbols().isEmpty()) errors.add("scanner.watchlist must contain at least one symbol");
        if (scanIntervalSeconds <= 0) errors.add("scanner.scan-interval-seconds must be > 0");
        if (dedupWindowSeconds < 0) errors.add("scanner.dedup-window-seconds must be >= 0");
        if (maxConcurrentFetches <= 0) errors.add("scanner.max-concurrent-fetches must be > 0");
        if (detectionThreads <= 0) errors.add("scanner.detection-threads must be > 0");
        if (minNotionalValue < 0) errors.add("scanner.whale.min-notional-value must be >= 0");
        if (!(unusualVolumeMultiplier > 0)) errors.add("scanner.whale.unusual-volume-multiplier must be > 0");
        if (minTradeSize <= 0) errors.add("scanner.whale.min-trade-size must be > 0");
        if (dayTradingMinVolume <= 0) errors.add("scanner.day-trading.min-volume must be > 0");
        if (dayTradingMinOpenInterest < 0) errors.add("scanner.day-trading.min-open-interest must be >= 0");
        if (dayTradingMinIvPercentile < 0 || dayTradingMinIvPercentile > 100) {
            errors.add("scanner.day-trading.min-iv-percentile must be within [0, 100]");
        }
        if (!(volumeOpenInterestMinRatio > 0)) errors.add("scanner.volume-oi.min-ratio must be > 0");
        if (baselineLookbackDays <= 0) errors.add("scanner.baseline.lookback-days must be > 0");
        if (baselineGranularityMinutes <= 0) errors.add("scanner.baseline.granularity-minutes must be > 0");
        if (backtestGranularityMinutes <= 0) errors.add("backtest.bar-granularity-minutes must be > 0");
        if (backtestThreads <= 0) errors.add("backtest.threads must be > 0");
        if (backtestRetryWindowHours < 0) errors.add("backtest.retry-window-hours must be >= 0");
        if (leaderboardTopSize <= 0) errors.add("leaderboard.top-size must be > 0");
        if (priceBasis == null) errors.add("backtest.price-basis must be OPTION or UNDERLYING");

        try {
            if (getHorizons().isEmpty()) errors.add("backtest.horizons-minutes must not be empty");
        } catch (IllegalArgumentException e) {
            errors.add("backtest.horizons-minutes: " + e.getMessage());
        }
        try {
            getRankingHorizonValue();
        } catch (IllegalArgumentException e) {
            errors.add("leaderboard.ranking-horizon: " + e.getMessage());
        }

        if (!errors.isEmpty()) {
            throw new ConfigurationException("Invalid scanner configuration: " + String.join("; ", errors));
        }

        log.info("Scanner configured | symbols={} interval={}s minNotional={} multiplier={} minTradeSize={} horizons={}",
                getSymbols(), scanIntervalSeconds, minNotionalValue, unusualVolumeMultiplier, minTradeSize, getHorizons());
    }

    /**
     * Watchlist trimmed, upper-cased and de-duplicated, in configured order.
     */
    public List<String> getSymbols() {
        if (watchlist == null) {
            return List.of();
        }
        Set<String> symbols = watchlist.stream()
                .filter(s -> s != null && !s.isBlank())
                .map(s -> s.trim().toUpperCase(Locale.ROOT))
                .collect(Collectors.toCollection(LinkedHashSet::new));
        return new ArrayList<>(symbols);
    }

    /**
     * Backtest horizons, shortest first, without duplicates.
     */
    public List<Horizon> getHorizons() {
        if (horizonMinutes == null) {
            return List.of();
        }
        return horizonMinutes.stream()
                .distinct()
                .map(Horizon::ofMinutes)
                .sorted()
                .collect(Collectors.toList());
    }

    /**
     * The configured horizon with the same duration as {@code leaderboard.ranking-horizon}, so "1h" and
     * "60m" name the same leaderboard column.
     */
    public Horizon getRankingHorizonValue() {
        return matchHorizon(rankingHorizon);
    }

    /**
     * @throws IllegalArgumentException when the text does not parse or names no configured horizon
     */
    public Horizon matchHorizon(String text) {
        Horizon requested = Horizon.parse(text);
        return getHorizons().stream()
                .filter(h -> h.getDuration().equals(requested.getDuration()))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Horizon " + text + " is not one of " + getHorizons()));
    }

    public Duration getScanInterval() {
        return Duration.ofSeconds(scanIntervalSeconds);
    }

    public Duration getDedupWindow() {
        return Duration.ofSeconds(dedupWindowSeconds);
    }

    public Duration getBaselineLookback() {
        return Duration.ofDays(baselineLookbackDays);
    }

    public Duration getBaselineGranularity() {
        return Duration.ofMinutes(baselineGranularityMinutes);
    }

    public Duration getBacktestGranularity() {
        return Duration.ofMinutes(backtestGranularityMinutes);
    }

    public Duration getBacktestRetryWindow() {
        return Duration.ofHours(backtestRetryWindowHours);
    }
}
