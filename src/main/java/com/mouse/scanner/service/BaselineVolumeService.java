package com.mouse.scanner.service;

import com.mouse.scanner.config.ScannerConfig;
import com.mouse.scanner.exception.DataUnavailableException;
import com.mouse.scanner.interfaces.MarketDataClient;
import com.mouse.scanner.logservice.ScanLogService;
import com.mouse.scanner.model.BaselineVolume;
import com.mouse.scanner.model.ContractKey;
import com.mouse.scanner.model.HistoricalBar;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;

/**
 * Rolling average volume per contract over the configured lookback, sampled at a fixed bar size.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BaselineVolumeService {

    private final MarketDataClient marketDataClient;
    private final ScannerConfig scannerConfig;
    private final ScanLogService scanLogService;

    /**
     * Fresh cache for one scan cycle; baselines are measured up to {@code asOf}.
     */
    public BaselineCache newCycleCache(Instant asOf) {
        return new BaselineCache(contract -> computeBaseline(contract, asOf));
    }

    /**
     * Never throws. Missing history and fetch failures both come back as {@link BaselineVolume#UNKNOWN}.
     */
    public BaselineVolume computeBaseline(ContractKey contract, Instant asOf) {
        Instant start = asOf.minus(scannerConfig.getBaselineLookback());
        List<HistoricalBar> bars;
        try {
            bars = marketDataClient.getHistoricalBars(contract, start, asOf, scannerConfig.getBaselineGranularity());
        } catch (DataUnavailableException e) {
            scanLogService.logNoData("baseline " + contract, e.getMessage());
            return BaselineVolume.UNKNOWN;
        } catch (Exception e) {
            scanLogService.logWarn("Baseline fetch failed for " + contract, e);
            return BaselineVolume.UNKNOWN;
        }

        if (bars == null || bars.isEmpty()) {
            return BaselineVolume.UNKNOWN;
        }

        long total = 0;
        for (HistoricalBar bar : bars) {
            total += bar.getVolume();
        }
        BaselineVolume baseline = BaselineVolume.of((double) total / bars.size(), bars.size());
        log.debug("Baseline {} | bars={} avg={} known={}", contract, bars.size(),
                baseline.getAverageVolume(), baseline.isKnown());
        return baseline;
    }
}
