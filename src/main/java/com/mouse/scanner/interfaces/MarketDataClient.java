package com.mouse.scanner.interfaces;

import com.mouse.scanner.model.ContractKey;
import com.mouse.scanner.model.HistoricalBar;
import com.mouse.scanner.model.OptionSnapshot;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Live and historical market data.
 * <p>
 * Implementations signal "the provider has nothing for this request" with
 * {@link com.mouse.scanner.exception.DataUnavailableException} and network or API failures with
 * {@link com.mouse.scanner.exception.TransientFetchException}, so callers can tell the two apart.
 */
public interface MarketDataClient {

    List<OptionSnapshot> getOptionChain(String symbol);

    /**
     * Bars for one option contract, oldest first, restricted to {@code [start, end]}.
     */
    List<HistoricalBar> getHistoricalBars(ContractKey contract, Instant start, Instant end, Duration granularity);

    /**
     * Bars for the underlying stock, oldest first, restricted to {@code [start, end]}.
     */
    List<HistoricalBar> getHistoricalStockBars(String symbol, Instant start, Instant end, Duration granularity);
}
