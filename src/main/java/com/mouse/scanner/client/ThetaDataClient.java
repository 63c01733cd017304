package com.mouse.scanner.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mouse.scanner.exception.DataUnavailableException;
import com.mouse.scanner.exception.TransientFetchException;
import com.mouse.scanner.interfaces.MarketDataClient;
import com.mouse.scanner.model.ContractKey;
import com.mouse.scanner.model.Greeks;
import com.mouse.scanner.model.HistoricalBar;
import com.mouse.scanner.model.OptionSnapshot;
import com.mouse.scanner.utils.ThetaDataResponseParser;
import com.mouse.scanner.utils.ThetaDataResponseParser.ContractRow;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.*;
import java.util.stream.Collectors;

import static com.mouse.scanner.utils.ThetaDataResponseParser.DATE_FORMAT;
import static com.mouse.scanner.utils.ThetaDataResponseParser.MARKET_ZONE;

/**
 * {@link MarketDataClient} backed by a ThetaData terminal's REST API.
 * <p>
 * The chain is built for the nearest listed expiration from the bulk ohlc and open-interest snapshots,
 * enriched with quotes and greeks when the terminal has them.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ThetaDataClient implements MarketDataClient {

    /** Terminal status for "no data for this request". */
    static final int NO_DATA_STATUS = 472;
    private static final DateTimeFormatter OCC_DATE = DateTimeFormatter.ofPattern("yyMMdd");

    private final OkHttpClient okHttpClient;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Value("${thetadata.base-url:http://127.0.0.1:25510}")
    private String baseUrl;

    @Value("${thetadata.username:}")
    private String username;

    @Value("${thetadata.api-key:}")
    private String apiKey;

    @Override
    public List<OptionSnapshot> getOptionChain(String symbol) {
        LocalDate expiration = nearestExpiration(symbol);
        String exp = expiration.format(DATE_FORMAT);

        List<ContractRow> ohlc = ThetaDataResponseParser.parseBulkSnapshot(
                get("/v2/bulk_snapshot/option/ohlc", Map.of("root", symbol, "exp", exp)), objectMapper);
        if (ohlc.isEmpty()) {
            throw new DataUnavailableException("Empty option chain for " + symbol + " " + expiration);
        }

        Map<String, ContractRow> openInterest = index(optionalSnapshot("open_interest", symbol, exp));
        Map<String, ContractRow> quotes = index(optionalSnapshot("quote", symbol, exp));
        Map<String, ContractRow> greeks = index(optionalSnapshot("greeks", symbol, exp));

        Instant now = clock.instant();
        List<OptionSnapshot> chain = new ArrayList<>(ohlc.size());
        for (ContractRow row : ohlc) {
            ContractRow oi = openInterest.get(row.key());
            ContractRow quote = quotes.get(row.key());
            ContractRow greek = greeks.get(row.key());

            double mid = 0.0;
            if (quote != null && quote.value("bid") > 0 && quote.value("ask") > 0) {
                mid = (quote.value("bid") + quote.value("ask")) / 2.0;
            }

            chain.add(OptionSnapshot.builder()
                    .symbol(symbol)
                    .optionSymbol(optionSymbol(row))
                    .optionType(row.getOptionType())
                    .strike(row.getStrike())
                    .expiration(row.getExpiration())
                    .lastPrice(row.value("close"))
                    .midPrice(mid)
                    .volume((long) row.value("volume"))
                    .openInterest(oi == null ? 0L : (long) oi.value("open_interest"))
                    .underlyingPrice(greek == null ? 0.0 : greek.value("underlying_price"))
                    .greeks(greek == null ? null : Greeks.builder()
                            .impliedVolatility(greek.value("implied_vol"))
                            .delta(greek.value("delta"))
                            .gamma(greek.value("gamma"))
                            .theta(greek.value("theta"))
                            .vega(greek.value("vega"))
                            .build())
                    .timestamp(now)
                    .build());
        }
        log.debug("Fetched {} contracts for {} exp {}", chain.size(), symbol, expiration);
        return chain;
    }

    @Override
    public List<HistoricalBar> getHistoricalBars(ContractKey contract, Instant start, Instant end, Duration granularity) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("root", contract.getSymbol());
        params.put("exp", contract.getExpiration().format(DATE_FORMAT));
        params.put("strike", String.valueOf(Math.round(contract.getStrike() * 1000)));
        params.put("right", contract.getOptionType().getRight());
        putRange(params, start, end, granularity);

        return within(ThetaDataResponseParser.parseBars(get("/v2/hist/option/ohlc", params), objectMapper), start, end);
    }

    @Override
    public List<HistoricalBar> getHistoricalStockBars(String symbol, Instant start, Instant end, Duration granularity) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("root", symbol);
        putRange(params, start, end, granularity);

        return within(ThetaDataResponseParser.parseBars(get("/v2/hist/stock/ohlc", params), objectMapper), start, end);
    }

    LocalDate nearestExpiration(String symbol) {
        List<LocalDate> expirations = ThetaDataResponseParser.parseExpirations(
                get("/v2/list/expirations", Map.of("root", symbol)), objectMapper);
        LocalDate today = LocalDate.now(clock.withZone(MARKET_ZONE));
        return expirations.stream()
                .filter(date -> !date.isBefore(today))
                .findFirst()
                .orElseThrow(() -> new DataUnavailableException("No upcoming expirations for " + symbol));
    }

    private List<ContractRow> optionalSnapshot(String kind, String symbol, String exp) {
        try {
            return ThetaDataResponseParser.parseBulkSnapshot(
                    get("/v2/bulk_snapshot/option/" + kind, Map.of("root", symbol, "exp", exp)), objectMapper);
        } catch (DataUnavailableException | TransientFetchException e) {
            log.warn("No {} snapshot for {} {}: {}", kind, symbol, exp, e.getMessage());
            return List.of();
        }
    }

    private String get(String path, Map<String, String> params) {
        HttpUrl parsed = HttpUrl.parse(baseUrl + path);
        if (parsed == null) {
            throw new IllegalStateException("Invalid ThetaData base url: " + baseUrl);
        }
        HttpUrl.Builder url = parsed.newBuilder();
        params.forEach(url::addQueryParameter);
        if (username != null && !username.isBlank()) {
            url.addQueryParameter("username", username);
        }
        if (apiKey != null && !apiKey.isBlank()) {
            url.addQueryParameter("key", apiKey);
        }

        Request request = new Request.Builder()
                .url(url.build())
                .header("Accept", "application/json")
                .get()
                .build();

        try (Response response = okHttpClient.newCall(request).execute()) {
            if (response.code() == NO_DATA_STATUS) {
                throw new DataUnavailableException("No data for " + path + " " + params);
            }
            if (!response.isSuccessful()) {
                throw new TransientFetchException("ThetaData " + path + " returned HTTP " + response.code());
            }
            ResponseBody body = response.body();
            return body == null ? "" : body.string();
        } catch (IOException e) {
            throw new TransientFetchException("ThetaData request " + path + " failed: " + e.getMessage(), e);
        }
    }

    private static void putRange(Map<String, String> params, Instant start, Instant end, Duration granularity) {
        params.put("start_date", start.atZone(MARKET_ZONE).toLocalDate().format(DATE_FORMAT));
        params.put("end_date", end.atZone(MARKET_ZONE).toLocalDate().format(DATE_FORMAT));
        params.put("ivl", String.valueOf(granularity.toMillis()));
    }

    private static List<HistoricalBar> within(List<HistoricalBar> bars, Instant start, Instant end) {
        return bars.stream()
                .filter(bar -> !bar.getTimestamp().isBefore(start) && !bar.getTimestamp().isAfter(end))
                .collect(Collectors.toList());
    }

    private static Map<String, ContractRow> index(List<ContractRow> rows) {
        Map<String, ContractRow> byKey = new HashMap<>();
        rows.forEach(row -> byKey.putIfAbsent(row.key(), row));
        return byKey;
    }

    /**
     * OCC-style symbol, e.g. {@code SPY240119C00450000}.
     */
    static String optionSymbol(ContractRow row) {
        return String.format("%s%s%s%08d",
                row.getRoot(),
                row.getExpiration().format(OCC_DATE),
                row.getOptionType().getRight(),
                Math.round(row.getStrike() * 1000));
    }
}
