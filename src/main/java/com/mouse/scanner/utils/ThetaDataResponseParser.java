package com.mouse.scanner.utils;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mouse.scanner.enums.OptionType;
import com.mouse.scanner.exception.TransientFetchException;
import com.mouse.scanner.model.HistoricalBar;
import lombok.NoArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.*;

/**
 * Parses ThetaData terminal responses.
 * <p>
 * Every response carries {@code header.format}, the list of column names, and a {@code response}
 * array whose rows are positional. Bulk endpoints wrap rows per contract as
 * {@code {"ticks": [[...]], "contract": {...}}}.
 */
@Slf4j
@NoArgsConstructor
public class ThetaDataResponseParser {

    public static final ZoneId MARKET_ZONE = ZoneId.of("America/New_York");
    public static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.BASIC_ISO_DATE;

    // strikes are quoted in tenths of a cent
    private static final double STRIKE_SCALE = 1000.0;

    /**
     * One contract row of a bulk snapshot: the contract identity plus its first tick keyed by column name.
     */
    @Value
    public static class ContractRow {
        String root;
        LocalDate expiration;
        double strike;
        OptionType optionType;
        Map<String, Double> values;

        public double value(String column) {
            Double v = values.get(column);
            return v == null ? 0.0 : v;
        }

        public String key() {
            return key(root, expiration, strike, optionType);
        }

        public static String key(String root, LocalDate expiration, double strike, OptionType optionType) {
            return root + "|" + expiration + "|" + strike + "|" + optionType.getRight();
        }
    }

    public static List<LocalDate> parseExpirations(String json, ObjectMapper objectMapper) {
        JsonNode response = readResponse(json, objectMapper);
        List<LocalDate> expirations = new ArrayList<>();
        for (JsonNode node : response) {
            LocalDate date = toDate(node);
            if (date != null) {
                expirations.add(date);
            }
        }
        Collections.sort(expirations);
        return expirations;
    }

    public static List<ContractRow> parseBulkSnapshot(String json, ObjectMapper objectMapper) {
        JsonNode root = readTree(json, objectMapper);
        List<String> format = readFormat(root);
        List<ContractRow> rows = new ArrayList<>();

        for (JsonNode item : root.path("response")) {
            JsonNode contract = item.path("contract");
            JsonNode ticks = item.path("ticks");
            if (contract.isMissingNode() || !ticks.isArray() || ticks.isEmpty()) {
                continue;
            }
            try {
                OptionType type = OptionType.fromString(contract.path("right").asText());
                LocalDate expiration = toDate(contract.path("expiration"));
                if (expiration == null) {
                    continue;
                }
                rows.add(new ContractRow(
                        contract.path("root").asText(),
                        expiration,
                        contract.path("strike").asDouble() / STRIKE_SCALE,
                        type,
                        toColumns(format, ticks.get(0))));
            } catch (IllegalArgumentException e) {
                log.debug("Skipping unparseable contract row {}: {}", contract, e.getMessage());
            }
        }
        return rows;
    }

    /**
     * Bars from a historical ohlc response, oldest first. The close is used as the bar price.
     */
    public static List<HistoricalBar> parseBars(String json, ObjectMapper objectMapper) {
        JsonNode root = readTree(json, objectMapper);
        List<String> format = readFormat(root);
        List<HistoricalBar> bars = new ArrayList<>();

        for (JsonNode tick : root.path("response")) {
            Map<String, Double> row = toColumns(format, tick);
            Double date = row.get("date");
            Double msOfDay = row.get("ms_of_day");
            if (date == null || msOfDay == null) {
                continue;
            }
            LocalDate day = LocalDate.parse(String.valueOf(date.longValue()), DATE_FORMAT);
            Instant timestamp = day.atStartOfDay(MARKET_ZONE).toInstant().plusMillis(msOfDay.longValue());
            bars.add(new HistoricalBar(
                    timestamp,
                    row.getOrDefault("volume", 0.0).longValue(),
                    row.getOrDefault("close", 0.0)));
        }
        bars.sort(Comparator.comparing(HistoricalBar::getTimestamp));
        return bars;
    }

    private static Map<String, Double> toColumns(List<String> format, JsonNode tick) {
        Map<String, Double> row = new HashMap<>();
        for (int i = 0; i < format.size() && i < tick.size(); i++) {
            JsonNode cell = tick.get(i);
            if (cell != null && cell.isNumber()) {
                row.put(format.get(i), cell.asDouble());
            }
        }
        return row;
    }

    private static List<String> readFormat(JsonNode root) {
        List<String> format = new ArrayList<>();
        for (JsonNode column : root.path("header").path("format")) {
            format.add(column.asText());
        }
        return format;
    }

    private static JsonNode readResponse(String json, ObjectMapper objectMapper) {
        return readTree(json, objectMapper).path("response");
    }

    private static JsonNode readTree(String json, ObjectMapper objectMapper) {
        if (objectMapper == null) {
            throw new IllegalArgumentException("ObjectMapper cannot be null");
        }
        if (json == null || json.isBlank()) {
            throw new TransientFetchException("Empty ThetaData response");
        }
        try {
            return objectMapper.readTree(json);
        } catch (Exception e) {
            throw new TransientFetchException("Malformed ThetaData response: " + e.getMessage(), e);
        }
    }

    private static LocalDate toDate(JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull()) {
            return null;
        }
        String text = node.isNumber() ? String.valueOf(node.asLong()) : node.asText();
        try {
            return LocalDate.parse(text, DATE_FORMAT);
        } catch (Exception e) {
            log.debug("Ignoring unparseable date '{}'", text);
            return null;
        }
    }
}
