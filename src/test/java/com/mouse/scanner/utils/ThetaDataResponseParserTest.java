package com.mouse.scanner.utils;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mouse.scanner.enums.OptionType;
import com.mouse.scanner.exception.TransientFetchException;
import com.mouse.scanner.model.HistoricalBar;
import com.mouse.scanner.utils.ThetaDataResponseParser.ContractRow;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ThetaDataResponseParserTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void parseExpirations_sortsAndSkipsGarbage() {
        String json = "{\"header\":{},\"response\":[20240322, \"bad\", 20240315]}";

        List<LocalDate> expirations = ThetaDataResponseParser.parseExpirations(json, objectMapper);

        assertThat(expirations).containsExactly(LocalDate.of(2024, 3, 15), LocalDate.of(2024, 3, 22));
    }

    @Test
    void parseBulkSnapshot_mapsColumnsByHeaderFormat() {
        String json = """
                {"header": {"format": ["volume", "close"]},
                 "response": [
                   {"ticks": [[700, 3.4]], "contract": {"root": "NVDA", "expiration": 20240419, "strike": 900500, "right": "P"}},
                   {"ticks": [], "contract": {"root": "NVDA", "expiration": 20240419, "strike": 905000, "right": "P"}},
                   {"ticks": [[1, 1.0]], "contract": {"root": "NVDA", "expiration": 20240419, "strike": 910000, "right": "X"}}
                 ]}
                """;

        List<ContractRow> rows = ThetaDataResponseParser.parseBulkSnapshot(json, objectMapper);

        assertThat(rows).hasSize(1);
        ContractRow row = rows.get(0);
        assertThat(row.getStrike()).isEqualTo(900.5);
        assertThat(row.getOptionType()).isEqualTo(OptionType.PUT);
        assertThat(row.value("volume")).isEqualTo(700.0);
        assertThat(row.value("close")).isEqualTo(3.4);
        assertThat(row.value("missing")).isZero();
        assertThat(row.key()).isEqualTo("NVDA|2024-04-19|900.5|P");
    }

    @Test
    void parseBars_convertsMarketTimeToInstantAndSorts() {
        String json = """
                {"header": {"format": ["ms_of_day", "close", "volume", "date"]},
                 "response": [[57540000, 1.5, 10, 20240105], [34200000, 1.2, 40, 20240105]]}
                """;

        List<HistoricalBar> bars = ThetaDataResponseParser.parseBars(json, objectMapper);

        // January is standard time, UTC-5
        assertThat(bars).extracting(HistoricalBar::getTimestamp).containsExactly(
                Instant.parse("2024-01-05T14:30:00Z"), Instant.parse("2024-01-05T20:59:00Z"));
        assertThat(bars.get(0).getVolume()).isEqualTo(40);
    }

    @Test
    void parse_emptyBody_isTransient() {
        assertThatThrownBy(() -> ThetaDataResponseParser.parseBars("", objectMapper))
                .isInstanceOf(TransientFetchException.class);
    }
}
