package com.mouse.scanner.model;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HorizonTest {

    @Test
    void parse_acceptsMinutesHoursAndBareNumbers() {
        assertThat(Horizon.parse("15m")).isEqualTo(Horizon.ofMinutes(15));
        assertThat(Horizon.parse("15")).isEqualTo(Horizon.ofMinutes(15));
        assertThat(Horizon.parse(" 5M ").getLabel()).isEqualTo("5m");
        assertThat(Horizon.parse("1h").getDuration()).isEqualTo(Duration.ofHours(1));
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "0m", "-5", "abc", "h"})
    void parse_invalid_throwsIllegalArgument(String text) {
        assertThatThrownBy(() -> Horizon.parse(text)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void compareTo_ordersByDuration() {
        assertThat(Horizon.ofMinutes(20)).isGreaterThan(Horizon.ofMinutes(5));
        assertThat(Horizon.parse("1h")).isGreaterThan(Horizon.ofMinutes(20));
    }

    @Test
    void baselineVolume_zeroAverage_isUnknown() {
        assertThat(BaselineVolume.of(0.0, 10)).isSameAs(BaselineVolume.UNKNOWN);
        assertThat(BaselineVolume.of(100.0, 0)).isSameAs(BaselineVolume.UNKNOWN);
        assertThat(BaselineVolume.UNKNOWN.ratio(500)).isNull();
        assertThat(BaselineVolume.of(100.0, 3).ratio(500)).isEqualTo(5.0);
    }
}
