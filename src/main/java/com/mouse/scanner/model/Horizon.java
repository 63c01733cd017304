package com.mouse.scanner.model;

import lombok.Value;

import java.time.Duration;
import java.util.Locale;

/**
 * A forward offset from detection, labelled the way reports show it ("5m", "1h").
 */
@Value
public class Horizon implements Comparable<Horizon> {
    String label;
    Duration duration;

    public static Horizon ofMinutes(long minutes) {
        if (minutes <= 0) {
            throw new IllegalArgumentException("Horizon must be positive: " + minutes);
        }
        return new Horizon(minutes + "m", Duration.ofMinutes(minutes));
    }

    /**
     * Parses "15m", "1h" or a bare minute count such as "15".
     */
    public static Horizon parse(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Horizon cannot be empty");
        }
        String value = text.trim().toLowerCase(Locale.ROOT);
        try {
            if (value.endsWith("h")) {
                long hours = Long.parseLong(value.substring(0, value.length() - 1));
                if (hours <= 0) {
                    throw new IllegalArgumentException("Horizon must be positive: " + text);
                }
                return new Horizon(hours + "h", Duration.ofHours(hours));
            }
            if (value.endsWith("m")) {
                value = value.substring(0, value.length() - 1);
            }
            return ofMinutes(Long.parseLong(value));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid horizon: " + text, e);
        }
    }

    @Override
    public int compareTo(Horizon other) {
        return duration.compareTo(other.duration);
    }

    @Override
    public String toString() {
        return label;
    }
}
