package com.mouse.scanner.service;

import com.mouse.scanner.config.ScannerConfig;
import com.mouse.scanner.entity.Opportunity;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Remembers when each contract/alert-type pair was last reported, so a contract that stays anomalous
 * across cycles is reported once per window instead of every cycle.
 */
@Component
@RequiredArgsConstructor
public class OpportunityDeduplicator {

    private final ScannerConfig scannerConfig;
    private final Map<String, Instant> lastReported = new ConcurrentHashMap<>();

    public boolean isDuplicate(Opportunity opportunity, Instant now) {
        Instant previous = lastReported.get(opportunity.dedupKey());
        if (previous == null) {
            return false;
        }
        return Duration.between(previous, now).compareTo(scannerConfig.getDedupWindow()) < 0;
    }

    public void markReported(Opportunity opportunity, Instant now) {
        lastReported.put(opportunity.dedupKey(), now);
    }

    /**
     * Drops keys whose window has passed.
     * @return number of keys removed
     */
    public int evictExpired(Instant now) {
        Instant cutoff = now.minus(scannerConfig.getDedupWindow());
        int before = lastReported.size();
        lastReported.values().removeIf(reportedAt -> !reportedAt.isAfter(cutoff));
        return before - lastReported.size();
    }

    public int size() {
        return lastReported.size();
    }
}
