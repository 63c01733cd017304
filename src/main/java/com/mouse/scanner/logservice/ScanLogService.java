package com.mouse.scanner.logservice;

import com.mouse.scanner.entity.Opportunity;
import com.mouse.scanner.model.ScanCycleReport;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Central place for scanner event logging. Also keeps running counters for the status endpoint.
 */
@Slf4j
@Service
public class ScanLogService {

    private final Map<String, AtomicLong> counters = new ConcurrentHashMap<>();

    public void logOpportunity(Opportunity opportunity) {
        log.info("OPPORTUNITY | type={} contract={} price={} volume={} notional={} ratio={} unusual={} probability={}",
                opportunity.getAlertType(), opportunity.contractKey(), opportunity.getPrice(),
                opportunity.getVolume(), opportunity.getNotionalValue(), opportunity.getVolumeRatio(),
                opportunity.isUnusualVolume(), opportunity.getSuccessProbability());
        increment("opportunity.detected.count");
    }

    public void logPersisted(Opportunity opportunity) {
        log.debug("OPPORTUNITY SAVED | id={} key={}", opportunity.getId(), opportunity.dedupKey());
        increment("opportunity.persisted.count");
    }

    public void logDuplicate(Opportunity opportunity) {
        log.debug("DUPLICATE SUPPRESSED | key={}", opportunity.dedupKey());
        increment("opportunity.duplicate.count");
    }

    public void logNoData(String what, String reason) {
        log.info("NO DATA | {} | {}", what, reason);
        increment("data.unavailable.count");
    }

    public void logCycleSkipped(long cycleId) {
        log.warn("Scan cycle {} skipped: previous cycle still running", cycleId);
        increment("cycle.skipped.count");
    }

    public void logCycle(ScanCycleReport report) {
        log.info("SCAN CYCLE {} | symbols={} failedSymbols={} contracts={} evalFailures={} detected={} duplicates={} saved={}",
                report.getCycleId(), report.getSymbolsScanned(), report.getSymbolsFailed(),
                report.getContractsEvaluated(), report.getEvaluationFailures(), report.getOpportunitiesDetected(),
                report.getDuplicatesSuppressed(), report.getPersistedIds().size());
        increment("cycle.completed.count");
    }

    public void logError(String message, Throwable t) {
        log.error(message, t);
        increment("error.count");
    }

    public void logWarn(String message, Throwable t) {
        log.warn("{}: {}", message, t.toString());
        increment("warning.count");
    }

    public void increment(String counter) {
        counters.computeIfAbsent(counter, k -> new AtomicLong()).incrementAndGet();
    }

    public long getCount(String counter) {
        AtomicLong value = counters.get(counter);
        return value == null ? 0 : value.get();
    }

    public Map<String, Long> snapshot() {
        Map<String, Long> copy = new TreeMap<>();
        counters.forEach((k, v) -> copy.put(k, v.get()));
        return copy;
    }
}
