package com.mouse.scanner.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

@Value
@Builder
public class ScanCycleReport {
    long cycleId;
    Instant startedAt;
    Instant finishedAt;
    int symbolsScanned;
    int symbolsFailed;
    int contractsEvaluated;
    int evaluationFailures;
    int opportunitiesDetected;
    int duplicatesSuppressed;
    List<Long> persistedIds;
}
