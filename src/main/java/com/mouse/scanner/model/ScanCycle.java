package com.mouse.scanner.model;

import com.mouse.scanner.service.BaselineCache;
import lombok.Value;

import java.time.Instant;

/**
 * Per-cycle context handed to every detector: the cycle start time and the baseline cache that lives
 * exactly as long as the cycle.
 */
@Value
public class ScanCycle {
    long cycleId;
    Instant startedAt;
    BaselineCache baselines;
}
