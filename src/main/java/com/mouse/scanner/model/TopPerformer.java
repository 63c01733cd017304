package com.mouse.scanner.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.time.LocalDate;

@Value
@Builder
public class TopPerformer {
    int rank;
    Long opportunityId;
    String symbol;
    String optionType;
    double strike;
    LocalDate expiration;
    String alertType;
    Instant detectedAt;
    double returnPct;
}
