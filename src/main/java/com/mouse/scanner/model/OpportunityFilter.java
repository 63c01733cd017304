package com.mouse.scanner.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OpportunityFilter {
    private String symbol;
    private String alertType;
    // inclusive
    private Instant from;
    // exclusive
    private Instant to;
}
