package com.mouse.scanner.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ScoreResult {
    double successProbability;
    String confidence;
    String reasoning;
}
