package com.mouse.scanner.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class Greeks {
    double impliedVolatility;
    double delta;
    double gamma;
    double theta;
    double vega;
}
