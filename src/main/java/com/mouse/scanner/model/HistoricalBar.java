package com.mouse.scanner.model;

import lombok.Value;

import java.time.Instant;

@Value
public class HistoricalBar {
    Instant timestamp;
    long volume;
    double price;
}
