package com.mouse.scanner.enums;

/**
 * Which price a backtest measures returns against.
 */
public enum PriceBasis {
    /** The option's own traded price. */
    OPTION,
    /** The underlying stock price. */
    UNDERLYING
}
