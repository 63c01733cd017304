package com.mouse.scanner.model;

import com.mouse.scanner.enums.OptionType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;
import java.time.LocalDate;

/**
 * One contract of an option chain as returned by the market-data client. Read-only for a scan cycle.
 */
@Getter
@ToString
@AllArgsConstructor
@Builder(toBuilder = true)
public class OptionSnapshot {

    /** Shares per contract. */
    public static final int CONTRACT_MULTIPLIER = 100;

    private final String symbol;
    private final String optionSymbol;
    private final OptionType optionType;
    private final double strike;
    private final LocalDate expiration;

    private final double lastPrice;
    private final double midPrice;
    private final long volume;
    private final long openInterest;
    private final double underlyingPrice;

    // null when the provider sent no greeks for the contract
    private final Greeks greeks;

    private final Instant timestamp;

    /**
     * Last traded price, falling back to the mid quote when the contract has not traded.
     */
    public double getPrice() {
        return lastPrice > 0 ? lastPrice : midPrice;
    }

    public double getNotionalValue() {
        return getPrice() * volume * CONTRACT_MULTIPLIER;
    }

    public ContractKey contractKey() {
        return new ContractKey(symbol, optionType, strike, expiration);
    }
}
