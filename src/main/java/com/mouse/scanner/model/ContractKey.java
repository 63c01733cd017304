package com.mouse.scanner.model;

import com.mouse.scanner.enums.OptionType;
import lombok.Value;

import java.time.LocalDate;

/**
 * Identity of a single option contract. Used as the baseline cache key and as part of the dedup key.
 */
@Value
public class ContractKey {
    String symbol;
    OptionType optionType;
    double strike;
    LocalDate expiration;

    @Override
    public String toString() {
        return symbol + " " + optionType + " " + strike + " " + expiration;
    }
}
