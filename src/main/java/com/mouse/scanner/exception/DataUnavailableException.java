package com.mouse.scanner.exception;

/**
 * The market-data provider answered, but has no data for the request
 * (no bars in range, no chain for the symbol). Never fatal.
 */
public class DataUnavailableException extends RuntimeException{
    public DataUnavailableException(String message) {
        super(message);
    }

    public DataUnavailableException(String message, Throwable e) {
        super(message, e);
    }
}
