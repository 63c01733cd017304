package com.mouse.scanner.exception;

/**
 * Network or API failure talking to the market-data provider. Isolated to the item that triggered it.
 */
public class TransientFetchException extends RuntimeException{
    public TransientFetchException(String message) {
        super(message);
    }

    public TransientFetchException(String message, Throwable e) {
        super(message, e);
    }
}
