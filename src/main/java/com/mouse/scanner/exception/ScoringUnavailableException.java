package com.mouse.scanner.exception;

/**
 * The scoring collaborator could not produce a score. The opportunity is still emitted, unscored.
 */
public class ScoringUnavailableException extends RuntimeException{
    public ScoringUnavailableException(String message) {
        super(message);
    }

    public ScoringUnavailableException(String message, Throwable e) {
        super(message, e);
    }
}
