package com.fincube.fraud.exception;

/**
 * The scoring pools are saturated and cannot accept another request stage.
 * Clients may retry later.
 */
public class ScoringCapacityException extends RuntimeException {

    public ScoringCapacityException(String message, Throwable cause) {
        super(message, cause);
    }
}
