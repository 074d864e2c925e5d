package com.fincube.fraud.exception;

/**
 * The reasoning oracle could not be reached, failed, or timed out.
 * The only failure the oracle call is retried on.
 */
public class OracleTransportException extends RuntimeException {

    public OracleTransportException(String message) {
        super(message);
    }

    public OracleTransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
