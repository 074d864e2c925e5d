package com.fincube.fraud.exception;

/**
 * The reasoning oracle answered, but no decision could be parsed from the text.
 */
public class OracleMalformedResponseException extends RuntimeException {

    public OracleMalformedResponseException(String message) {
        super(message);
    }

    public OracleMalformedResponseException(String message, Throwable cause) {
        super(message, cause);
    }
}
