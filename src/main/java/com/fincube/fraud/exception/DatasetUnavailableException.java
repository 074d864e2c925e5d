package com.fincube.fraud.exception;

/**
 * A remote reference dataset could not be downloaded.
 */
public class DatasetUnavailableException extends RuntimeException {

    public DatasetUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
