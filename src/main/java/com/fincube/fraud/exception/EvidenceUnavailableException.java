package com.fincube.fraud.exception;

/**
 * No reference population is available to score against: either no scaler has
 * been fitted yet or the similarity index returned no neighbors.
 */
public class EvidenceUnavailableException extends RuntimeException {

    public EvidenceUnavailableException(String message) {
        super(message);
    }
}
