package com.fincube.fraud.model;

/**
 * Format of a remote reference dataset.
 */
public enum ReferenceSourceType {
    CSV_URL,
    JSON_URL
}
