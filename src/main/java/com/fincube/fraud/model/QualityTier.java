package com.fincube.fraud.model;

public enum QualityTier {
    LOW,
    MEDIUM,
    HIGH;

    public static QualityTier fromScore(double score) {
        if (score > 0.7) return HIGH;
        if (score > 0.4) return MEDIUM;
        return LOW;
    }
}
