package com.fincube.fraud.model;

public enum PatternDimension {
    TEMPORAL("temporal"),
    VALUE("value"),
    NETWORK("network"),
    TOKEN("token"),
    BEHAVIORAL("behavioral");

    private final String displayName;

    PatternDimension(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }
}
