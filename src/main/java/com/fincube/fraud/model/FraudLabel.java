package com.fincube.fraud.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum FraudLabel {
    FRAUD("Fraud"),
    NOT_FRAUD("Not_Fraud"),
    UNDECIDED("Undecided");

    private final String wireName;

    FraudLabel(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    /**
     * Lenient parse of oracle output: accepts Fraud, Not_Fraud, NotFraud, "not fraud"
     * in any case. Returns null for anything else.
     */
    public static FraudLabel fromText(String text) {
        if (text == null) return null;
        String key = text.trim().toLowerCase().replace("_", "").replace("-", "").replace(" ", "");
        switch (key) {
            case "fraud":
                return FRAUD;
            case "notfraud":
                return NOT_FRAUD;
            case "undecided":
                return UNDECIDED;
            default:
                return null;
        }
    }
}
