package com.example.wormhole.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * How a mapping was confirmed.
 */
public enum VerifiedBy {
    AUTO("auto"),
    MANUAL("manual");

    private final String value;

    VerifiedBy(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }
}
