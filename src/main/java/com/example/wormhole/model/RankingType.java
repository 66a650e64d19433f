package com.example.wormhole.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Bilibili ranked lists scanned for new candidates.
 */
public enum RankingType {
    /** 入站必刷 */
    MUST_WATCH("must-watch"),
    HOT("hot"),
    /** 百大UP主 */
    TOP_100("top-100");

    private final String value;

    RankingType(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }
}
