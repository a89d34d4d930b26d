package com.myorg.fanout.contracts.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum SubscriptionStyle {
    REQUEST,
    WATCH,
    FOLLOW,
    ACCEPT;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static SubscriptionStyle fromWire(String value) {
        if (value == null) return null;
        return SubscriptionStyle.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
