package com.payment.processing.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Card networks a processor actor can talk to. The wire value is used in
 * attempt keys, circuit keys and REST paths.
 */
public enum ProcessorName {
    STRIPE("stripe"),
    ADYEN("adyen");

    private final String value;

    ProcessorName(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static ProcessorName fromValue(String value) {
        if (value != null) {
            String normalized = value.trim().toLowerCase(Locale.ROOT);
            for (ProcessorName name : values()) {
                if (name.value.equals(normalized)) {
                    return name;
                }
            }
        }
        throw new IllegalArgumentException("Unknown payment processor: " + value);
    }

    @Override
    public String toString() {
        return value;
    }
}
