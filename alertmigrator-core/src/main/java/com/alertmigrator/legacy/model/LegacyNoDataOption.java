package com.alertmigrator.legacy.model;

import java.util.Optional;

/** No-data policies a legacy alert can declare. An empty value means {@link #NO_DATA}. */
public enum LegacyNoDataOption {
    OK("ok"),
    NO_DATA("no_data"),
    ALERTING("alerting"),
    KEEP_STATE("keep_state");

    private final String value;

    LegacyNoDataOption(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static Optional<LegacyNoDataOption> fromValue(String value) {
        if (value == null || value.isEmpty()) {
            return Optional.of(NO_DATA);
        }
        for (LegacyNoDataOption option : values()) {
            if (option.value.equals(value)) {
                return Optional.of(option);
            }
        }
        return Optional.empty();
    }
}
