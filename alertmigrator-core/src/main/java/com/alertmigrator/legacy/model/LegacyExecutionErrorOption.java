package com.alertmigrator.legacy.model;

import java.util.Optional;

/** Execution error policies a legacy alert can declare. An empty value means {@link #ALERTING}. */
public enum LegacyExecutionErrorOption {
    ALERTING("alerting"),
    KEEP_STATE("keep_state"),
    OK("ok");

    private final String value;

    LegacyExecutionErrorOption(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static Optional<LegacyExecutionErrorOption> fromValue(String value) {
        if (value == null || value.isEmpty()) {
            return Optional.of(ALERTING);
        }
        for (LegacyExecutionErrorOption option : values()) {
            if (option.value.equals(value)) {
                return Optional.of(option);
            }
        }
        return Optional.empty();
    }
}
