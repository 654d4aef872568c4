package com.alertmigrator.legacy.model;

import com.fasterxml.jackson.databind.JsonNode;
import java.time.Duration;
import java.util.Map;

/**
 * A legacy notification channel row. Read-only input of the migration.
 *
 * <p>{@code secureSettings} holds base64 encoded ciphertexts keyed by setting name. {@code uid} may be empty or
 * collide with another channel's UID.
 */
public record NotificationChannel(
        long id,
        long orgId,
        String uid,
        String name,
        String type,
        boolean isDefault,
        boolean disableResolveMessage,
        JsonNode settings,
        Map<String, String> secureSettings,
        boolean sendReminder,
        Duration frequency) {

    public NotificationChannel {
        secureSettings = secureSettings == null ? Map.of() : Map.copyOf(secureSettings);
        frequency = frequency == null ? Duration.ZERO : frequency;
    }

    public boolean hasUid() {
        return uid != null && !uid.isEmpty();
    }
}
