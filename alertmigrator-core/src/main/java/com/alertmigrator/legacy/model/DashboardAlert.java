package com.alertmigrator.legacy.model;

import com.fasterxml.jackson.databind.JsonNode;
import java.time.Duration;

/** A legacy alert embedded in a dashboard panel. Read-only input of the migration. */
public record DashboardAlert(
        long id,
        long orgId,
        long dashboardId,
        long panelId,
        String name,
        String message,
        String state, // normal | paused | alerting | ...
        long frequencySeconds,
        Duration forDuration,
        JsonNode settings) {

    public static final String STATE_PAUSED = "paused";

    public DashboardAlert {
        forDuration = forDuration == null ? Duration.ZERO : forDuration;
    }

    public boolean isPaused() {
        return STATE_PAUSED.equals(state);
    }
}
