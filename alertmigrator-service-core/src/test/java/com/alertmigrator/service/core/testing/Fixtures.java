package com.alertmigrator.service.core.testing;

import com.alertmigrator.legacy.model.DashboardAlert;
import com.alertmigrator.legacy.model.NotificationChannel;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Duration;
import java.util.Map;

public final class Fixtures {
    public static final ObjectMapper MAPPER = new ObjectMapper();

    private Fixtures() {}

    public static JsonNode json(String json) {
        try {
            return MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(e);
        }
    }

    public static NotificationChannel channel(long orgId, long id, String uid, String name, boolean isDefault) {
        return new NotificationChannel(
                id,
                orgId,
                uid,
                name,
                "email",
                isDefault,
                false,
                json("{\"addresses\":\"ops@example.com\"}"),
                Map.of(),
                false,
                Duration.ZERO);
    }

    public static NotificationChannel reminderChannel(
            long orgId, long id, String uid, String name, boolean isDefault, Duration frequency) {
        return new NotificationChannel(
                id,
                orgId,
                uid,
                name,
                "email",
                isDefault,
                false,
                json("{\"addresses\":\"ops@example.com\"}"),
                Map.of(),
                true,
                frequency);
    }

    public static DashboardAlert alert(long orgId, long id, long dashboardId, String name, String settings) {
        return new DashboardAlert(
                id, orgId, dashboardId, id, name, "Check ${host}", "alerting", 60, Duration.ofMinutes(5), json(settings));
    }

    /** A single-condition settings document querying refId A over the last 5 minutes. */
    public static String settings(long datasourceId, String noData, String execErr, String notifications) {
        return """
                {
                  "conditions": [{
                    "type": "query",
                    "query": {"params": ["A", "5m", "now"], "datasourceId": %d, "model": {"expr": "up", "refId": "A"}},
                    "reducer": {"type": "avg", "params": []},
                    "evaluator": {"type": "gt", "params": [1]},
                    "operator": {"type": "and"}
                  }],
                  "noDataState": "%s",
                  "executionErrorState": "%s",
                  "notifications": %s,
                  "alertRuleTags": {"team": "ops"}
                }
                """
                .formatted(datasourceId, noData, execErr, notifications);
    }
}
