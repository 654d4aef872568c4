package com.alertmigrator.unified.model;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** A unified alert rule produced from exactly one legacy dashboard alert. */
public record AlertRule(
        long orgId,
        String uid,
        String title,
        String condition,
        List<AlertQuery> data,
        long intervalSeconds,
        long version,
        String namespaceUid,
        String dashboardUid,
        Long panelId,
        String ruleGroup,
        int ruleGroupIndex,
        Duration forDuration,
        Instant updated,
        Map<String, String> labels,
        Map<String, String> annotations,
        boolean paused,
        NoDataState noDataState,
        ExecutionErrorState execErrState) {

    public AlertRule {
        data = data == null ? List.of() : List.copyOf(data);
        labels = labels == null ? Map.of() : Map.copyOf(labels);
        annotations = annotations == null ? Map.of() : Map.copyOf(annotations);
        forDuration = forDuration == null ? Duration.ZERO : forDuration;
    }

    public AlertRule withLabel(String name, String value) {
        Map<String, String> merged = new LinkedHashMap<>(labels);
        merged.put(name, value);
        return new AlertRule(
                orgId,
                uid,
                title,
                condition,
                data,
                intervalSeconds,
                version,
                namespaceUid,
                dashboardUid,
                panelId,
                ruleGroup,
                ruleGroupIndex,
                forDuration,
                updated,
                merged,
                annotations,
                paused,
                noDataState,
                execErrState);
    }
}
