package com.alertmigrator.unified.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.Map;

/** A single notifier inside a receiver (a "grafana managed receiver config"). */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record IntegrationConfig(
        @JsonProperty("uid") String uid,
        @JsonProperty("name") String name,
        @JsonProperty("type") String type,
        @JsonProperty("disableResolveMessage") boolean disableResolveMessage,
        @JsonProperty("settings") JsonNode settings,
        @JsonProperty("secureSettings") Map<String, String> secureSettings) {

    public IntegrationConfig {
        secureSettings = secureSettings == null ? Map.of() : Map.copyOf(secureSettings);
    }

    public IntegrationConfig withName(String newName) {
        return new IntegrationConfig(uid, newName, type, disableResolveMessage, settings, secureSettings);
    }
}
