package com.alertmigrator.unified.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/** A contact point: a named bundle of notifiers. */
public record Receiver(
        @JsonProperty("name") String name,
        @JsonProperty("grafana_managed_receiver_configs") List<IntegrationConfig> integrations) {

    public Receiver {
        integrations = integrations == null ? List.of() : List.copyOf(integrations);
    }
}
