package com.alertmigrator.unified.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import java.util.Map;

/** The per-org alertmanager configuration document written by the migration. */
public record AlertmanagerUserConfig(
        @JsonProperty("template_files") Map<String, String> templateFiles,
        @JsonProperty("alertmanager_config") AlertingConfig alertmanagerConfig) {

    public AlertmanagerUserConfig {
        templateFiles = templateFiles == null ? Map.of() : Map.copyOf(templateFiles);
    }

    public record AlertingConfig(
            @JsonProperty("route") Route route, @JsonProperty("receivers") List<Receiver> receivers) {
        public AlertingConfig {
            receivers = receivers == null ? List.of() : List.copyOf(receivers);
        }
    }
}
