package com.alertmigrator.service.core.store;

import java.time.Instant;
import java.util.Optional;

public interface AlertmanagerConfigStore {
    void save(long orgId, String configuration, String configurationVersion);

    Optional<StoredConfig> find(long orgId);

    int delete(long orgId);

    record StoredConfig(long orgId, String configuration, String configurationVersion, Instant createdAt) {}
}
