package com.alertmigrator.service.core.store;

import com.alertmigrator.service.core.migration.OrgMigrationState;
import java.util.Optional;

/** Per-org migration bookkeeping. Org {@code 0} carries the global migrated flag. */
public interface MigrationStateStore {
    Optional<OrgMigrationState> find(long orgId);

    void save(OrgMigrationState state);

    void delete(long orgId);

    default boolean isMigrated(long orgId) {
        return find(orgId).map(OrgMigrationState::migrated).orElse(false);
    }
}
