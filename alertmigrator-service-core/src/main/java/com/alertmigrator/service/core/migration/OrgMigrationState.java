package com.alertmigrator.service.core.migration;

import java.time.Instant;
import java.util.List;

/** What a migration recorded for one org, enough to revert it. */
public record OrgMigrationState(
        long orgId, boolean migrated, List<String> createdFolderUids, String version, Instant updatedAt) {

    public OrgMigrationState {
        createdFolderUids = createdFolderUids == null ? List.of() : List.copyOf(createdFolderUids);
    }

    public static OrgMigrationState flag(long orgId, boolean migrated, String version, Instant now) {
        return new OrgMigrationState(orgId, migrated, List.of(), version, now);
    }
}
