package com.alertmigrator.service.core.migration;

import java.util.List;

public record OrgMigrationSummary(
        long orgId, int rules, int receivers, int silences, List<String> createdFolderUids) {
    public OrgMigrationSummary {
        createdFolderUids = List.copyOf(createdFolderUids);
    }
}
