package com.alertmigrator.service.core.migration;

import java.util.List;

/** Outcome of one run over every org. {@code enabled=false} means nothing was migrated. */
public record MigrationRunSummary(boolean enabled, List<OrgMigrationSummary> migrated, List<Long> skipped) {
    public MigrationRunSummary {
        migrated = List.copyOf(migrated);
        skipped = List.copyOf(skipped);
    }

    public static MigrationRunSummary disabled() {
        return new MigrationRunSummary(false, List.of(), List.of());
    }
}
