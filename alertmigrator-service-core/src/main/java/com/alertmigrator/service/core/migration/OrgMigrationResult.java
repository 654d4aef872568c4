package com.alertmigrator.service.core.migration;

import com.alertmigrator.unified.model.Silence;
import java.util.List;

/** An org pass as committed, plus the silences to write once the transaction is done. */
public record OrgMigrationResult(OrgMigrationSummary summary, List<Silence> silences) {
    public OrgMigrationResult {
        silences = List.copyOf(silences);
    }
}
