package com.alertmigrator.service.core.telemetry;

import static org.assertj.core.api.Assertions.assertThat;

import com.alertmigrator.service.core.telemetry.MigrationTelemetry.WarningKind;
import java.util.Map;
import org.junit.jupiter.api.Test;

class MigrationTelemetryRegistryTest {

    @Test
    void snapshotSumsCountersAndWarnings() {
        MigrationTelemetryRegistry registry = new MigrationTelemetryRegistry();

        registry.recordOrgMigrated(1, 3, 2);
        registry.recordOrgMigrated(2, 1, 1);
        registry.recordOrgSkipped(3);
        registry.recordOrgFailed(4);
        registry.recordSilencesWritten(1, 0);
        registry.recordSilencesWritten(2, 2);
        registry.recordWarning(WarningKind.DISCONTINUED_CHANNEL);
        registry.recordWarning(WarningKind.DISCONTINUED_CHANNEL);

        MigrationTelemetryRegistry.Snapshot snapshot = registry.snapshot();
        assertThat(snapshot.orgsMigrated()).isEqualTo(2);
        assertThat(snapshot.rulesMigrated()).isEqualTo(4);
        assertThat(snapshot.receiversMigrated()).isEqualTo(3);
        assertThat(snapshot.orgsSkipped()).isEqualTo(1);
        assertThat(snapshot.orgsFailed()).isEqualTo(1);
        assertThat(snapshot.orgsReverted()).isZero();
        assertThat(snapshot.silencesWritten()).isEqualTo(2);
        assertThat(snapshot.warnings()).containsOnly(Map.entry(WarningKind.DISCONTINUED_CHANNEL, 2L));
    }
}
