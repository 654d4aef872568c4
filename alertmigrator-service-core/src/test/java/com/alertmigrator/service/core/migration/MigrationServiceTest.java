package com.alertmigrator.service.core.migration;

import static com.alertmigrator.service.core.support.MigrationConstants.ANY_ORG;
import static com.alertmigrator.service.core.testing.Fixtures.alert;
import static com.alertmigrator.service.core.testing.Fixtures.channel;
import static com.alertmigrator.service.core.testing.Fixtures.settings;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class MigrationServiceTest {

    @TempDir
    Path dataDir;

    private MigrationHarness h;

    @BeforeEach
    void setUp() {
        h = new MigrationHarness(dataDir);
        h.legacy.orgs.add(1L);
        h.folders.dashboard(1, 10, "dash", "Hosts", 0, false);
        h.legacy.channels.add(channel(1, 1, "mail", "Mail", true));
        h.legacy.alerts.add(alert(1, 1, 10, "CPU", settings(1, "keep_state", "ok", "[{\"uid\":\"mail\"}]")));
    }

    @Test
    void runMigratesOrgAndRecordsState() {
        MigrationRunSummary summary = h.service.run();

        assertThat(summary.enabled()).isTrue();
        assertThat(summary.migrated()).extracting(OrgMigrationSummary::orgId).containsExactly(1L);
        assertThat(h.rules.rules).hasSize(1);
        assertThat(h.service.isMigrated(1)).isTrue();
        assertThat(h.service.isMigrated(ANY_ORG)).isTrue();
        assertThat(h.service.getOrgMigrationState(1))
                .hasValueSatisfying(state -> assertThat(state.createdFolderUids()).hasSize(1));
    }

    @Test
    void migratedOrgIsSkippedUnlessForced() {
        h.service.run();

        MigrationRunSummary again = h.service.run();
        assertThat(again.skipped()).containsExactly(1L);
        assertThat(h.rules.rules).hasSize(1);

        h.properties.setForceMigration(true);
        MigrationRunSummary forced = h.service.run();

        assertThat(forced.migrated()).hasSize(1);
        assertThat(h.rules.rules).hasSize(1);
        assertThat(h.folders.folders).hasSize(1);
        assertThat(h.silences.read(1)).hasSize(1);
        assertThat(h.telemetry.snapshot().orgsMigrated()).isEqualTo(2);
        assertThat(h.telemetry.snapshot().orgsSkipped()).isEqualTo(1);
    }

    @Test
    void silencesAreWrittenAfterOrgPassCompletes() {
        MigrationRunSummary summary = h.service.run();

        assertThat(summary.migrated().get(0).silences()).isEqualTo(1);
        assertThat(h.silences.read(1)).hasSize(1);
        assertThat(h.telemetry.snapshot().silencesWritten()).isEqualTo(1);
    }

    @Test
    void failedForcedRerunLeavesPreviousSilenceFile() {
        h.service.run();
        h.legacy.alerts.add(alert(1, 9, 404, "Lost", settings(1, "keep_state", "ok", "[]")));
        h.properties.setForceMigration(true);

        assertThatThrownBy(h.service::run).isInstanceOf(MigrationException.class);

        assertThat(h.silences.read(1)).hasSize(1);
        assertThat(h.telemetry.snapshot().silencesWritten()).isEqualTo(1);
    }

    @Test
    void disabledRunOnlyClearsFlag() {
        h.service.run();
        h.properties.setEnabled(false);

        MigrationRunSummary summary = h.service.run();

        assertThat(summary).isEqualTo(MigrationRunSummary.disabled());
        assertThat(h.service.isMigrated(ANY_ORG)).isFalse();
        assertThat(h.service.isMigrated(1)).isTrue();
        assertThat(h.rules.rules).hasSize(1);
    }

    @Test
    void revertIsIdempotent() {
        h.service.run();

        OrgRevertSummary first = h.service.revertOrg(1);
        OrgRevertSummary second = h.service.revertOrg(1);

        assertThat(first).isEqualTo(new OrgRevertSummary(1, 1, 1, 1, true));
        assertThat(second).isEqualTo(new OrgRevertSummary(1, 0, 0, 0, false));
        assertThat(h.folders.folders).isEmpty();
        assertThat(h.service.isMigrated(1)).isFalse();
    }

    @Test
    void revertAllClearsGlobalFlagAndAllowsRerun() {
        h.legacy.orgs.add(2L);
        h.service.run();

        List<OrgRevertSummary> reverted = h.service.revertAllOrgs();

        assertThat(reverted).extracting(OrgRevertSummary::orgId).containsExactly(1L, 2L);
        assertThat(h.service.isMigrated(ANY_ORG)).isFalse();

        MigrationRunSummary rerun = h.service.run();
        assertThat(rerun.migrated()).hasSize(2);
        assertThat(h.rules.rules).hasSize(1);
    }

    @Test
    void failingOrgStopsRunAndStaysUnmigrated() {
        h.legacy.orgs.add(2L);
        h.legacy.alerts.add(alert(2, 7, 404, "Lost", settings(1, "ok", "ok", "[]")));

        assertThatThrownBy(h.service::run).isInstanceOf(MigrationException.class);

        assertThat(h.service.isMigrated(1)).isTrue();
        assertThat(h.service.isMigrated(2)).isFalse();
        assertThat(h.service.isMigrated(ANY_ORG)).isFalse();
        assertThat(h.telemetry.snapshot().orgsFailed()).isEqualTo(1);
    }
}
