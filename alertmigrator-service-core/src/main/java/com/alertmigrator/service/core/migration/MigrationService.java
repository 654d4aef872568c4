package com.alertmigrator.service.core.migration;

import static com.alertmigrator.service.core.support.MigrationConstants.ANY_ORG;
import static com.alertmigrator.service.core.support.MigrationConstants.STATE_VERSION;

import com.alertmigrator.service.core.config.MigrationProperties;
import com.alertmigrator.service.core.silence.SilenceFileWriter;
import com.alertmigrator.service.core.store.AlertRuleStore;
import com.alertmigrator.service.core.store.AlertmanagerConfigStore;
import com.alertmigrator.service.core.store.DashboardFolderStore;
import com.alertmigrator.service.core.store.MigrationStateStore;
import com.alertmigrator.service.core.store.OrgStore;
import com.alertmigrator.service.core.telemetry.MigrationTelemetry;
import com.alertmigrator.service.core.telemetry.MigrationTelemetry.WarningKind;
import com.alertmigrator.unified.model.Silence;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Runs the migration over every org, honouring the per-org migrated flags, and reverts it. Each org is migrated or
 * reverted in its own transaction; the silence file is only touched after that transaction commits, so a rolled back
 * org keeps the silences of its previous migration.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MigrationService {

    private final OrgStore orgStore;
    private final OrgMigrator orgMigrator;
    private final MigrationStateStore stateStore;
    private final AlertRuleStore alertRuleStore;
    private final AlertmanagerConfigStore alertmanagerConfigStore;
    private final DashboardFolderStore dashboardFolderStore;
    private final SilenceFileWriter silenceFileWriter;
    private final MigrationProperties properties;
    private final MigrationTelemetry telemetry;
    private final TransactionTemplate txTemplate;
    private final Clock clock;

    public MigrationRunSummary run() {
        if (!properties.isEnabled()) {
            log.info("Unified alerting disabled, clearing migrated flag");
            txTemplate.executeWithoutResult(status -> stateStore.save(
                    OrgMigrationState.flag(ANY_ORG, false, STATE_VERSION, clock.instant())));
            return MigrationRunSummary.disabled();
        }

        boolean force = properties.isForceMigration();
        List<OrgMigrationSummary> migrated = new ArrayList<>();
        List<Long> skipped = new ArrayList<>();
        for (long orgId : orgStore.findAllOrgIds()) {
            boolean alreadyMigrated = stateStore.isMigrated(orgId);
            if (alreadyMigrated && !force) {
                log.debug("Org already migrated, skipping: orgId={}", orgId);
                telemetry.recordOrgSkipped(orgId);
                skipped.add(orgId);
                continue;
            }
            migrated.add(migrateOrg(orgId, alreadyMigrated));
        }

        txTemplate.executeWithoutResult(
                status -> stateStore.save(OrgMigrationState.flag(ANY_ORG, true, STATE_VERSION, clock.instant())));
        log.info("Migration run finished: migrated={} skipped={} force={}", migrated.size(), skipped.size(), force);
        return new MigrationRunSummary(true, migrated, skipped);
    }

    private OrgMigrationSummary migrateOrg(long orgId, boolean revertFirst) {
        OrgMigrationResult result;
        try {
            result = txTemplate.execute(status -> {
                if (revertFirst) {
                    log.info("Force migration: reverting org before migrating it again: orgId={}", orgId);
                    revertInTransaction(orgId);
                }
                OrgMigrationResult pass = orgMigrator.migrate(orgId);
                stateStore.save(new OrgMigrationState(
                        orgId, true, pass.summary().createdFolderUids(), STATE_VERSION, clock.instant()));
                return pass;
            });
        } catch (RuntimeException ex) {
            telemetry.recordOrgFailed(orgId);
            log.error("Org migration failed: orgId={} error={}", orgId, ex.getMessage());
            throw ex;
        }

        if (revertFirst) {
            deleteSilences(orgId);
        }
        writeSilences(orgId, result.silences());
        OrgMigrationSummary summary = result.summary();
        telemetry.recordOrgMigrated(orgId, summary.rules(), summary.receivers());
        return summary;
    }

    public OrgRevertSummary revertOrg(long orgId) {
        OrgRevertSummary summary = txTemplate.execute(status -> revertInTransaction(orgId));
        telemetry.recordOrgReverted(orgId);
        return summary.withSilencesDeleted(deleteSilences(orgId));
    }

    public List<OrgRevertSummary> revertAllOrgs() {
        List<OrgRevertSummary> summaries = new ArrayList<>();
        for (long orgId : orgStore.findAllOrgIds()) {
            summaries.add(revertOrg(orgId));
        }
        txTemplate.executeWithoutResult(
                status -> stateStore.save(OrgMigrationState.flag(ANY_ORG, false, STATE_VERSION, clock.instant())));
        log.info("All orgs reverted: orgs={}", summaries.size());
        return summaries;
    }

    public boolean isMigrated(long orgId) {
        return stateStore.isMigrated(orgId);
    }

    public Optional<OrgMigrationState> getOrgMigrationState(long orgId) {
        return stateStore.find(orgId);
    }

    private OrgRevertSummary revertInTransaction(long orgId) {
        List<String> createdFolders =
                stateStore.find(orgId).map(OrgMigrationState::createdFolderUids).orElse(List.of());

        int rules = alertRuleStore.deleteByOrg(orgId);
        int configs = alertmanagerConfigStore.delete(orgId);
        int folders = 0;
        for (String uid : createdFolders) {
            folders += dashboardFolderStore.deleteFolder(orgId, uid);
        }
        stateStore.delete(orgId);

        log.info("Org reverted: orgId={} rules={} configs={} folders={}", orgId, rules, configs, folders);
        return new OrgRevertSummary(orgId, rules, configs, folders, false);
    }

    private void writeSilences(long orgId, List<Silence> silences) {
        try {
            silenceFileWriter.write(orgId, silences);
            telemetry.recordSilencesWritten(orgId, silences.size());
        } catch (RuntimeException ex) {
            log.error("Failed to write silence file: orgId={}", orgId, ex);
            telemetry.recordWarning(WarningKind.SILENCE_FAILURE);
        }
    }

    private boolean deleteSilences(long orgId) {
        try {
            return silenceFileWriter.delete(orgId);
        } catch (RuntimeException ex) {
            log.warn("Failed to delete silence file: orgId={} error={}", orgId, ex.getMessage());
            return false;
        }
    }
}
