package com.alertmigrator.service.core.migration;

import com.alertmigrator.dashboard.model.Dashboard;
import com.alertmigrator.dashboard.model.Folder;
import com.alertmigrator.legacy.model.DashboardAlert;
import com.alertmigrator.legacy.model.NotificationChannel;
import com.alertmigrator.service.core.channel.ContactLabeler;
import com.alertmigrator.service.core.channel.OrgReceivers;
import com.alertmigrator.service.core.channel.ReceiverBuilder;
import com.alertmigrator.service.core.channel.ReceiverValidator;
import com.alertmigrator.service.core.config.MigrationProperties;
import com.alertmigrator.service.core.folder.FolderResolver;
import com.alertmigrator.service.core.rule.AlertRuleTranslator;
import com.alertmigrator.service.core.rule.TranslatedAlert;
import com.alertmigrator.service.core.store.AlertRuleStore;
import com.alertmigrator.service.core.store.AlertmanagerConfigStore;
import com.alertmigrator.service.core.store.DashboardFolderStore;
import com.alertmigrator.service.core.store.LegacyAlertStore;
import com.alertmigrator.service.core.support.MigrationConstants;
import com.alertmigrator.service.core.uid.ShortUidGenerator;
import com.alertmigrator.unified.model.AlertRule;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * One org pass: translate every legacy alert, build receivers and routes from the org's channels, label the rules for
 * routing, validate, then persist rules and the alertmanager configuration. Nothing is persisted before every alert
 * translated; the caller wraps the pass in a transaction so created folders roll back too. Silences are handed back
 * instead of written, and only go to disk after that transaction commits.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OrgMigrator {

    private final LegacyAlertStore legacyAlertStore;
    private final DashboardFolderStore dashboardFolderStore;
    private final AlertRuleStore alertRuleStore;
    private final AlertmanagerConfigStore alertmanagerConfigStore;
    private final FolderResolver folderResolver;
    private final AlertRuleTranslator alertRuleTranslator;
    private final ReceiverBuilder receiverBuilder;
    private final ContactLabeler contactLabeler;
    private final ReceiverValidator receiverValidator;
    private final ShortUidGenerator uidGenerator;
    private final MigrationProperties properties;
    private final ObjectMapper objectMapper;

    public OrgMigrationResult migrate(long orgId) {
        List<NotificationChannel> channels = legacyAlertStore.findChannels(orgId);
        List<DashboardAlert> alerts = legacyAlertStore.findAlerts(orgId);
        log.info("Migrating org: orgId={} alerts={} channels={}", orgId, alerts.size(), channels.size());

        OrgMigrationContext ctx =
                new OrgMigrationContext(orgId, properties.isCaseInsensitiveUids(), uidGenerator, channels);

        List<TranslatedAlert> translated = new ArrayList<>(alerts.size());
        for (DashboardAlert alert : alerts) {
            translated.add(migrateAlert(ctx, alert));
        }

        OrgReceivers receivers;
        try {
            receivers = receiverBuilder.build(ctx, channels);
        } catch (RuntimeException ex) {
            throw MigrationException.forOrg(orgId, "failed to create receivers: " + ex.getMessage(), ex);
        }

        List<AlertRule> rules = new ArrayList<>(translated.size());
        for (TranslatedAlert alert : translated) {
            rules.add(contactLabeler.apply(alert.rule(), alert.channels(), receivers));
        }

        try {
            receiverValidator.validate(receivers);
        } catch (RuntimeException ex) {
            throw MigrationException.forOrg(
                    orgId, "failed to validate alertmanager configuration: " + ex.getMessage(), ex);
        }

        alertRuleStore.insertAll(rules);
        alertmanagerConfigStore.save(orgId, toJson(orgId, receivers), MigrationConstants.ALERTMANAGER_CONFIG_VERSION);

        log.info(
                "Org migrated: orgId={} rules={} receivers={} silences={} createdFolders={}",
                orgId,
                rules.size(),
                receivers.receivers().size(),
                ctx.silences().size(),
                ctx.createdFolderUids().size());
        OrgMigrationSummary summary = new OrgMigrationSummary(
                orgId, rules.size(), receivers.receivers().size(), ctx.silences().size(), ctx.createdFolderUids());
        return new OrgMigrationResult(summary, ctx.silences());
    }

    private TranslatedAlert migrateAlert(OrgMigrationContext ctx, DashboardAlert alert) {
        Dashboard dashboard = dashboardFolderStore
                .findDashboard(alert.orgId(), alert.dashboardId())
                .orElseThrow(() -> new MigrationException(
                        alert.id(),
                        String.format(
                                "dashboard with ID %d under organisation %d not found",
                                alert.dashboardId(),
                                alert.orgId())));

        Folder folder;
        try {
            folder = folderResolver.resolve(ctx, dashboard);
        } catch (RuntimeException ex) {
            throw new MigrationException(alert.id(), "failed to resolve folder: " + ex.getMessage(), ex);
        }
        if (folder.uid() == null || folder.uid().isEmpty()) {
            throw new MigrationException(alert.id(), "empty folder identifier");
        }

        TranslatedAlert result;
        try {
            result = alertRuleTranslator.translate(ctx, alert, dashboard, folder);
        } catch (RuntimeException ex) {
            throw new MigrationException(
                    alert.id(),
                    String.format(
                            "failed to migrate alert rule '%s' [ID:%d, DashboardUID:%s, orgID:%d]: %s",
                            alert.name(),
                            alert.id(),
                            dashboard.uid(),
                            alert.orgId(),
                            ex.getMessage()),
                    ex);
        }

        if (!ctx.recordRuleChannels(result.rule().uid(), result.channels())) {
            throw new MigrationException(alert.id(), "duplicate generated rule UID");
        }
        return result;
    }

    private String toJson(long orgId, OrgReceivers receivers) {
        try {
            return objectMapper.writeValueAsString(receivers.toConfig());
        } catch (JsonProcessingException ex) {
            throw MigrationException.forOrg(orgId, "failed to serialize alertmanager configuration", ex);
        }
    }
}
