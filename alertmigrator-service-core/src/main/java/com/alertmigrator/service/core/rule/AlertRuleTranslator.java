package com.alertmigrator.service.core.rule;

import static com.alertmigrator.service.core.support.MigrationConstants.ALERT_ID_ANNOTATION;
import static com.alertmigrator.service.core.support.MigrationConstants.BASE_INTERVAL_SECONDS;
import static com.alertmigrator.service.core.support.MigrationConstants.CHANNEL_LABEL_TEMPLATE;
import static com.alertmigrator.service.core.support.MigrationConstants.DASHBOARD_UID_ANNOTATION;
import static com.alertmigrator.service.core.support.MigrationConstants.MESSAGE_ANNOTATION;
import static com.alertmigrator.service.core.support.MigrationConstants.PANEL_ID_ANNOTATION;
import static com.alertmigrator.service.core.support.MigrationConstants.RULE_UID_LABEL;
import static com.alertmigrator.service.core.support.MigrationConstants.USE_LEGACY_CHANNELS_LABEL;

import com.alertmigrator.dashboard.model.Dashboard;
import com.alertmigrator.dashboard.model.Folder;
import com.alertmigrator.legacy.model.DashboardAlert;
import com.alertmigrator.legacy.model.DashboardAlertSettings;
import com.alertmigrator.legacy.model.DashboardAlertSettings.NotificationRef;
import com.alertmigrator.legacy.model.LegacyExecutionErrorOption;
import com.alertmigrator.legacy.model.LegacyNoDataOption;
import com.alertmigrator.service.core.channel.ChannelRef;
import com.alertmigrator.service.core.migration.OrgMigrationContext;
import com.alertmigrator.service.core.silence.SilenceFactory;
import com.alertmigrator.service.core.telemetry.MigrationTelemetry;
import com.alertmigrator.service.core.telemetry.MigrationTelemetry.WarningKind;
import com.alertmigrator.unified.model.AlertQuery;
import com.alertmigrator.unified.model.AlertRule;
import com.alertmigrator.unified.model.Silence;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** Converts one legacy dashboard alert into one unified rule in its own rule group. */
@Slf4j
@Component
@RequiredArgsConstructor
public class AlertRuleTranslator {

    private final ConditionTranslator conditionTranslator;
    private final QueryMigrator queryMigrator;
    private final StateTranslator stateTranslator;
    private final SilenceFactory silenceFactory;
    private final MigrationTelemetry telemetry;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public TranslatedAlert translate(OrgMigrationContext ctx, DashboardAlert alert, Dashboard dashboard, Folder folder) {
        log.debug("Migrating alert: orgId={} alertId={} name={}", alert.orgId(), alert.id(), alert.name());
        DashboardAlertSettings settings = parseSettings(alert);

        MigratedCondition condition = conditionTranslator.translate(alert.orgId(), settings);
        List<AlertQuery> data = queryMigrator.migrate(condition.data());
        List<ChannelRef> channels = channelRefs(ctx, settings);

        String uid = ctx.newRuleUid();
        Supplier<String> moreSuffixes = ctx::newRuleUid;
        String title = ctx.titleDeduplicator(folder.uid()).deduplicate(alert.name(), uid, moreSuffixes);
        if (!title.equals(alert.name())) {
            log.debug("Alert rule renamed: alertId={} old={} new={}", alert.id(), alert.name(), title);
        }

        Map<String, String> labels = new LinkedHashMap<>(settings.tags());
        labels.put(USE_LEGACY_CHANNELS_LABEL, "true");
        for (ChannelRef channel : channels) {
            labels.put(String.format(CHANNEL_LABEL_TEMPLATE, channel.value()), "true");
        }
        labels.put(RULE_UID_LABEL, uid);

        Map<String, String> annotations = new LinkedHashMap<>();
        annotations.put(DASHBOARD_UID_ANNOTATION, dashboard.uid());
        annotations.put(PANEL_ID_ANNOTATION, Long.toString(alert.panelId()));
        annotations.put(ALERT_ID_ANNOTATION, Long.toString(alert.id()));
        annotations.put(MESSAGE_ANNOTATION, MessageTemplateMigrator.migrate(alert.message()));

        AlertRule rule = new AlertRule(
                alert.orgId(),
                uid,
                title,
                condition.condition(),
                data,
                adjustInterval(alert.frequencySeconds()),
                1L,
                folder.uid(),
                dashboard.uid(),
                alert.panelId(),
                dashboard.title() + " - " + alert.panelId(),
                1,
                alert.forDuration(),
                clock.instant(),
                labels,
                annotations,
                alert.isPaused(),
                stateTranslator.noData(settings.noDataState()),
                stateTranslator.execErr(settings.executionErrorState()));

        if (LegacyExecutionErrorOption.KEEP_STATE.value().equals(settings.executionErrorState())) {
            addSilence(ctx, rule, () -> silenceFactory.error(uid), "Error");
        }
        if (LegacyNoDataOption.KEEP_STATE.value().equals(settings.noDataState())) {
            addSilence(ctx, rule, () -> silenceFactory.noData(uid), "NoData");
        }
        return new TranslatedAlert(rule, channels);
    }

    private DashboardAlertSettings parseSettings(DashboardAlert alert) {
        if (alert.settings() == null || !alert.settings().isObject()) {
            throw new IllegalArgumentException("parse settings: settings is not a JSON object");
        }
        try {
            return objectMapper.treeToValue(alert.settings(), DashboardAlertSettings.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("parse settings: " + e.getOriginalMessage(), e);
        }
    }

    private static List<ChannelRef> channelRefs(OrgMigrationContext ctx, DashboardAlertSettings settings) {
        List<ChannelRef> refs = new ArrayList<>();
        for (NotificationRef notification : settings.notifications()) {
            ChannelRef.from(notification, ctx.channels()).filter(ref -> !refs.contains(ref)).ifPresent(refs::add);
        }
        return refs;
    }

    private void addSilence(OrgMigrationContext ctx, AlertRule rule, Supplier<Silence> silence, String state) {
        try {
            ctx.addSilence(silence.get());
        } catch (RuntimeException ex) {
            log.error("Failed to create {} silence: orgId={} rule={}", state, rule.orgId(), rule.title(), ex);
            telemetry.recordWarning(WarningKind.SILENCE_FAILURE);
        }
    }

    /** Rounds the legacy frequency down to a multiple of the scheduler's base interval, never below it. */
    static long adjustInterval(long frequencySeconds) {
        if (frequencySeconds <= BASE_INTERVAL_SECONDS) {
            return BASE_INTERVAL_SECONDS;
        }
        return frequencySeconds - (frequencySeconds % BASE_INTERVAL_SECONDS);
    }
}
