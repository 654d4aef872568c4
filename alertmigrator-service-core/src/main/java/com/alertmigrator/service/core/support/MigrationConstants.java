package com.alertmigrator.service.core.support;

import java.time.Duration;

public final class MigrationConstants {
    private MigrationConstants() {}

    /** Org id under which the global migrated flag is kept. */
    public static final long ANY_ORG = 0L;

    public static final String STATE_VERSION = "1";
    public static final String ALERTMANAGER_CONFIG_VERSION = "v1";

    // Labels
    public static final String CONTACT_LABEL = "__contacts__";
    public static final String CHANNEL_LABEL_TEMPLATE = "__contacts_%s__";
    public static final String USE_LEGACY_CHANNELS_LABEL = "__legacy_use_channels__";
    public static final String RULE_UID_LABEL = "__alert_rule_uid__";
    public static final String ALERT_NAME_LABEL = "alertname";
    public static final String FOLDER_TITLE_LABEL = "grafana_folder";

    // Annotations
    public static final String DASHBOARD_UID_ANNOTATION = "__dashboardUid__";
    public static final String PANEL_ID_ANNOTATION = "__panelId__";
    public static final String ALERT_ID_ANNOTATION = "__alertId__";
    public static final String MESSAGE_ANNOTATION = "message";

    // Rules
    public static final int MAX_TITLE_LENGTH = 190;
    public static final long BASE_INTERVAL_SECONDS = 10L;

    // Folders
    public static final String DASHBOARD_FOLDER_TEMPLATE = "%s Alerts - %s";
    public static final int MAX_FOLDER_NAME_LENGTH = 255;
    public static final String GENERAL_FOLDER_TITLE = "General Alerting";
    /** Marker stored as creator of folders made by the migration. */
    public static final long FOLDER_CREATED_BY = -8L;

    // Receivers
    public static final String DEFAULT_RECEIVER_NAME = "autogen-contact-point-default";
    /** Pseudo-disabled repeat interval for channels without reminders (1 year of 52 weeks). */
    public static final Duration DISABLED_REPEAT_INTERVAL = Duration.ofHours(8736);

    // Silences
    public static final String NO_DATA_ALERT_NAME = "DatasourceNoData";
    public static final String ERROR_ALERT_NAME = "DatasourceError";
    public static final String SILENCE_CREATED_BY = "Grafana Migration";
}
