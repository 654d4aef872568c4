package com.alertmigrator.service.core.migration;

import com.alertmigrator.service.core.channel.ReceiverValidationException;
import com.alertmigrator.service.core.secrets.SecretsException;
import com.alertmigrator.service.core.uid.UidGenerationException;

/**
 * A failure that aborts an org's migration. Carries the legacy alert id when one alert caused it; org-wide failures
 * (receiver building, validation, persistence) carry only the org.
 */
public class MigrationException extends RuntimeException {
    private final Long alertId;
    private final Long orgId;

    public MigrationException(long alertId, String message) {
        this(alertId, message, null);
    }

    public MigrationException(long alertId, String message, Throwable cause) {
        this(alertId, null, String.format("failed to migrate alert %d: %s", alertId, message), cause);
    }

    private MigrationException(Long alertId, Long orgId, String message, Throwable cause) {
        super(message, cause);
        this.alertId = alertId;
        this.orgId = orgId;
    }

    public static MigrationException forOrg(long orgId, String message, Throwable cause) {
        return new MigrationException(null, orgId, String.format("failed to migrate org %d: %s", orgId, message), cause);
    }

    /** @return the legacy alert id, or {@code null} for org-wide failures */
    public Long getAlertId() {
        return alertId;
    }

    /** @return the org of an org-wide failure, or {@code null} when the failure names an alert */
    public Long getOrgId() {
        return orgId;
    }

    /**
     * Whether the failure came from the migration's own machinery (UID exhaustion, secrets) rather than from the legacy
     * data it was given. A receiver that failed validation is a data problem even when its cause is a secrets error.
     */
    public boolean isSystemFailure() {
        for (Throwable cause = getCause(); cause != null && cause != this; cause = cause.getCause()) {
            if (cause instanceof ReceiverValidationException) {
                return false;
            }
            if (cause instanceof UidGenerationException || cause instanceof SecretsException) {
                return true;
            }
        }
        return false;
    }
}
