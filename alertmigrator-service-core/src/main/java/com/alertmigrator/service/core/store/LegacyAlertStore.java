package com.alertmigrator.service.core.store;

import com.alertmigrator.legacy.model.DashboardAlert;
import com.alertmigrator.legacy.model.NotificationChannel;
import java.util.List;

/** Read-only access to the legacy alerting tables. */
public interface LegacyAlertStore {
    List<DashboardAlert> findAlerts(long orgId);

    List<NotificationChannel> findChannels(long orgId);
}
