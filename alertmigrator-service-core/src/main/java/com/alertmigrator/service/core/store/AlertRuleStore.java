package com.alertmigrator.service.core.store;

import com.alertmigrator.unified.model.AlertRule;
import java.util.List;

public interface AlertRuleStore {
    void insertAll(List<AlertRule> rules);

    List<AlertRule> findByOrg(long orgId);

    int deleteByOrg(long orgId);
}
