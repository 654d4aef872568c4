package com.alertmigrator.service.core.store;

import com.alertmigrator.dashboard.model.Datasource;
import java.util.Optional;

public interface DatasourceCache {
    Optional<Datasource> getById(long orgId, long id);

    Optional<Datasource> getByUid(long orgId, String uid);

    Optional<Datasource> getByName(long orgId, String name);
}
