package com.alertmigrator.service.core.testing;

import com.alertmigrator.dashboard.model.Datasource;
import com.alertmigrator.service.core.store.DatasourceCache;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Predicate;

public class InMemoryDatasourceCache implements DatasourceCache {
    private final List<Datasource> datasources = new ArrayList<>();

    public InMemoryDatasourceCache add(Datasource datasource) {
        datasources.add(datasource);
        return this;
    }

    @Override
    public Optional<Datasource> getById(long orgId, long id) {
        return find(orgId, ds -> ds.id() == id);
    }

    @Override
    public Optional<Datasource> getByUid(long orgId, String uid) {
        return find(orgId, ds -> Objects.equals(ds.uid(), uid));
    }

    @Override
    public Optional<Datasource> getByName(long orgId, String name) {
        return find(orgId, ds -> Objects.equals(ds.name(), name));
    }

    private Optional<Datasource> find(long orgId, Predicate<Datasource> filter) {
        return datasources.stream()
                .filter(ds -> ds.orgId() == orgId)
                .filter(filter)
                .findFirst();
    }
}
