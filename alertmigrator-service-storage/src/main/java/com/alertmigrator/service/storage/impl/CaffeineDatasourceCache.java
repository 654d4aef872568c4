package com.alertmigrator.service.storage.impl;

import com.alertmigrator.dashboard.model.Datasource;
import com.alertmigrator.service.core.config.MigrationProperties;
import com.alertmigrator.service.core.store.DatasourceCache;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import jakarta.annotation.PostConstruct;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

/**
 * Datasource lookups keyed by org plus id, uid or name. Misses are cached too, so a dashboard referencing a deleted
 * datasource costs one query per run.
 */
@Repository
@RequiredArgsConstructor
@Slf4j
public class CaffeineDatasourceCache implements DatasourceCache {

    private static final RowMapper<Datasource> DATASOURCE = (rs, i) -> new Datasource(
            rs.getLong("id"), rs.getLong("org_id"), rs.getString("uid"), rs.getString("name"), rs.getString("type"));

    private final NamedParameterJdbcTemplate jdbc;
    private final MigrationProperties properties;

    private Cache<String, Optional<Datasource>> byKey;

    @PostConstruct
    public void init() {
        MigrationProperties.DatasourceCacheConfig config = properties.getDatasourceCache();
        byKey = Caffeine.newBuilder()
                .maximumSize(config.getMaximumSize())
                .expireAfterWrite(config.getTtl())
                .recordStats()
                .build();
        log.info(
                "Initialized datasource cache size={} ttl={}.", config.getMaximumSize(), config.getTtl());
    }

    @Override
    public Optional<Datasource> getById(long orgId, long id) {
        return byKey.get(orgId + "/id/" + id, k -> lookup("id = :value", orgId, id));
    }

    @Override
    public Optional<Datasource> getByUid(long orgId, String uid) {
        return byKey.get(orgId + "/uid/" + uid, k -> lookup("uid = :value", orgId, uid));
    }

    @Override
    public Optional<Datasource> getByName(long orgId, String name) {
        return byKey.get(orgId + "/name/" + name, k -> lookup("name = :value", orgId, name));
    }

    void invalidateAll() {
        byKey.invalidateAll();
    }

    private Optional<Datasource> lookup(String predicate, long orgId, Object value) {
        return jdbc
                .query(
                        "select id, org_id, uid, name, type from data_source where org_id = :org and " + predicate,
                        new MapSqlParameterSource().addValue("org", orgId).addValue("value", value),
                        DATASOURCE)
                .stream()
                .findFirst();
    }
}
