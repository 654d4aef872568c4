package com.alertmigrator.service.storage.impl;

import static org.assertj.core.api.Assertions.assertThat;

import com.alertmigrator.dashboard.model.Datasource;
import com.alertmigrator.service.core.config.MigrationProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;

class CaffeineDatasourceCacheTest {

    private final H2Database db = new H2Database();
    private final CaffeineDatasourceCache cache = new CaffeineDatasourceCache(db.jdbc, new MigrationProperties());

    @BeforeEach
    void init() {
        cache.init();
    }

    @Test
    void looksUpByIdUidAndName() {
        long id = db.datasource(1, "prom", "Prometheus", "prometheus");

        Datasource expected = new Datasource(id, 1, "prom", "Prometheus", "prometheus");
        assertThat(cache.getById(1, id)).contains(expected);
        assertThat(cache.getByUid(1, "prom")).contains(expected);
        assertThat(cache.getByName(1, "Prometheus")).contains(expected);
        assertThat(cache.getByUid(2, "prom")).isEmpty();
    }

    @Test
    void servesCachedValuesUntilInvalidated() {
        long id = db.datasource(1, "graphite", "Graphite", "graphite");
        assertThat(cache.getById(1, id)).isPresent();
        assertThat(cache.getByName(1, "Loki")).isEmpty();

        db.jdbc.update("delete from data_source", new MapSqlParameterSource());
        db.datasource(1, "loki", "Loki", "loki");

        assertThat(cache.getById(1, id)).isPresent();
        assertThat(cache.getByName(1, "Loki")).isEmpty();

        cache.invalidateAll();

        assertThat(cache.getById(1, id)).isEmpty();
        assertThat(cache.getByName(1, "Loki")).map(Datasource::uid).contains("loki");
    }
}
