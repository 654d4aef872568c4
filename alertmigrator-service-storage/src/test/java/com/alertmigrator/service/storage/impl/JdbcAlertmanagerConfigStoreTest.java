package com.alertmigrator.service.storage.impl;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.jupiter.api.Test;

class JdbcAlertmanagerConfigStoreTest {

    private static final Instant NOW = Instant.parse("2024-05-05T12:00:00Z");

    private final H2Database db = new H2Database();
    private final JdbcAlertmanagerConfigStore store =
            new JdbcAlertmanagerConfigStore(db.jdbc, Clock.fixed(NOW, ZoneOffset.UTC));

    @Test
    void findReturnsLatestConfiguration() {
        store.save(1, "{\"first\":true}", "v1");
        store.save(1, "{\"second\":true}", "v1");

        assertThat(store.find(1)).hasValueSatisfying(config -> {
            assertThat(config.configuration()).isEqualTo("{\"second\":true}");
            assertThat(config.configurationVersion()).isEqualTo("v1");
            assertThat(config.createdAt()).isEqualTo(NOW);
        });
        assertThat(store.find(2)).isEmpty();
    }

    @Test
    void deleteRemovesEveryRowOfOrg() {
        store.save(1, "{}", "v1");
        store.save(1, "{}", "v1");
        store.save(2, "{}", "v1");

        assertThat(store.delete(1)).isEqualTo(2);
        assertThat(store.find(1)).isEmpty();
        assertThat(store.find(2)).isPresent();
    }
}
