package com.alertmigrator.reference;

import static com.alertmigrator.service.core.support.MigrationConstants.ANY_ORG;
import static org.assertj.core.api.Assertions.assertThat;

import com.alertmigrator.controller.admin.MigrationAdminController;
import com.alertmigrator.service.core.migration.MigrationRunSummary;
import com.alertmigrator.service.core.migration.MigrationService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest(properties = "alertmigrator.data-path=target/test-data")
@ActiveProfiles("test")
class ReferenceServiceApplicationTest {

    @Autowired
    MigrationService migrationService;

    @Autowired
    MigrationAdminController controller;

    @Test
    void contextLoadsAndRunsAgainstEmptySchema() {
        assertThat(controller).isNotNull();

        MigrationRunSummary summary = migrationService.run();

        assertThat(summary.enabled()).isTrue();
        assertThat(summary.migrated()).isEmpty();
        assertThat(migrationService.isMigrated(ANY_ORG)).isTrue();
    }
}
