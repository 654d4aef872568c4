package com.alertmigrator.service.core.rule;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class MessageTemplateMigratorTest {

    @Test
    void plainMessagesAreUnchanged() {
        assertThat(MessageTemplateMigrator.migrate("Disk is full")).isEqualTo("Disk is full");
        assertThat(MessageTemplateMigrator.migrate("")).isEmpty();
        assertThat(MessageTemplateMigrator.migrate(null)).isEmpty();
    }

    @Test
    void variablesBecomeMergedLabelReferences() {
        assertThat(MessageTemplateMigrator.migrate("Host ${instance} on ${job-name} is down"))
                .isEqualTo(MessageTemplateMigrator.MERGED_LABELS_PREFIX
                        + "Host {{$mergedLabels.instance}} on {{index $mergedLabels \"job-name\"}} is down");
    }

    @Test
    void dollarSignsInReplacementAreLiteral() {
        assertThat(MessageTemplateMigrator.migrate("costs $5 at ${site}"))
                .endsWith("costs $5 at {{$mergedLabels.site}}");
    }
}
