package com.alertmigrator.legacy.model;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

class DashboardAlertSettingsTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void parsesConditionsAndNotifications() throws Exception {
        DashboardAlertSettings settings = mapper.readValue(
                """
                {
                  "conditions": [{
                    "type": "query",
                    "query": {"params": ["A", "5m", "now"], "datasourceId": 3, "model": {"expr": "up"}},
                    "reducer": {"type": "avg", "params": []},
                    "evaluator": {"type": "gt", "params": [2]},
                    "operator": {"type": "and"}
                  }],
                  "notifications": [{"uid": "abc"}, {"id": 4}],
                  "alertRuleTags": {"team": "ops", "prio": 1},
                  "handler": 1
                }
                """,
                DashboardAlertSettings.class);

        assertThat(settings.conditions()).hasSize(1);
        assertThat(settings.conditions().get(0).query().params()).containsExactly("A", "5m", "now");
        assertThat(settings.conditions().get(0).query().datasourceId()).isEqualTo(3);
        assertThat(settings.notifications())
                .containsExactly(
                        new DashboardAlertSettings.NotificationRef(null, "abc"),
                        new DashboardAlertSettings.NotificationRef(4L, null));
        assertThat(settings.tags()).containsEntry("team", "ops").containsEntry("prio", "1");
        assertThat(settings.noDataState()).isEmpty();
    }

    @Test
    void nonObjectTagsAreIgnored() throws Exception {
        DashboardAlertSettings settings =
                mapper.readValue("{\"alertRuleTags\": [\"a\", \"b\"]}", DashboardAlertSettings.class);

        assertThat(settings.tags()).isEmpty();
        assertThat(settings.conditions()).isEmpty();
        assertThat(settings.notifications()).isEmpty();
    }

    @Test
    void emptyNoDataOptionMeansNoData() {
        assertThat(LegacyNoDataOption.fromValue("")).contains(LegacyNoDataOption.NO_DATA);
        assertThat(LegacyNoDataOption.fromValue("keep_state")).contains(LegacyNoDataOption.KEEP_STATE);
        assertThat(LegacyNoDataOption.fromValue("bogus")).isEmpty();
    }
}
