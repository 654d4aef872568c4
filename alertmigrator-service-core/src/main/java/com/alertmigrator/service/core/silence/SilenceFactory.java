package com.alertmigrator.service.core.silence;

import static com.alertmigrator.service.core.support.MigrationConstants.ALERT_NAME_LABEL;
import static com.alertmigrator.service.core.support.MigrationConstants.ERROR_ALERT_NAME;
import static com.alertmigrator.service.core.support.MigrationConstants.NO_DATA_ALERT_NAME;
import static com.alertmigrator.service.core.support.MigrationConstants.RULE_UID_LABEL;
import static com.alertmigrator.service.core.support.MigrationConstants.SILENCE_CREATED_BY;

import com.alertmigrator.unified.model.MatchType;
import com.alertmigrator.unified.model.ObjectMatcher;
import com.alertmigrator.unified.model.Silence;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Silences for rules whose legacy policy was "keep last state". The unified rule raises DatasourceNoData or
 * DatasourceError instead, which is muted for a year.
 */
@Component
@RequiredArgsConstructor
public class SilenceFactory {

    private final Clock clock;

    public Silence noData(String ruleUid) {
        return silence(ruleUid, NO_DATA_ALERT_NAME, "NoData");
    }

    public Silence error(String ruleUid) {
        return silence(ruleUid, ERROR_ALERT_NAME, "Error");
    }

    private Silence silence(String ruleUid, String alertName, String state) {
        if (ruleUid == null || ruleUid.isEmpty()) {
            throw new IllegalArgumentException("rule UID is required for a silence");
        }
        Instant now = clock.instant();
        Instant end = now.plus(365, ChronoUnit.DAYS);
        return new Silence(
                UUID.randomUUID().toString(),
                List.of(
                        new ObjectMatcher(ALERT_NAME_LABEL, MatchType.EQUAL, alertName),
                        new ObjectMatcher(RULE_UID_LABEL, MatchType.EQUAL, ruleUid)),
                now,
                end,
                SILENCE_CREATED_BY,
                "Created during migration to unified alerting to silence " + state
                        + " state when the legacy option was 'Keep Last State'",
                end);
    }
}
