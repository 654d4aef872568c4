package com.alertmigrator.service.core.rule;

import com.alertmigrator.legacy.model.LegacyExecutionErrorOption;
import com.alertmigrator.legacy.model.LegacyNoDataOption;
import com.alertmigrator.service.core.telemetry.MigrationTelemetry;
import com.alertmigrator.service.core.telemetry.MigrationTelemetry.WarningKind;
import com.alertmigrator.unified.model.ExecutionErrorState;
import com.alertmigrator.unified.model.NoDataState;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Maps legacy no-data and execution error policies. "keep_state" has no unified counterpart: the rule raises the
 * special DatasourceNoData / DatasourceError alert instead, which the migration silences. Unknown values fall back to
 * NoData and Error with a warning.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StateTranslator {

    private final MigrationTelemetry telemetry;

    public NoDataState noData(String legacy) {
        Optional<LegacyNoDataOption> option = LegacyNoDataOption.fromValue(legacy);
        if (option.isEmpty()) {
            log.warn("Unable to translate no-data state, using default: old={} new={}", legacy, NoDataState.NO_DATA);
            telemetry.recordWarning(WarningKind.UNKNOWN_NO_DATA_STATE);
            return NoDataState.NO_DATA;
        }
        return switch (option.get()) {
            case OK -> NoDataState.OK;
            case NO_DATA, KEEP_STATE -> NoDataState.NO_DATA;
            case ALERTING -> NoDataState.ALERTING;
        };
    }

    public ExecutionErrorState execErr(String legacy) {
        Optional<LegacyExecutionErrorOption> option = LegacyExecutionErrorOption.fromValue(legacy);
        if (option.isEmpty()) {
            log.warn(
                    "Unable to translate execution error state, using default: old={} new={}",
                    legacy,
                    ExecutionErrorState.ERROR);
            telemetry.recordWarning(WarningKind.UNKNOWN_EXEC_ERROR_STATE);
            return ExecutionErrorState.ERROR;
        }
        return switch (option.get()) {
            case ALERTING -> ExecutionErrorState.ALERTING;
            case KEEP_STATE -> ExecutionErrorState.ERROR;
            case OK -> ExecutionErrorState.OK;
        };
    }
}
