package com.alertmigrator.controller.admin;

import com.alertmigrator.service.core.channel.ReceiverValidationException;
import com.alertmigrator.service.core.migration.MigrationException;
import com.alertmigrator.service.core.migration.init.MigrationInProgressException;
import com.alertmigrator.service.core.secrets.SecretsException;
import com.alertmigrator.service.core.uid.UidGenerationException;
import java.time.Instant;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.context.request.ServletWebRequest;
import org.springframework.web.context.request.WebRequest;

/** Maps migration failures to consistent JSON payloads. */
@ControllerAdvice
public class RestErrorHandler {

    @ExceptionHandler(MigrationInProgressException.class)
    public ResponseEntity<ErrorPayload> handleConflict(MigrationInProgressException ex, WebRequest request) {
        return build(HttpStatus.CONFLICT, ex.getMessage(), request);
    }

    /** Bad legacy data is 422; an org that failed on UID exhaustion or secrets is a server error. */
    @ExceptionHandler(MigrationException.class)
    public ResponseEntity<ErrorPayload> handleMigrationFailure(MigrationException ex, WebRequest request) {
        HttpStatus status = ex.isSystemFailure() ? HttpStatus.INTERNAL_SERVER_ERROR : HttpStatus.UNPROCESSABLE_ENTITY;
        return build(status, ex.getMessage(), request);
    }

    @ExceptionHandler(ReceiverValidationException.class)
    public ResponseEntity<ErrorPayload> handleInvalidReceiver(ReceiverValidationException ex, WebRequest request) {
        return build(HttpStatus.UNPROCESSABLE_ENTITY, ex.getMessage(), request);
    }

    // UidGenerationException extends IllegalStateException and must not map to 400
    @ExceptionHandler({UidGenerationException.class, SecretsException.class})
    public ResponseEntity<ErrorPayload> handleInternal(RuntimeException ex, WebRequest request) {
        return build(HttpStatus.INTERNAL_SERVER_ERROR, ex.getMessage(), request);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorPayload> handleBadRequest(RuntimeException ex, WebRequest request) {
        return build(HttpStatus.BAD_REQUEST, ex.getMessage(), request);
    }

    private ResponseEntity<ErrorPayload> build(HttpStatus status, String message, WebRequest request) {
        String path = null;
        if (request instanceof ServletWebRequest servletRequest) {
            path = servletRequest.getRequest().getRequestURI();
        }
        ErrorPayload body = new ErrorPayload(Instant.now(), status.value(), status.getReasonPhrase(), message, path);
        return ResponseEntity.status(status).body(body);
    }
}
