package com.alertmigrator.service.core.secrets;

public class SecretsException extends RuntimeException {
    public SecretsException(String message, Throwable cause) {
        super(message, cause);
    }
}
