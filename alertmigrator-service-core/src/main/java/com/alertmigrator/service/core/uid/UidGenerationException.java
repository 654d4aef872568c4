package com.alertmigrator.service.core.uid;

public class UidGenerationException extends IllegalStateException {
    public UidGenerationException(int attempts) {
        super("failed to generate UID after " + attempts + " attempts");
    }
}
