package com.alertmigrator.service.core.channel;

/** A migrated integration whose settings the target notifier would reject. */
public class ReceiverValidationException extends RuntimeException {
    private final String receiver;
    private final String integrationType;

    public ReceiverValidationException(String receiver, String integrationType, String message) {
        this(receiver, integrationType, message, null);
    }

    public ReceiverValidationException(String receiver, String integrationType, String message, Throwable cause) {
        super("invalid integration " + integrationType + " in receiver '" + receiver + "': " + message, cause);
        this.receiver = receiver;
        this.integrationType = integrationType;
    }

    public String getReceiver() {
        return receiver;
    }

    public String getIntegrationType() {
        return integrationType;
    }
}
