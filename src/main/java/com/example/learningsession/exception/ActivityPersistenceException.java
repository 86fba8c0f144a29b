package com.example.learningsession.exception;

/**
 * An activity record could not be stored. The prompt stays active; when
 * {@link #isRetryable()} the user may submit again.
 */
public class ActivityPersistenceException extends RuntimeException {

    private final String messageId;
    private final boolean retryable;

    public ActivityPersistenceException(String messageId, String reason, boolean retryable) {
        super(reason);
        this.messageId = messageId;
        this.retryable = retryable;
    }

    public String getMessageId() {
        return messageId;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
