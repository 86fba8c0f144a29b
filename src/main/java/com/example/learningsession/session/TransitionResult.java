package com.example.learningsession.session;

import com.example.learningsession.model.Message;

import java.util.Map;

/**
 * Outcome of a requested transition. A request that would break a lifecycle
 * rule is not an error; it comes back {@link Outcome#IGNORED} with the reason.
 */
public class TransitionResult {

    public enum Outcome { APPLIED, IGNORED }

    private final Outcome outcome;
    private final Message message;
    private final String reason;

    private TransitionResult(Outcome outcome, Message message, String reason) {
        this.outcome = outcome;
        this.message = message;
        this.reason = reason;
    }

    public static TransitionResult applied(Message message) {
        return new TransitionResult(Outcome.APPLIED, message, null);
    }

    public static TransitionResult ignored(String reason) {
        return new TransitionResult(Outcome.IGNORED, null, reason);
    }

    public boolean isApplied() { return outcome == Outcome.APPLIED; }
    public Outcome getOutcome() { return outcome; }
    public Message getMessage() { return message; }
    public String getReason() { return reason; }

    public Map<String, Object> toMap() {
        return isApplied()
                ? Map.of("outcome", outcome, "message", message)
                : Map.of("outcome", outcome, "reason", reason);
    }
}
