package com.example.learningsession.model;

/**
 * Tagged variant of a ledger message. Views are derived from the kind only,
 * see {@link com.example.learningsession.ledger.MessageViewClassifier}.
 */
public enum MessageKind {
    CONVERSATIONAL,
    AGENT_PROMPT,
    SYSTEM_NOTICE,
    ACTIVITY_RESULT
}
