package com.example.learningsession.ledger;

import com.example.learningsession.model.Message;
import com.example.learningsession.model.MessageKind;

/**
 * The only place that decides which view a message belongs to. The decision
 * depends on the kind alone, never on lifecycle state, so an agent prompt can
 * not leak into the conversation view after it is activated.
 */
public final class MessageViewClassifier {

    private MessageViewClassifier() {
    }

    public static MessageView viewOf(MessageKind kind) {
        if (kind == null) {
            throw new IllegalArgumentException("Message kind is required");
        }
        switch (kind) {
            case CONVERSATIONAL:
            case SYSTEM_NOTICE:
                return MessageView.CONVERSATION;
            case AGENT_PROMPT:
            case ACTIVITY_RESULT:
                return MessageView.ACTIVITY;
            default:
                throw new IllegalStateException("Unclassified message kind: " + kind);
        }
    }

    public static boolean belongsTo(Message message, MessageView view) {
        return viewOf(message.getKind()) == view;
    }
}
