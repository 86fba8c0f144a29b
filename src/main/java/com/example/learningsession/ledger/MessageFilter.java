package com.example.learningsession.ledger;

import com.example.learningsession.model.LifecycleState;
import com.example.learningsession.model.Message;
import com.example.learningsession.model.MessageKind;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Set;

/**
 * Criteria for {@link MessageLedger#query(MessageFilter)}. Empty sets match everything.
 */
@Value
@Builder
public class MessageFilter {

    public static final MessageFilter ALL = MessageFilter.builder().build();

    @Singular
    Set<MessageKind> kinds;
    @Singular("state")
    Set<LifecycleState> states;
    MessageView view;

    public static MessageFilter forView(MessageView view) {
        return MessageFilter.builder().view(view).build();
    }

    public static MessageFilter ofKind(MessageKind kind) {
        return MessageFilter.builder().kind(kind).build();
    }

    boolean matches(Message message) {
        if (!kinds.isEmpty() && !kinds.contains(message.getKind())) {
            return false;
        }
        if (!states.isEmpty() && !states.contains(message.getLifecycleState())) {
            return false;
        }
        return view == null || MessageViewClassifier.belongsTo(message, view);
    }
}
