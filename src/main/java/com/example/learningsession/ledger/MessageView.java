package com.example.learningsession.ledger;

public enum MessageView {
    CONVERSATION,
    ACTIVITY
}
