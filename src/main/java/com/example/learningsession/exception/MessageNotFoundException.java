package com.example.learningsession.exception;

public class MessageNotFoundException extends RuntimeException {

    public MessageNotFoundException(String sessionId, String messageId) {
        super("Message " + messageId + " not found in session " + sessionId);
    }
}
