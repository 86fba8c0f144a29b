package com.example.learningsession.model;

/**
 * Kinds of system-initiated activities that can interrupt playback.
 */
public enum AgentType {
    QUIZ("Do you want to be quizzed about what you've learned?"),
    REFLECTION("Would you like to reflect on what you've learned?"),
    CHECKPOINT("Let's check in on your progress before moving on."),
    HINT("Do you want a hint about what's happening at this timestamp?"),
    PATH("Want a personalized learning path based on your progress?");

    private final String defaultPrompt;

    AgentType(String defaultPrompt) {
        this.defaultPrompt = defaultPrompt;
    }

    public String getDefaultPrompt() {
        return defaultPrompt;
    }

    public static AgentType parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Agent type is required");
        }
        String normalized = value.trim().toUpperCase();
        // authored configs use the short names from the player UI
        if ("REFLECT".equals(normalized)) {
            return REFLECTION;
        }
        return AgentType.valueOf(normalized);
    }
}
