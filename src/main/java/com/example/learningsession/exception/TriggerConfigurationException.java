package com.example.learningsession.exception;

/**
 * Authored trigger points for a video cannot be used as given.
 */
public class TriggerConfigurationException extends RuntimeException {

    private final String videoId;

    public TriggerConfigurationException(String videoId, String message) {
        super(message);
        this.videoId = videoId;
    }

    public TriggerConfigurationException(String videoId, String message, Throwable cause) {
        super(message, cause);
        this.videoId = videoId;
    }

    public String getVideoId() {
        return videoId;
    }
}
