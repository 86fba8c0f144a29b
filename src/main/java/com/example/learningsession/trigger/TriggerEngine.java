package com.example.learningsession.trigger;

import com.example.learningsession.exception.TriggerConfigurationException;
import com.example.learningsession.model.AgentType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Decides which authored trigger points fire as playback moves.
 *
 * <p>A trigger fires once per session, the first time the position crosses its
 * timestamp going forward: {@code lastPosition < timestamp <= position}.
 * Seeking backwards does not re-arm it; only {@link #reset()} does.
 */
public class TriggerEngine {

    private static final Logger logger = LoggerFactory.getLogger(TriggerEngine.class);

    private final String videoId;
    private final List<TriggerPoint> triggers;
    private final boolean enabled;
    private final String disabledReason;
    private final Set<String> fired = new HashSet<>();
    private double lastPosition = -1d;

    private TriggerEngine(String videoId, List<TriggerPoint> triggers, boolean enabled, String disabledReason) {
        this.videoId = videoId;
        this.triggers = triggers;
        this.enabled = enabled;
        this.disabledReason = disabledReason;
    }

    /**
     * @throws TriggerConfigurationException if any trigger point is malformed
     */
    public static TriggerEngine forVideo(String videoId, List<TriggerPoint> triggers) {
        List<TriggerPoint> validated = validate(videoId, triggers == null ? List.of() : triggers);
        return new TriggerEngine(videoId, validated, true, null);
    }

    /**
     * An engine that never fires. The video still plays, without prompts.
     */
    public static TriggerEngine disabled(String videoId, String reason) {
        logger.warn("Trigger engine disabled for video {}: {}", videoId, reason);
        return new TriggerEngine(videoId, List.of(), false, reason);
    }

    private static List<TriggerPoint> validate(String videoId, List<TriggerPoint> triggers) {
        Set<String> ids = new HashSet<>();
        for (TriggerPoint t : triggers) {
            if (t == null) {
                throw new TriggerConfigurationException(videoId, "Null trigger point");
            }
            if (t.getId() == null || t.getId().isBlank()) {
                throw new TriggerConfigurationException(videoId, "Trigger point without id");
            }
            if (!ids.add(t.getId())) {
                throw new TriggerConfigurationException(videoId, "Duplicate trigger id " + t.getId());
            }
            if (Double.isNaN(t.getTimestampSeconds()) || Double.isInfinite(t.getTimestampSeconds())
                    || t.getTimestampSeconds() < 0) {
                throw new TriggerConfigurationException(videoId,
                        "Invalid timestamp " + t.getTimestampSeconds() + " for trigger " + t.getId());
            }
            if (t.getAgentType() == null) {
                throw new TriggerConfigurationException(videoId, "Missing agent type for trigger " + t.getId());
            }
            if (t.getAgentType() == AgentType.QUIZ && !hasQuestions(t.getAgentPayload())) {
                throw new TriggerConfigurationException(videoId, "Quiz trigger " + t.getId() + " has no questions");
            }
        }
        return triggers.stream()
                .sorted(Comparator.comparingDouble(TriggerPoint::getTimestampSeconds)
                        .thenComparing(TriggerPoint::getId))
                .collect(Collectors.toUnmodifiableList());
    }

    private static boolean hasQuestions(Map<String, Object> payload) {
        if (payload == null) return false;
        Object questions = payload.get("questions");
        return questions instanceof List && !((List<?>) questions).isEmpty();
    }

    /**
     * Questions of the authored quiz closest to {@code positionSeconds}, for a
     * quiz the viewer asks for by hand. Empty when the video has no quiz.
     */
    public List<?> authoredQuizQuestions(double positionSeconds) {
        return triggers.stream()
                .filter(t -> t.getAgentType() == AgentType.QUIZ)
                .min(Comparator.comparingDouble(t -> Math.abs(t.getTimestampSeconds() - positionSeconds)))
                .map(t -> (List<?>) t.getAgentPayload().get("questions"))
                .orElse(List.of());
    }

    /**
     * Moves the playback position and returns the triggers crossed going
     * forward, in timestamp order. Each trigger is returned at most once.
     */
    public List<TriggerPoint> advance(double positionSeconds) {
        double previous = lastPosition;
        lastPosition = positionSeconds;
        if (!enabled || positionSeconds <= previous) {
            return List.of();
        }
        List<TriggerPoint> crossed = new ArrayList<>();
        for (TriggerPoint t : triggers) {
            if (t.getTimestampSeconds() > previous && t.getTimestampSeconds() <= positionSeconds
                    && fired.add(t.getId())) {
                crossed.add(t);
            }
        }
        if (!crossed.isEmpty()) {
            logger.debug("Video {} crossed {} trigger(s) between {}s and {}s",
                    videoId, crossed.size(), previous, positionSeconds);
        }
        return crossed;
    }

    public void markFired(String triggerId) {
        if (triggerId != null) {
            fired.add(triggerId);
        }
    }

    public void reset() {
        fired.clear();
        lastPosition = -1d;
    }

    public void reset(String triggerId) {
        fired.remove(triggerId);
    }

    public boolean hasFired(String triggerId) {
        return fired.contains(triggerId);
    }

    public boolean isEnabled() {
        return enabled;
    }

    public String getDisabledReason() {
        return disabledReason;
    }

    public String getVideoId() {
        return videoId;
    }

    public int triggerCount() {
        return triggers.size();
    }
}
