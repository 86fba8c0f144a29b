package com.example.learningsession.session;

import com.example.learningsession.bridge.EventBroadcastBridge;
import com.example.learningsession.exception.TriggerConfigurationException;
import com.example.learningsession.service.ActivityResultEvaluator;
import com.example.learningsession.service.ActivityStore;
import com.example.learningsession.trigger.TriggerEngine;
import com.example.learningsession.trigger.TriggerPointSource;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

@Component
public class SessionStateMachineFactory {

    private static final Logger logger = LoggerFactory.getLogger(SessionStateMachineFactory.class);

    private final TriggerPointSource triggerPointSource;
    private final ActivityStore activityStore;
    private final ActivityResultEvaluator evaluator;
    private final EventBroadcastBridge bridge;
    private final ScheduledExecutorService countdownScheduler;

    @Value("${app.session.resume-countdown-seconds:3}")
    private int resumeCountdownSeconds = 3;

    public SessionStateMachineFactory(TriggerPointSource triggerPointSource, ActivityStore activityStore,
                                      ActivityResultEvaluator evaluator, EventBroadcastBridge bridge) {
        this.triggerPointSource = triggerPointSource;
        this.activityStore = activityStore;
        this.evaluator = evaluator;
        this.bridge = bridge;
        this.countdownScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "session-countdown-thread");
            t.setDaemon(true);
            return t;
        });
    }

    public SessionStateMachine create(String sessionId, String userId, String videoId, String courseId) {
        return new SessionStateMachine(sessionId, userId, videoId, courseId, loadTriggers(videoId),
                activityStore, evaluator, bridge, countdownScheduler, resumeCountdownSeconds);
    }

    /**
     * Bad or unreadable trigger configuration disables prompts for the video;
     * the session itself still opens.
     */
    TriggerEngine loadTriggers(String videoId) {
        try {
            TriggerEngine engine = TriggerEngine.forVideo(videoId, triggerPointSource.findByVideoId(videoId));
            logger.debug("Loaded {} trigger point(s) for video {}", engine.triggerCount(), videoId);
            return engine;
        } catch (TriggerConfigurationException e) {
            return TriggerEngine.disabled(videoId, e.getMessage());
        } catch (RuntimeException e) {
            logger.error("Could not read trigger points for video {}", videoId, e);
            return TriggerEngine.disabled(videoId, "Trigger configuration unavailable: " + e.getMessage());
        }
    }

    @PreDestroy
    public void shutdown() {
        countdownScheduler.shutdownNow();
    }
}
