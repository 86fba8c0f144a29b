package com.example.learningsession.session;

import com.example.learningsession.exception.SessionNotFoundException;
import com.example.learningsession.model.ViewingSession;
import com.example.learningsession.repo.ViewingSessionRepo;
import com.example.learningsession.service.ActivityStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Holds the one {@link SessionStateMachine} of every open session. Callers get
 * the machine from here and pass it on; nothing else keeps a reference.
 */
@Service
public class SessionRegistry {

    private static final Logger logger = LoggerFactory.getLogger(SessionRegistry.class);

    private final SessionStateMachineFactory factory;
    private final ActivityStore activityStore;
    private final ViewingSessionRepo viewingSessionRepo;
    private final Map<String, SessionStateMachine> sessions = new ConcurrentHashMap<>();

    @Value("${app.session.idle-timeout:PT30M}")
    private Duration idleTimeout = Duration.ofMinutes(30);

    public SessionRegistry(SessionStateMachineFactory factory, ActivityStore activityStore,
                           ViewingSessionRepo viewingSessionRepo) {
        this.factory = factory;
        this.activityStore = activityStore;
        this.viewingSessionRepo = viewingSessionRepo;
    }

    /**
     * Opens a session, or returns the open one with the same id. A new machine
     * is rehydrated from the session's stored activity records.
     */
    public SessionStateMachine open(String sessionId, String userId, String videoId, String courseId) {
        if (videoId == null || videoId.isBlank() || courseId == null || courseId.isBlank()) {
            throw new IllegalArgumentException("videoId and courseId are required");
        }
        String id = sessionId == null || sessionId.isBlank() ? UUID.randomUUID().toString() : sessionId;
        SessionStateMachine existing = sessions.get(id);
        if (existing != null) {
            if (!existing.getVideoId().equals(videoId) || !existing.getCourseId().equals(courseId)) {
                throw new IllegalArgumentException("Session " + id + " is open for another video");
            }
            logger.debug("Reattaching to open session {}", id);
            return existing;
        }

        SessionStateMachine created = sessions.computeIfAbsent(id, k -> {
            SessionStateMachine machine = factory.create(k, userId, videoId, courseId);
            machine.rehydrate(activityStore.findBySession(k));
            return machine;
        });
        recordOpened(created);
        logger.info("Opened session {} for user {} on video {} (course {})", id, userId, videoId, courseId);
        return created;
    }

    public SessionStateMachine get(String sessionId) {
        return find(sessionId).orElseThrow(() -> new SessionNotFoundException(sessionId));
    }

    public Optional<SessionStateMachine> find(String sessionId) {
        return sessionId == null ? Optional.empty() : Optional.ofNullable(sessions.get(sessionId));
    }

    public SessionContext close(String sessionId) {
        SessionStateMachine machine = sessions.remove(sessionId);
        if (machine == null) {
            throw new SessionNotFoundException(sessionId);
        }
        machine.close();
        recordClosed(machine);
        return machine.getContext();
    }

    public int activeSessionCount() {
        return sessions.size();
    }

    /**
     * Closes sessions with no activity and no observers for longer than the idle timeout.
     */
    @Scheduled(fixedDelayString = "${app.session.eviction-interval-ms:60000}", initialDelay = 60000L)
    public void evictIdleSessions() {
        Instant cutoff = Instant.now().minus(idleTimeout);
        for (SessionStateMachine machine : List.copyOf(sessions.values())) {
            if (machine.isIdleSince(cutoff) && machine.getContext().getObserverCount() == 0
                    && sessions.remove(machine.getSessionId(), machine)) {
                logger.info("Evicting idle session {}", machine.getSessionId());
                machine.close();
                recordClosed(machine);
            }
        }
    }

    private void recordOpened(SessionStateMachine machine) {
        try {
            Instant now = Instant.now();
            viewingSessionRepo.save(ViewingSession.builder()
                    .sessionId(machine.getSessionId())
                    .userId(machine.getUserId())
                    .videoId(machine.getVideoId())
                    .courseId(machine.getCourseId())
                    .status("OPEN")
                    .startedAt(now)
                    .lastActivityAt(now)
                    .build());
        } catch (RuntimeException e) {
            logger.warn("Could not record opening of session {}: {}", machine.getSessionId(), e.getMessage());
        }
    }

    private void recordClosed(SessionStateMachine machine) {
        try {
            Instant now = Instant.now();
            ViewingSession record = viewingSessionRepo.findById(machine.getSessionId())
                    .orElseGet(() -> ViewingSession.builder()
                            .sessionId(machine.getSessionId())
                            .userId(machine.getUserId())
                            .videoId(machine.getVideoId())
                            .courseId(machine.getCourseId())
                            .build());
            record.setStatus("CLOSED");
            record.setLastActivityAt(now);
            record.setClosedAt(now);
            record.setActivityCount((int) activityStore.countBySession(machine.getSessionId()));
            viewingSessionRepo.save(record);
        } catch (RuntimeException e) {
            logger.warn("Could not record closing of session {}: {}", machine.getSessionId(), e.getMessage());
        }
    }
}
