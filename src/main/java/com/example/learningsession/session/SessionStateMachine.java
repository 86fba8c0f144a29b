package com.example.learningsession.session;

import com.example.learningsession.bridge.BridgeEvent;
import com.example.learningsession.bridge.BridgeEventType;
import com.example.learningsession.bridge.EventBroadcastBridge;
import com.example.learningsession.bridge.SessionObserver;
import com.example.learningsession.exception.ActivityPersistenceException;
import com.example.learningsession.exception.InvalidResponseException;
import com.example.learningsession.exception.MessageNotFoundException;
import com.example.learningsession.ledger.LedgerEntry;
import com.example.learningsession.ledger.MessageFilter;
import com.example.learningsession.ledger.MessageLedger;
import com.example.learningsession.model.*;
import com.example.learningsession.service.ActivityResultEvaluator;
import com.example.learningsession.service.ActivityStore;
import com.example.learningsession.service.ActivityStore.PersistResult;
import com.example.learningsession.trigger.TriggerEngine;
import com.example.learningsession.trigger.TriggerPoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.*;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Coordinator of one viewing session: owns its ledger, its trigger engine and
 * the playback suspension flag.
 *
 * <p>Every public operation runs under the instance lock, so the transitions of
 * one session are applied one at a time. The only work done outside the lock is
 * the activity store insert of {@link #onUserResponse}; a dismiss can land while
 * it runs, in which case its result is discarded.
 *
 * <p>At most one agent prompt is {@code ACTIVATED}. Prompts that fire while one
 * is active wait as {@code UNACTIVATED} and are activated in order.
 */
public class SessionStateMachine {

    private static final Logger logger = LoggerFactory.getLogger(SessionStateMachine.class);

    private final Object lock = new Object();

    private final String sessionId;
    private final String userId;
    private final String videoId;
    private final String courseId;
    private final MessageLedger ledger;
    private final TriggerEngine triggerEngine;
    private final ActivityStore activityStore;
    private final ActivityResultEvaluator evaluator;
    private final EventBroadcastBridge bridge;
    private final ScheduledExecutorService scheduler;
    private final int resumeCountdownSeconds;

    private final Deque<String> pendingPrompts = new ArrayDeque<>();
    private String activeMessageId;
    private boolean playbackSuspended;
    private double positionSeconds;
    private String inFlightToken;
    private ScheduledFuture<?> resumeCountdown;
    private long logicalClock;
    private Instant lastActivityAt = Instant.now();
    private boolean closed;

    public SessionStateMachine(String sessionId, String userId, String videoId, String courseId,
                               TriggerEngine triggerEngine, ActivityStore activityStore,
                               ActivityResultEvaluator evaluator, EventBroadcastBridge bridge,
                               ScheduledExecutorService scheduler, int resumeCountdownSeconds) {
        this.sessionId = Objects.requireNonNull(sessionId, "sessionId");
        this.userId = userId;
        this.videoId = Objects.requireNonNull(videoId, "videoId");
        this.courseId = Objects.requireNonNull(courseId, "courseId");
        this.ledger = new MessageLedger(sessionId);
        this.triggerEngine = triggerEngine;
        this.activityStore = activityStore;
        this.evaluator = evaluator;
        this.bridge = bridge;
        this.scheduler = scheduler;
        this.resumeCountdownSeconds = Math.max(resumeCountdownSeconds, 0);
    }

    /**
     * Moves the playback position. Triggers crossed going forward become agent
     * prompts; the first is activated and the rest queue behind it. While
     * playback is suspended the engine is not advanced, so crossings are
     * picked up by the first update after resume.
     *
     * @return the prompts created by this update
     */
    public List<Message> onTimeUpdate(double position) {
        requireValidPosition(position);
        synchronized (lock) {
            if (closed) {
                logger.debug("Ignoring time update for closed session {}", sessionId);
                return List.of();
            }
            touch();
            positionSeconds = position;
            if (playbackSuspended) {
                logger.debug("Session {} suspended, deferring trigger evaluation at {}s", sessionId, position);
                return List.of();
            }
            List<TriggerPoint> crossed = triggerEngine.advance(position);
            if (crossed.isEmpty()) {
                return List.of();
            }
            List<Message> prompts = new ArrayList<>();
            for (TriggerPoint trigger : crossed) {
                Message prompt = newPrompt(trigger.getAgentType(), trigger.getAgentPayload(),
                        trigger.getTimestampSeconds(), trigger.getId());
                appendAndPublish(prompt);
                pendingPrompts.addLast(prompt.getId());
                prompts.add(prompt);
            }
            logger.info("Session {} fired {} prompt(s) at {}s", sessionId, prompts.size(), position);
            activateNextPending();
            return prompts;
        }
    }

    /**
     * A user-initiated prompt ("quiz me"). Refused while another prompt is
     * active; no message is created in that case. A quiz asked for without
     * questions takes those of the nearest authored quiz.
     *
     * @throws InvalidResponseException if a quiz
     *         has no questions and the video has no authored quiz to borrow from
     */
    public TransitionResult requestAgent(AgentType agentType, Map<String, Object> payload) {
        Objects.requireNonNull(agentType, "agentType");
        synchronized (lock) {
            if (closed) {
                return TransitionResult.ignored("Session is closed");
            }
            touch();
            if (activeMessageId != null) {
                logger.warn("Session {} refused manual {} request, prompt {} is active",
                        sessionId, agentType, activeMessageId);
                return TransitionResult.ignored("Another prompt is active: " + activeMessageId);
            }
            Map<String, Object> promptPayload = agentType == AgentType.QUIZ ? quizPayload(payload) : payload;
            Message prompt = newPrompt(agentType, promptPayload, positionSeconds, null);
            appendAndPublish(prompt);
            pendingPrompts.addFirst(prompt.getId());
            activateNextPending();
            return TransitionResult.applied(ledger.find(prompt.getId()).orElse(prompt));
        }
    }

    /**
     * Manual pause: records the position and offers a hint about it.
     */
    public TransitionResult onManualPause(double position) {
        requireValidPosition(position);
        synchronized (lock) {
            positionSeconds = position;
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("positionSeconds", position);
        payload.put("manual", true);
        return requestAgent(AgentType.HINT, payload);
    }

    /**
     * Completes the active prompt with the user's submission. The prompt becomes
     * {@code PERMANENT} only once the activity store has confirmed the record.
     *
     * @throws MessageNotFoundException if the message is not in this session
     * @throws InvalidResponseException if the submission is invalid
     * @throws ActivityPersistenceException if the record could not be stored; the prompt stays active
     */
    public TransitionResult onUserResponse(String messageId, Map<String, Object> response) {
        String token;
        ActivityRecord record;
        synchronized (lock) {
            Message prompt = requireMessage(messageId);
            if (closed) {
                return TransitionResult.ignored("Session is closed");
            }
            touch();
            if (!prompt.isAgentPrompt() || prompt.getLifecycleState() != LifecycleState.ACTIVATED) {
                logger.warn("Session {} ignored response to {} {} in state {}",
                        sessionId, prompt.getKind(), messageId, prompt.getLifecycleState());
                return TransitionResult.ignored("Message " + messageId + " is not an active prompt");
            }
            if (inFlightToken != null) {
                logger.warn("Session {} ignored response to {}, a submission is already being stored", sessionId, messageId);
                return TransitionResult.ignored("A submission for " + messageId + " is already in progress");
            }
            Map<String, Object> result = evaluator.evaluate(prompt.getAgentType(), prompt.getPayload(), response);
            record = ActivityRecord.builder()
                    .id(UUID.randomUUID().toString())
                    .sessionId(sessionId)
                    .userId(userId)
                    .videoId(videoId)
                    .courseId(courseId)
                    .messageId(messageId)
                    .triggerId(prompt.getTriggerId())
                    .activityType(prompt.getAgentType())
                    .triggerTimestampSeconds(prompt.getVideoPositionSeconds() != null ? prompt.getVideoPositionSeconds() : positionSeconds)
                    .resultPayload(result)
                    .createdAt(Instant.now())
                    .build();
            token = UUID.randomUUID().toString();
            inFlightToken = token;
        }

        PersistResult persisted = activityStore.persistActivity(record);

        boolean rejected;
        synchronized (lock) {
            Message prompt = requireMessage(messageId);
            if (!closed && token.equals(inFlightToken) && prompt.getLifecycleState() == LifecycleState.ACTIVATED) {
                inFlightToken = null;
                if (!persisted.isSuccess()) {
                    logger.error("Session {} could not store activity for {}: {}", sessionId, messageId, persisted.getReason());
                    throw new ActivityPersistenceException(messageId, persisted.getReason(), persisted.isRetryable());
                }
                record.setId(persisted.getId());
                return TransitionResult.applied(complete(prompt, record));
            }
            rejected = prompt.getLifecycleState() == LifecycleState.REJECTED;
        }
        // a stored record must not outlive a rejected prompt; one stored as the session closed is kept for rehydrate
        if (persisted.isSuccess() && rejected) {
            logger.info("Session {} discarding stored activity {} for {} which was dismissed meanwhile",
                    sessionId, persisted.getId(), messageId);
            activityStore.discardActivity(persisted.getId());
        } else {
            logger.debug("Session {} dropped store result for {} which was resolved meanwhile", sessionId, messageId);
        }
        return TransitionResult.ignored("Prompt " + messageId + " was resolved while its activity was being stored");
    }

    /**
     * User declined or abandoned the active prompt. No activity record is made
     * and playback resumes at once.
     */
    public TransitionResult onUserDismiss(String messageId) {
        synchronized (lock) {
            Message prompt = requireMessage(messageId);
            if (closed) {
                return TransitionResult.ignored("Session is closed");
            }
            touch();
            if (!prompt.isAgentPrompt() || prompt.getLifecycleState() != LifecycleState.ACTIVATED) {
                logger.warn("Session {} ignored dismiss of {} {} in state {}",
                        sessionId, prompt.getKind(), messageId, prompt.getLifecycleState());
                return TransitionResult.ignored("Message " + messageId + " is not an active prompt");
            }
            if (inFlightToken != null) {
                logger.info("Session {} dismissed {} while its activity was being stored", sessionId, messageId);
                inFlightToken = null;
            }
            LedgerEntry entry = ledger.recordTransition(messageId, LifecycleState.REJECTED);
            publishTransition(entry);
            activeMessageId = null;
            playbackSuspended = false;
            publish(BridgeEventType.PLAYBACK_RESUMED, Map.of("messageId", messageId, "positionSeconds", positionSeconds));
            logger.info("Session {} prompt {} rejected", sessionId, messageId);
            activateNextPending();
            return TransitionResult.applied(entry.getMessage());
        }
    }

    public Message appendConversation(String role, String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Message text is required");
        }
        synchronized (lock) {
            if (closed) {
                throw new IllegalStateException("Session " + sessionId + " is closed");
            }
            touch();
            Message message = Message.builder()
                    .id(UUID.randomUUID().toString())
                    .sessionId(sessionId)
                    .kind(MessageKind.CONVERSATIONAL)
                    .lifecycleState(LifecycleState.PERMANENT)
                    .originTimestamp(nextOrigin())
                    .videoPositionSeconds(positionSeconds)
                    .text(text)
                    .payloadEntry("role", role == null || role.isBlank() ? "user" : role)
                    .build();
            appendAndPublish(message);
            return message;
        }
    }

    /**
     * Replays stored activity records into a fresh ledger and marks their
     * triggers fired, so a reconnecting viewer is not asked again.
     *
     * @return number of records replayed
     */
    public int rehydrate(List<ActivityRecord> records) {
        synchronized (lock) {
            int replayed = 0;
            List<ActivityRecord> ordered = new ArrayList<>(records);
            ordered.sort(Comparator.comparing(ActivityRecord::getCreatedAt, Comparator.nullsFirst(Comparator.naturalOrder())));
            for (ActivityRecord record : ordered) {
                String resultId = resultMessageId(record.getId());
                if (ledger.find(resultId).isPresent()) {
                    continue;
                }
                ledger.append(resultMessage(resultId, record));
                triggerEngine.markFired(record.getTriggerId());
                replayed++;
            }
            if (replayed > 0) {
                logger.info("Session {} rehydrated {} activity record(s)", sessionId, replayed);
            }
            return replayed;
        }
    }

    /**
     * Subscribes {@code observer} and returns the ledger up to that point.
     */
    public SessionAttachment attach(SessionObserver observer) {
        synchronized (lock) {
            touch();
            return new SessionAttachment(contextLocked(), ledger.entriesAfter(0),
                    bridge.subscribe(sessionId, observer));
        }
    }

    public List<Message> query(MessageFilter filter) {
        synchronized (lock) {
            return ledger.query(filter);
        }
    }

    public List<LedgerEntry> entriesAfter(long sequenceNumber) {
        synchronized (lock) {
            return ledger.entriesAfter(sequenceNumber);
        }
    }

    public Optional<Message> findMessage(String messageId) {
        synchronized (lock) {
            return ledger.find(messageId);
        }
    }

    public SessionContext getContext() {
        synchronized (lock) {
            return contextLocked();
        }
    }

    public boolean isIdleSince(Instant cutoff) {
        synchronized (lock) {
            return lastActivityAt.isBefore(cutoff);
        }
    }

    public boolean isClosed() {
        synchronized (lock) {
            return closed;
        }
    }

    /**
     * Ends the session: pending countdowns are cancelled and every observer is
     * detached after a {@code SESSION_CLOSED} event.
     */
    public void close() {
        synchronized (lock) {
            if (closed) {
                return;
            }
            cancelCountdown();
            publish(BridgeEventType.SESSION_CLOSED, Map.of("messageCount", ledger.messageCount()));
            closed = true;
            inFlightToken = null;
            bridge.unsubscribeAll(sessionId);
            logger.info("Session {} closed with {} message(s)", sessionId, ledger.messageCount());
        }
    }

    public String getSessionId() { return sessionId; }
    public String getUserId() { return userId; }
    public String getVideoId() { return videoId; }
    public String getCourseId() { return courseId; }

    // ---- under lock ----

    private Message complete(Message prompt, ActivityRecord record) {
        LedgerEntry entry = ledger.recordTransition(prompt.getId(), LifecycleState.PERMANENT);
        publishTransition(entry);
        activeMessageId = null;
        playbackSuspended = false;

        appendAndPublish(resultMessage(resultMessageId(record.getId()), record));

        Map<String, Object> completed = new LinkedHashMap<>();
        completed.put("recordId", record.getId());
        completed.put("messageId", prompt.getId());
        completed.put("videoId", videoId);
        completed.put("courseId", courseId);
        completed.put("activityType", record.getActivityType().name());
        completed.put("triggerTimestampSeconds", record.getTriggerTimestampSeconds());
        bridge.publish(BridgeEvent.builder()
                .operationId("activity:" + record.getId())
                .sessionId(sessionId)
                .type(BridgeEventType.ACTIVITY_COMPLETED)
                .payload(completed)
                .build());

        if (resumeCountdownSeconds > 0) {
            appendAndPublish(notice("Video continues in " + resumeCountdownSeconds + "..."));
        }
        scheduleResume(prompt.getId());
        logger.info("Session {} prompt {} completed as activity {}", sessionId, prompt.getId(), record.getId());
        activateNextPending();
        return entry.getMessage();
    }

    private Map<String, Object> quizPayload(Map<String, Object> requested) {
        Object questions = requested == null ? null : requested.get("questions");
        if (questions instanceof List && !((List<?>) questions).isEmpty()) {
            return requested;
        }
        List<?> authored = triggerEngine.authoredQuizQuestions(positionSeconds);
        if (authored.isEmpty()) {
            logger.warn("Session {} refused manual quiz, video {} has no authored questions", sessionId, videoId);
            throw new InvalidResponseException("Quiz request requires questions and video " + videoId + " has none");
        }
        Map<String, Object> payload = requested == null ? new LinkedHashMap<>() : new LinkedHashMap<>(requested);
        payload.put("questions", authored);
        return payload;
    }

    private void activateNextPending() {
        if (activeMessageId != null || pendingPrompts.isEmpty()) {
            return;
        }
        String next = pendingPrompts.pollFirst();
        LedgerEntry entry = ledger.recordTransition(next, LifecycleState.ACTIVATED);
        activeMessageId = next;
        playbackSuspended = true;
        cancelCountdown();
        publishTransition(entry);

        Double at = entry.getMessage().getVideoPositionSeconds();
        double pausedAt = at != null ? at : positionSeconds;
        appendAndPublish(notice("Paused at " + formatPosition(pausedAt)));
        publish(BridgeEventType.PLAYBACK_SUSPENDED, Map.of(
                "messageId", next,
                "agentType", entry.getMessage().getAgentType().name(),
                "positionSeconds", pausedAt));
        logger.debug("Session {} activated prompt {}", sessionId, next);
    }

    private void scheduleResume(String messageId) {
        if (resumeCountdownSeconds == 0) {
            publish(BridgeEventType.PLAYBACK_RESUMED, Map.of("messageId", messageId, "positionSeconds", positionSeconds));
            return;
        }
        publish(BridgeEventType.PLAYBACK_RESUME_SCHEDULED, Map.of("messageId", messageId, "seconds", resumeCountdownSeconds));
        resumeCountdown = scheduler.schedule(() -> resumeAfterCountdown(messageId),
                resumeCountdownSeconds, TimeUnit.SECONDS);
    }

    private void resumeAfterCountdown(String messageId) {
        synchronized (lock) {
            resumeCountdown = null;
            if (closed || playbackSuspended) {
                return;
            }
            publish(BridgeEventType.PLAYBACK_RESUMED, Map.of("messageId", messageId, "positionSeconds", positionSeconds));
        }
    }

    private void cancelCountdown() {
        if (resumeCountdown != null) {
            resumeCountdown.cancel(false);
            resumeCountdown = null;
        }
    }

    private Message newPrompt(AgentType agentType, Map<String, Object> payload, double position, String triggerId) {
        return Message.builder()
                .id(UUID.randomUUID().toString())
                .sessionId(sessionId)
                .kind(MessageKind.AGENT_PROMPT)
                .lifecycleState(LifecycleState.UNACTIVATED)
                .originTimestamp(nextOrigin())
                .videoPositionSeconds(position)
                .agentType(agentType)
                .triggerId(triggerId)
                .text(agentType.getDefaultPrompt())
                .payload(payload == null ? Map.of() : payload)
                .build();
    }

    private Message notice(String text) {
        return Message.builder()
                .id(UUID.randomUUID().toString())
                .sessionId(sessionId)
                .kind(MessageKind.SYSTEM_NOTICE)
                .lifecycleState(LifecycleState.PERMANENT)
                .originTimestamp(nextOrigin())
                .text(text)
                .build();
    }

    private Message resultMessage(String id, ActivityRecord record) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("recordId", record.getId());
        payload.put("promptMessageId", record.getMessageId());
        payload.put("result", record.getResultPayload() == null ? Map.of() : record.getResultPayload());
        return Message.builder()
                .id(id)
                .sessionId(sessionId)
                .kind(MessageKind.ACTIVITY_RESULT)
                .lifecycleState(LifecycleState.PERMANENT)
                .originTimestamp(nextOrigin())
                .videoPositionSeconds(record.getTriggerTimestampSeconds())
                .agentType(record.getActivityType())
                .triggerId(record.getTriggerId())
                .payload(payload)
                .build();
    }

    private static String resultMessageId(String recordId) {
        return "result:" + recordId;
    }

    private void appendAndPublish(Message message) {
        long sequence = ledger.append(message);
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("sequenceNumber", sequence);
        payload.put("message", message);
        publishSequenced(BridgeEventType.MESSAGE_APPENDED, sequence, payload);
    }

    private void publishTransition(LedgerEntry entry) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("sequenceNumber", entry.getSequenceNumber());
        payload.put("message", entry.getMessage());
        publishSequenced(BridgeEventType.MESSAGE_TRANSITIONED, entry.getSequenceNumber(), payload);
    }

    private void publishSequenced(BridgeEventType type, long sequence, Map<String, Object> payload) {
        bridge.publish(BridgeEvent.builder()
                .operationId(sessionId + ":seq:" + sequence)
                .sessionId(sessionId)
                .type(type)
                .payload(payload)
                .build());
    }

    private void publish(BridgeEventType type, Map<String, Object> payload) {
        bridge.publish(BridgeEvent.builder()
                .operationId(sessionId + ":" + type.name().toLowerCase() + ":" + UUID.randomUUID())
                .sessionId(sessionId)
                .type(type)
                .payload(payload)
                .build());
    }

    private Message requireMessage(String messageId) {
        return ledger.find(messageId).orElseThrow(() -> new MessageNotFoundException(sessionId, messageId));
    }

    private OriginTimestamp nextOrigin() {
        return OriginTimestamp.of(++logicalClock, Instant.now());
    }

    private void touch() {
        lastActivityAt = Instant.now();
    }

    private SessionContext contextLocked() {
        return SessionContext.builder()
                .sessionId(sessionId)
                .userId(userId)
                .videoId(videoId)
                .courseId(courseId)
                .activeAgentMessageId(activeMessageId)
                .playbackSuspended(playbackSuspended)
                .positionSeconds(positionSeconds)
                .observerCount(bridge.observerCount(sessionId))
                .triggersEnabled(triggerEngine.isEnabled())
                .pendingPromptCount(pendingPrompts.size())
                .messageCount(ledger.messageCount())
                .lastSequenceNumber(ledger.lastSequenceNumber())
                .build();
    }

    private static void requireValidPosition(double position) {
        if (Double.isNaN(position) || Double.isInfinite(position) || position < 0) {
            throw new IllegalArgumentException("Invalid playback position " + position);
        }
    }

    static String formatPosition(double seconds) {
        long total = (long) Math.floor(seconds);
        return String.format("%d:%02d", total / 60, total % 60);
    }
}
