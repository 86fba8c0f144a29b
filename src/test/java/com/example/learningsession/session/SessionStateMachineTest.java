package com.example.learningsession.session;

import com.example.learningsession.bridge.BridgeEvent;
import com.example.learningsession.bridge.BridgeEventType;
import com.example.learningsession.bridge.EventBroadcastBridge;
import com.example.learningsession.exception.ActivityPersistenceException;
import com.example.learningsession.exception.InvalidResponseException;
import com.example.learningsession.exception.MessageNotFoundException;
import com.example.learningsession.ledger.MessageFilter;
import com.example.learningsession.ledger.MessageView;
import com.example.learningsession.model.*;
import com.example.learningsession.service.ActivityResultEvaluator;
import com.example.learningsession.service.ActivityStore;
import com.example.learningsession.service.ActivityStore.PersistResult;
import com.example.learningsession.support.DirectExecutorService;
import com.example.learningsession.support.RecordingObserver;
import com.example.learningsession.trigger.TriggerEngine;
import com.example.learningsession.trigger.TriggerPoint;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SessionStateMachineTest {

    private static final Map<String, Object> QUIZ_PAYLOAD = Map.of("questions", List.of(
            Map.of("question", "2 + 2?", "options", List.of("3", "4"), "correctAnswer", 1),
            Map.of("question", "Capital of France?", "options", List.of("Paris", "Rome"), "correctAnswer", 0)));

    @Mock
    private ActivityStore activityStore;

    @Mock
    private ScheduledExecutorService scheduler;

    private EventBroadcastBridge bridge;
    private RecordingObserver observer;
    private SessionStateMachine machine;

    @BeforeEach
    void setUp() {
        bridge = new EventBroadcastBridge(List.of(), new DirectExecutorService());
        observer = new RecordingObserver();
        machine = newMachine(0);
        machine.attach(observer);
    }

    private SessionStateMachine newMachine(int countdownSeconds) {
        TriggerEngine engine = TriggerEngine.forVideo("v1", List.of(
                TriggerPoint.builder().id("quiz-120").timestampSeconds(120).agentType(AgentType.QUIZ)
                        .agentPayload(QUIZ_PAYLOAD).build(),
                TriggerPoint.builder().id("reflect-300").timestampSeconds(300).agentType(AgentType.REFLECTION)
                        .agentPayload(Map.of()).build()));
        return new SessionStateMachine("s1", "u1", "v1", "c1", engine, activityStore,
                new ActivityResultEvaluator(), bridge, scheduler, countdownSeconds);
    }

    private void persistSucceeds() {
        when(activityStore.persistActivity(any(ActivityRecord.class)))
                .thenAnswer(inv -> PersistResult.success(((ActivityRecord) inv.getArgument(0)).getId()));
    }

    @Test
    void testQuizAt120_SubmitPersistsAndResumes() {
        // Given
        persistSucceeds();
        assertTrue(machine.onTimeUpdate(119).isEmpty());

        // When
        List<Message> prompts = machine.onTimeUpdate(120);

        // Then
        assertEquals(1, prompts.size());
        Message prompt = prompts.get(0);
        SessionContext suspended = machine.getContext();
        assertTrue(suspended.isPlaybackSuspended());
        assertEquals(prompt.getId(), suspended.getActiveAgentMessageId());
        assertEquals(LifecycleState.ACTIVATED, machine.findMessage(prompt.getId()).orElseThrow().getLifecycleState());

        // When
        TransitionResult result = machine.onUserResponse(prompt.getId(), Map.of("answers", List.of(1, 1)));

        // Then
        assertTrue(result.isApplied());
        ArgumentCaptor<ActivityRecord> captor = ArgumentCaptor.forClass(ActivityRecord.class);
        verify(activityStore).persistActivity(captor.capture());
        ActivityRecord record = captor.getValue();
        assertEquals(120.0, record.getTriggerTimestampSeconds());
        assertEquals("s1", record.getSessionId());
        assertEquals("v1", record.getVideoId());
        assertEquals("c1", record.getCourseId());
        assertEquals("quiz-120", record.getTriggerId());
        assertEquals(1, record.getResultPayload().get("score"));

        assertEquals(LifecycleState.PERMANENT, machine.findMessage(prompt.getId()).orElseThrow().getLifecycleState());
        SessionContext resumed = machine.getContext();
        assertFalse(resumed.isPlaybackSuspended());
        assertNull(resumed.getActiveAgentMessageId());
        assertEquals(1, machine.query(MessageFilter.ofKind(MessageKind.ACTIVITY_RESULT)).size());
    }

    @Test
    void testQuiz_PublishesSuspendCompletionAndResume() {
        // Given
        persistSucceeds();
        Message prompt = machine.onTimeUpdate(125).get(0);

        // When
        machine.onUserResponse(prompt.getId(), Map.of("answers", List.of(1, 0)));

        // Then
        List<BridgeEventType> types = observer.types();
        assertTrue(types.indexOf(BridgeEventType.PLAYBACK_SUSPENDED) < types.indexOf(BridgeEventType.ACTIVITY_COMPLETED));
        assertTrue(types.indexOf(BridgeEventType.ACTIVITY_COMPLETED) < types.indexOf(BridgeEventType.PLAYBACK_RESUMED));
        BridgeEvent completed = observer.ofType(BridgeEventType.ACTIVITY_COMPLETED).get(0);
        assertEquals("activity:" + completed.payloadString("recordId"), completed.getOperationId());
        assertEquals("c1", completed.payloadString("courseId"));
        List<String> notices = machine.query(MessageFilter.ofKind(MessageKind.SYSTEM_NOTICE)).stream()
                .map(Message::getText).collect(Collectors.toList());
        assertEquals(List.of("Paused at 2:00"), notices);
    }

    @Test
    void testDismissReflection_RejectedWithoutRecord() {
        // Given
        Message quiz = machine.onTimeUpdate(290).get(0);
        machine.onUserDismiss(quiz.getId());
        Message prompt = machine.onTimeUpdate(300).get(0);
        assertEquals(AgentType.REFLECTION, prompt.getAgentType());

        // When
        TransitionResult result = machine.onUserDismiss(prompt.getId());

        // Then
        assertTrue(result.isApplied());
        assertEquals(LifecycleState.REJECTED, machine.findMessage(prompt.getId()).orElseThrow().getLifecycleState());
        assertFalse(machine.getContext().isPlaybackSuspended());
        verify(activityStore, never()).persistActivity(any());
    }

    @Test
    void testMultipleCrossings_QueueBehindActivePrompt() {
        // When
        List<Message> prompts = machine.onTimeUpdate(400);

        // Then
        assertEquals(2, prompts.size());
        SessionContext context = machine.getContext();
        assertEquals(prompts.get(0).getId(), context.getActiveAgentMessageId());
        assertEquals(1, context.getPendingPromptCount());
        assertEquals(LifecycleState.UNACTIVATED,
                machine.findMessage(prompts.get(1).getId()).orElseThrow().getLifecycleState());

        // When
        machine.onUserDismiss(prompts.get(0).getId());

        // Then
        assertEquals(prompts.get(1).getId(), machine.getContext().getActiveAgentMessageId());
        assertTrue(machine.getContext().isPlaybackSuspended());
        assertEquals(1, activatedCount());
    }

    @Test
    void testRequestAgent_RefusedWhileAnotherIsActive() {
        // Given
        machine.onTimeUpdate(120);
        int messages = machine.getContext().getMessageCount();

        // When
        TransitionResult result = machine.requestAgent(AgentType.HINT, Map.of());

        // Then
        assertFalse(result.isApplied());
        assertEquals(messages, machine.getContext().getMessageCount());
        assertEquals(1, activatedCount());
    }

    @Test
    void testRequestAgent_ManualQuizTakesAuthoredQuestionsAndCompletes() {
        // Given
        persistSucceeds();
        machine.onTimeUpdate(45);

        // When
        TransitionResult requested = machine.requestAgent(AgentType.QUIZ, Map.of());

        // Then
        assertTrue(requested.isApplied());
        Message prompt = requested.getMessage();
        assertEquals(LifecycleState.ACTIVATED, prompt.getLifecycleState());
        assertNull(prompt.getTriggerId());
        assertEquals(QUIZ_PAYLOAD.get("questions"), prompt.getPayload().get("questions"));
        assertTrue(machine.getContext().isPlaybackSuspended());

        // When
        TransitionResult completed = machine.onUserResponse(prompt.getId(), Map.of("answers", List.of(1, 0)));

        // Then
        assertTrue(completed.isApplied());
        assertEquals(LifecycleState.PERMANENT, machine.findMessage(prompt.getId()).orElseThrow().getLifecycleState());
        assertFalse(machine.getContext().isPlaybackSuspended());
        ArgumentCaptor<ActivityRecord> captor = ArgumentCaptor.forClass(ActivityRecord.class);
        verify(activityStore).persistActivity(captor.capture());
        assertEquals(2, captor.getValue().getResultPayload().get("score"));
        assertEquals(45.0, captor.getValue().getTriggerTimestampSeconds());
    }

    @Test
    void testRequestAgent_QuizWithoutAnyQuestionsIsRefused() {
        // Given
        SessionStateMachine noQuiz = new SessionStateMachine("s2", "u1", "v2", "c1",
                TriggerEngine.forVideo("v2", List.of()), activityStore,
                new ActivityResultEvaluator(), bridge, scheduler, 0);

        // When / Then
        assertThrows(InvalidResponseException.class, () -> noQuiz.requestAgent(AgentType.QUIZ, Map.of()));
        assertEquals(0, noQuiz.getContext().getMessageCount());
        assertFalse(noQuiz.getContext().isPlaybackSuspended());
        assertNull(noQuiz.getContext().getActiveAgentMessageId());
    }

    @Test
    void testOnManualPause_HintCompletesAndResumes() {
        // Given
        persistSucceeds();
        machine.onTimeUpdate(75);

        // When
        TransitionResult paused = machine.onManualPause(80);

        // Then
        assertTrue(paused.isApplied());
        Message hint = paused.getMessage();
        assertEquals(AgentType.HINT, hint.getAgentType());
        assertEquals(80.0, hint.getVideoPositionSeconds());
        assertTrue(machine.getContext().isPlaybackSuspended());

        // When
        TransitionResult completed = machine.onUserResponse(hint.getId(), Map.of("helpful", true));

        // Then
        assertTrue(completed.isApplied());
        assertEquals(LifecycleState.PERMANENT, machine.findMessage(hint.getId()).orElseThrow().getLifecycleState());
        assertFalse(machine.getContext().isPlaybackSuspended());
        assertEquals(1, observer.ofType(BridgeEventType.ACTIVITY_COMPLETED).size());
        assertFalse(observer.ofType(BridgeEventType.PLAYBACK_RESUMED).isEmpty());
    }

    @Test
    void testTriggersDeferredWhileSuspended() {
        // Given
        machine.onTimeUpdate(100);
        Message hint = machine.onManualPause(100).getMessage();
        assertEquals(AgentType.HINT, hint.getAgentType());

        // When
        List<Message> whileSuspended = machine.onTimeUpdate(130);
        machine.onUserDismiss(hint.getId());
        List<Message> afterResume = machine.onTimeUpdate(131);

        // Then
        assertTrue(whileSuspended.isEmpty());
        assertEquals(1, afterResume.size());
        assertEquals("quiz-120", afterResume.get(0).getTriggerId());
    }

    @Test
    void testDuplicateTimeUpdates_EmitOnce() {
        // When
        machine.onTimeUpdate(120);
        machine.onTimeUpdate(120);
        machine.onTimeUpdate(120);

        // Then
        assertEquals(1, machine.query(MessageFilter.ofKind(MessageKind.AGENT_PROMPT)).size());
    }

    @Test
    void testPersistenceFailure_StaysActivatedAndCanRetry() {
        // Given
        Message prompt = machine.onTimeUpdate(120).get(0);
        when(activityStore.persistActivity(any(ActivityRecord.class)))
                .thenReturn(PersistResult.failure("mongo down", true))
                .thenAnswer(inv -> PersistResult.success(((ActivityRecord) inv.getArgument(0)).getId()));

        // When
        ActivityPersistenceException e = assertThrows(ActivityPersistenceException.class,
                () -> machine.onUserResponse(prompt.getId(), Map.of("answers", List.of(1, 0))));

        // Then
        assertTrue(e.isRetryable());
        assertEquals(LifecycleState.ACTIVATED, machine.findMessage(prompt.getId()).orElseThrow().getLifecycleState());
        assertTrue(machine.getContext().isPlaybackSuspended());
        assertTrue(machine.query(MessageFilter.ofKind(MessageKind.ACTIVITY_RESULT)).isEmpty());

        // When
        TransitionResult retry = machine.onUserResponse(prompt.getId(), Map.of("answers", List.of(1, 0)));

        // Then
        assertTrue(retry.isApplied());
        assertEquals(LifecycleState.PERMANENT, machine.findMessage(prompt.getId()).orElseThrow().getLifecycleState());
    }

    @Test
    void testDismissDuringPersistence_ResultDiscarded() {
        // Given
        Message prompt = machine.onTimeUpdate(120).get(0);
        when(activityStore.persistActivity(any(ActivityRecord.class))).thenAnswer(inv -> {
            machine.onUserDismiss(prompt.getId());
            return PersistResult.success(((ActivityRecord) inv.getArgument(0)).getId());
        });

        // When
        TransitionResult result = machine.onUserResponse(prompt.getId(), Map.of("answers", List.of(1, 0)));

        // Then
        assertFalse(result.isApplied());
        assertEquals(LifecycleState.REJECTED, machine.findMessage(prompt.getId()).orElseThrow().getLifecycleState());
        assertTrue(machine.query(MessageFilter.ofKind(MessageKind.ACTIVITY_RESULT)).isEmpty());
        assertTrue(observer.ofType(BridgeEventType.ACTIVITY_COMPLETED).isEmpty());
        assertFalse(machine.getContext().isPlaybackSuspended());
        ArgumentCaptor<ActivityRecord> captor = ArgumentCaptor.forClass(ActivityRecord.class);
        verify(activityStore).persistActivity(captor.capture());
        verify(activityStore).discardActivity(captor.getValue().getId());
    }

    @Test
    void testInvalidResponse_StateUnchanged() {
        // Given
        Message prompt = machine.onTimeUpdate(120).get(0);

        // When / Then
        assertThrows(InvalidResponseException.class,
                () -> machine.onUserResponse(prompt.getId(), Map.of("answers", List.of(1))));
        assertEquals(LifecycleState.ACTIVATED, machine.findMessage(prompt.getId()).orElseThrow().getLifecycleState());
        verifyNoInteractions(activityStore);
    }

    @Test
    void testResponseToTerminalPrompt_IsIgnored() {
        // Given
        Message prompt = machine.onTimeUpdate(120).get(0);
        machine.onUserDismiss(prompt.getId());

        // When
        TransitionResult again = machine.onUserDismiss(prompt.getId());
        TransitionResult response = machine.onUserResponse(prompt.getId(), Map.of("answers", List.of(1, 0)));

        // Then
        assertFalse(again.isApplied());
        assertFalse(response.isApplied());
        assertEquals(LifecycleState.REJECTED, machine.findMessage(prompt.getId()).orElseThrow().getLifecycleState());
        assertThrows(MessageNotFoundException.class, () -> machine.onUserDismiss("nope"));
    }

    @Test
    void testResumeCountdown_ResumesAfterScheduledDelay() {
        // Given
        persistSucceeds();
        SessionStateMachine counting = newMachine(3);
        RecordingObserver countingObserver = new RecordingObserver();
        counting.attach(countingObserver);
        ScheduledFuture<?> future = mock(ScheduledFuture.class);
        doReturn(future).when(scheduler).schedule(any(Runnable.class), eq(3L), eq(TimeUnit.SECONDS));
        Message prompt = counting.onTimeUpdate(120).get(0);

        // When
        counting.onUserResponse(prompt.getId(), Map.of("answers", List.of(1, 0)));

        // Then
        assertEquals(1, countingObserver.ofType(BridgeEventType.PLAYBACK_RESUME_SCHEDULED).size());
        assertTrue(countingObserver.ofType(BridgeEventType.PLAYBACK_RESUMED).isEmpty());
        assertTrue(counting.query(MessageFilter.ofKind(MessageKind.SYSTEM_NOTICE)).stream()
                .anyMatch(m -> m.getText().equals("Video continues in 3...")));

        // When
        ArgumentCaptor<Runnable> countdown = ArgumentCaptor.forClass(Runnable.class);
        verify(scheduler).schedule(countdown.capture(), eq(3L), eq(TimeUnit.SECONDS));
        countdown.getValue().run();

        // Then
        assertEquals(1, countingObserver.ofType(BridgeEventType.PLAYBACK_RESUMED).size());
    }

    @Test
    void testRehydrate_ReplaysRecordsAndSkipsTheirTriggers() {
        // Given
        SessionStateMachine fresh = newMachine(0);
        ActivityRecord stored = ActivityRecord.builder()
                .id("r1").sessionId("s1").videoId("v1").courseId("c1")
                .triggerId("quiz-120").activityType(AgentType.QUIZ)
                .triggerTimestampSeconds(120).resultPayload(Map.of("score", 2))
                .createdAt(Instant.now())
                .build();

        // When
        int replayed = fresh.rehydrate(List.of(stored));
        int again = fresh.rehydrate(List.of(stored));
        List<Message> prompts = fresh.onTimeUpdate(200);

        // Then
        assertEquals(1, replayed);
        assertEquals(0, again);
        assertTrue(prompts.isEmpty());
        assertEquals(1, fresh.query(MessageFilter.forView(MessageView.ACTIVITY)).size());
    }

    @Test
    void testConversationView_NeverShowsPrompts() {
        // Given
        machine.appendConversation("user", "What is a closure?");
        machine.onTimeUpdate(120);

        // When
        List<Message> conversation = machine.query(MessageFilter.forView(MessageView.CONVERSATION));

        // Then
        assertTrue(conversation.stream().noneMatch(Message::isAgentPrompt));
        assertEquals(MessageKind.CONVERSATIONAL, conversation.get(0).getKind());
        assertEquals(LifecycleState.PERMANENT, conversation.get(0).getLifecycleState());
    }

    @Test
    void testClose_PublishesAndDetachesObservers() {
        // When
        machine.close();

        // Then
        assertEquals(List.of(BridgeEventType.SESSION_CLOSED), observer.types());
        assertEquals(0, bridge.observerCount("s1"));
        assertTrue(machine.onTimeUpdate(120).isEmpty());
        assertTrue(machine.isClosed());
    }

    @Test
    void testOnTimeUpdate_RejectsInvalidPosition() {
        assertThrows(IllegalArgumentException.class, () -> machine.onTimeUpdate(-1));
        assertThrows(IllegalArgumentException.class, () -> machine.onTimeUpdate(Double.NaN));
    }

    @Test
    void testFormatPosition() {
        assertEquals("2:00", SessionStateMachine.formatPosition(120));
        assertEquals("0:05", SessionStateMachine.formatPosition(5.9));
        assertEquals("61:01", SessionStateMachine.formatPosition(3661));
    }

    private long activatedCount() {
        return machine.query(MessageFilter.builder().state(LifecycleState.ACTIVATED).build()).size();
    }
}
