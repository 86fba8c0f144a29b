package com.example.learningsession.controller;

import com.example.learningsession.bridge.EventBroadcastBridge;
import com.example.learningsession.service.ActivityResultEvaluator;
import com.example.learningsession.service.ActivityStore;
import com.example.learningsession.session.SessionRegistry;
import com.example.learningsession.session.SessionStateMachine;
import com.example.learningsession.support.DirectExecutorService;
import com.example.learningsession.trigger.TriggerEngine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.test.StepVerifier;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ScheduledExecutorService;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SessionStreamControllerTest {

    @Mock
    private SessionRegistry sessionRegistry;

    @Mock
    private ActivityStore activityStore;

    @Mock
    private ScheduledExecutorService scheduler;

    private EventBroadcastBridge bridge;
    private SessionStateMachine machine;
    private SessionStreamController controller;

    @BeforeEach
    void setUp() {
        bridge = new EventBroadcastBridge(List.of(), new DirectExecutorService());
        machine = new SessionStateMachine("s1", "u1", "v1", "c1", TriggerEngine.disabled("v1", "none"),
                activityStore, new ActivityResultEvaluator(), bridge, scheduler, 0);
        controller = new SessionStreamController(sessionRegistry);
        when(sessionRegistry.get("s1")).thenReturn(machine);
    }

    @Test
    void testStream_SnapshotThenLiveEvents() {
        // Given
        machine.appendConversation("user", "hello");

        // When / Then
        StepVerifier.create(controller.stream("s1", 0))
                .assertNext(sse -> {
                    assertEquals("snapshot", sse.event());
                    Map<?, ?> data = (Map<?, ?>) sse.data();
                    assertEquals(1, ((List<?>) data.get("entries")).size());
                })
                .then(() -> machine.appendConversation("user", "still there?"))
                .assertNext(sse -> assertEquals("MESSAGE_APPENDED", sse.event()))
                .thenCancel()
                .verify();

        assertEquals(0, bridge.observerCount("s1"));
    }

    @Test
    void testStream_SkipsEntriesAlreadySeen() {
        // Given
        machine.appendConversation("user", "one");
        machine.appendConversation("user", "two");

        // When / Then
        StepVerifier.create(controller.stream("s1", 1))
                .assertNext(sse -> {
                    Map<?, ?> data = (Map<?, ?>) sse.data();
                    assertEquals(1, ((List<?>) data.get("entries")).size());
                })
                .thenCancel()
                .verify();
    }
}
