package com.example.learningsession.bridge;

import com.example.learningsession.model.OutboxEvent;
import com.example.learningsession.repo.OutboxRepo;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class OutboxBridgePublisherTest {

    @Mock
    private OutboxRepo outboxRepo;

    private OutboxBridgePublisher publisher;

    @BeforeEach
    void setUp() {
        publisher = new OutboxBridgePublisher(outboxRepo);
    }

    @Test
    void testEnqueue_WritesUnprocessedOutboxEvent() {
        // Given
        when(outboxRepo.save(any(OutboxEvent.class))).thenAnswer(inv -> inv.getArgument(0));

        // When
        OutboxEvent saved = publisher.enqueue(BridgeEvent.builder()
                .operationId("upload:42")
                .sessionId("s1")
                .type(BridgeEventType.UPLOAD_PROGRESS)
                .payload(Map.of("percent", 50))
                .build());

        // Then
        assertEquals("upload:42", saved.getOperationId());
        assertEquals("UPLOAD_PROGRESS", saved.getType());
        assertFalse(saved.isProcessed());
        assertNotNull(saved.getTs());
        assertEquals(50, saved.getPayload().get("percent"));
    }

    @Test
    void testEnqueue_RejectsInvalidEvent() {
        assertThrows(IllegalArgumentException.class,
                () -> publisher.enqueue(BridgeEvent.builder().operationId("x").type(BridgeEventType.UPLOAD_PROGRESS).build()));
        verifyNoInteractions(outboxRepo);
    }
}
