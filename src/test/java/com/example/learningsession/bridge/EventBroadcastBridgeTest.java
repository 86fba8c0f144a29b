package com.example.learningsession.bridge;

import com.example.learningsession.support.DirectExecutorService;
import com.example.learningsession.support.RecordingObserver;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class EventBroadcastBridgeTest {

    private final List<Integer> seenByObserverAtProcessing = new ArrayList<>();
    private RecordingObserver observer;
    private StubProcessor processor;
    private EventBroadcastBridge bridge;

    @BeforeEach
    void setUp() {
        observer = new RecordingObserver();
        processor = new StubProcessor();
        bridge = new EventBroadcastBridge(List.of(processor), new DirectExecutorService());
        ReflectionTestUtils.setField(bridge, "maxDeliveryAttempts", 2);
        ReflectionTestUtils.setField(bridge, "dedupeWindow", 16);
    }

    @Test
    void testPublish_DeliversOnlyToTargetSession() {
        // Given
        RecordingObserver other = new RecordingObserver();
        bridge.subscribe("s1", observer);
        bridge.subscribe("s2", other);

        // When
        DeliveryReport report = bridge.publish(event("op-1", "s1", BridgeEventType.UPLOAD_PROGRESS));

        // Then
        assertEquals(1, report.getObservers());
        assertEquals(1, observer.getEvents().size());
        assertTrue(other.getEvents().isEmpty());
    }

    @Test
    void testPublish_DuplicateOperationAppliedOnce() {
        // Given
        bridge.subscribe("s1", observer);

        // When
        bridge.publish(event("op-1", "s1", BridgeEventType.UPLOAD_COMPLETE));
        bridge.publish(event("op-1", "s1", BridgeEventType.UPLOAD_COMPLETE));

        // Then
        assertEquals(1, observer.getEvents().size());
    }

    @Test
    void testPublish_DisconnectedObserverIsDropped() {
        // Given
        bridge.subscribe("s1", observer);
        observer.disconnect();

        // When
        DeliveryReport report = bridge.publish(event("op-1", "s1", BridgeEventType.UPLOAD_PROGRESS));

        // Then
        assertEquals(0, report.getObservers());
        assertEquals(1, report.getDroppedObservers());
        assertEquals(0, bridge.observerCount("s1"));
        assertTrue(observer.getEvents().isEmpty());
    }

    @Test
    void testPublish_ProcessorRunsBeforeObserversAndCacheUpdatesFollow() {
        // Given
        bridge.subscribe("s1", observer);

        // When
        DeliveryReport report = bridge.publish(event("activity:r1", "s1", BridgeEventType.ACTIVITY_COMPLETED));

        // Then
        assertEquals(List.of(0), seenByObserverAtProcessing);
        assertEquals(2, report.getCacheUpdates());
        assertEquals(List.of(BridgeEventType.ACTIVITY_COMPLETED, BridgeEventType.CACHE_UPDATED, BridgeEventType.CACHE_UPDATED),
                observer.types());
        BridgeEvent cacheEvent = observer.ofType(BridgeEventType.CACHE_UPDATED).get(0);
        assertEquals("activity:r1#cache:video:v1", cacheEvent.getOperationId());
        assertEquals("cache:video:v1", cacheEvent.payloadString("cacheKey"));
    }

    @Test
    void testPublish_ProcessorFailureStillDeliversEvent() {
        // Given
        bridge.subscribe("s1", observer);
        processor.fail = true;

        // When
        DeliveryReport report = bridge.publish(event("activity:r1", "s1", BridgeEventType.ACTIVITY_COMPLETED));

        // Then
        assertTrue(report.isProcessorFailed());
        assertEquals(List.of(BridgeEventType.ACTIVITY_COMPLETED), observer.types());
    }

    @Test
    void testPublish_RetriesFailedDelivery() {
        // Given
        bridge.subscribe("s1", observer);
        observer.failNext(1);

        // When
        bridge.publish(event("op-1", "s1", BridgeEventType.UPLOAD_PROGRESS));

        // Then
        assertEquals(1, observer.getEvents().size());
        Map<?, ?> counters = (Map<?, ?>) bridge.getBridgeStats().get("events");
        assertEquals(1L, counters.get("delivered"));
        assertEquals(0L, counters.get("failed"));
    }

    @Test
    void testPublish_GivesUpAfterMaxAttempts() {
        // Given
        bridge.subscribe("s1", observer);
        observer.failNext(2);

        // When
        bridge.publish(event("op-1", "s1", BridgeEventType.UPLOAD_PROGRESS));

        // Then
        assertTrue(observer.getEvents().isEmpty());
        Map<?, ?> counters = (Map<?, ?>) bridge.getBridgeStats().get("events");
        assertEquals(1L, counters.get("failed"));
    }

    @Test
    void testSubscriptionCancel_StopsDelivery() {
        // Given
        Subscription subscription = bridge.subscribe("s1", observer);

        // When
        subscription.cancel();
        bridge.publish(event("op-1", "s1", BridgeEventType.UPLOAD_PROGRESS));

        // Then
        assertTrue(observer.getEvents().isEmpty());
        assertEquals(0, bridge.observerCount("s1"));
    }

    @Test
    void testPublish_RejectsEventWithoutOperationId() {
        assertThrows(IllegalArgumentException.class,
                () -> bridge.publish(BridgeEvent.builder().sessionId("s1").type(BridgeEventType.UPLOAD_PROGRESS).build()));
    }

    private static BridgeEvent event(String operationId, String sessionId, BridgeEventType type) {
        return BridgeEvent.builder()
                .operationId(operationId)
                .sessionId(sessionId)
                .type(type)
                .payload(Map.of("videoId", "v1"))
                .build();
    }

    private class StubProcessor implements BridgeEventProcessor {
        boolean fail;

        @Override
        public boolean supports(BridgeEventType type) {
            return type == BridgeEventType.ACTIVITY_COMPLETED;
        }

        @Override
        public List<CacheUpdate> process(BridgeEvent event) {
            seenByObserverAtProcessing.add(observer.getEvents().size());
            if (fail) {
                throw new IllegalStateException("redis down");
            }
            return List.of(new CacheUpdate("cache:video:v1", Map.of("activityCount", 1)),
                    new CacheUpdate("cache:course:c1", Map.of("activityCount", 1)));
        }
    }
}
