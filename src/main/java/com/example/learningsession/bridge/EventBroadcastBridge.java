package com.example.learningsession.bridge;

import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.*;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Delivers state changes from wherever they originate to the observers of the
 * target session.
 *
 * <p>Publishing first runs every {@link BridgeEventProcessor} inline, then hands
 * the event (and the cache updates it caused) to the delivery pool, one task per
 * observer. Deliveries are retried a bounded number of times and observers see
 * each operation id once. An observer that is disconnected at publish time is
 * detached and the event is lost for it; there is no replay queue.
 *
 * <p>The bridge carries events, it does not order them. Causal order within a
 * session is the ledger's sequence numbering.
 */
@Service
public class EventBroadcastBridge {

    private static final Logger logger = LoggerFactory.getLogger(EventBroadcastBridge.class);

    private final List<BridgeEventProcessor> processors;
    private final ExecutorService deliveryExecutor;
    private final Map<String, Map<String, Subscription>> subscriptions = new ConcurrentHashMap<>();

    private final AtomicLong publishedCount = new AtomicLong();
    private final AtomicLong deliveredCount = new AtomicLong();
    private final AtomicLong failedCount = new AtomicLong();
    private final AtomicLong droppedCount = new AtomicLong();

    @Value("${app.bridge.max-delivery-attempts:2}")
    private int maxDeliveryAttempts = 2;

    @Value("${app.bridge.dedupe-window:1024}")
    private int dedupeWindow = 1024;

    @Autowired
    public EventBroadcastBridge(List<BridgeEventProcessor> processors,
                                @Value("${app.bridge.delivery-threads:4}") int deliveryThreads) {
        this(processors, createExecutorService(deliveryThreads));
    }

    public EventBroadcastBridge(List<BridgeEventProcessor> processors, ExecutorService deliveryExecutor) {
        this.processors = List.copyOf(processors);
        this.deliveryExecutor = deliveryExecutor;
    }

    private static ExecutorService createExecutorService(int deliveryThreads) {
        int threadCount = deliveryThreads > 0 ? deliveryThreads : 4;
        return Executors.newFixedThreadPool(threadCount, r -> {
            Thread t = new Thread(r, "bridge-delivery-thread");
            t.setDaemon(true);
            return t;
        });
    }

    public Subscription subscribe(String sessionId, SessionObserver observer) {
        Objects.requireNonNull(sessionId, "sessionId");
        Objects.requireNonNull(observer, "observer");
        Subscription subscription = new Subscription(UUID.randomUUID().toString(), sessionId,
                new DeduplicatingObserver(observer, dedupeWindow), this::unsubscribe);
        subscriptions.computeIfAbsent(sessionId, k -> new ConcurrentHashMap<>())
                .put(subscription.getId(), subscription);
        logger.debug("Observer {} subscribed to session {}", subscription.getId(), sessionId);
        return subscription;
    }

    private void unsubscribe(Subscription subscription) {
        subscriptions.computeIfPresent(subscription.getSessionId(), (sessionId, subs) -> {
            subs.remove(subscription.getId());
            return subs.isEmpty() ? null : subs;
        });
    }

    public void unsubscribeAll(String sessionId) {
        Map<String, Subscription> removed = subscriptions.remove(sessionId);
        if (removed != null) {
            logger.debug("Detached {} observer(s) from session {}", removed.size(), sessionId);
        }
    }

    public int observerCount(String sessionId) {
        return subscriptions.getOrDefault(sessionId, Map.of()).size();
    }

    public DeliveryReport publish(BridgeEvent event) {
        Objects.requireNonNull(event, "event");
        event.validate();
        BridgeEvent stamped = event.getOccurredAt() != null ? event : event.toBuilder().occurredAt(Instant.now()).build();
        publishedCount.incrementAndGet();

        List<BridgeEvent> outgoing = new ArrayList<>();
        outgoing.add(stamped);
        boolean processorFailed = false;
        for (BridgeEventProcessor processor : processors) {
            if (!processor.supports(stamped.getType())) {
                continue;
            }
            try {
                for (CacheUpdate update : processor.process(stamped)) {
                    outgoing.add(cacheUpdatedEvent(stamped, update));
                }
            } catch (Exception e) {
                // the caches keep their previous consistent state; verification repairs them
                processorFailed = true;
                logger.error("Processor {} failed for operation {}",
                        processor.getClass().getSimpleName(), stamped.getOperationId(), e);
            }
        }

        int observers = 0;
        int dropped = 0;
        for (Subscription subscription : List.copyOf(subscriptions.getOrDefault(stamped.getSessionId(), Map.of()).values())) {
            if (!subscription.getObserver().isConnected()) {
                subscription.cancel();
                dropped++;
                droppedCount.incrementAndGet();
                logger.info("Dropped {} for disconnected observer {} of session {}",
                        stamped.getType(), subscription.getId(), stamped.getSessionId());
                continue;
            }
            try {
                deliveryExecutor.execute(() -> deliverAll(subscription, outgoing));
                observers++;
            } catch (RejectedExecutionException e) {
                dropped++;
                droppedCount.incrementAndGet();
                logger.warn("Delivery pool rejected operation {} for observer {}",
                        stamped.getOperationId(), subscription.getId());
            }
        }
        logger.debug("Published {} {} to {} observer(s) with {} cache update(s)",
                stamped.getType(), stamped.getOperationId(), observers, outgoing.size() - 1);
        return new DeliveryReport(stamped.getOperationId(), observers, dropped, outgoing.size() - 1, processorFailed);
    }

    private void deliverAll(Subscription subscription, List<BridgeEvent> events) {
        for (BridgeEvent event : events) {
            if (!deliver(subscription, event)) {
                return;
            }
        }
    }

    /**
     * @return false once the observer turns out to be disconnected
     */
    private boolean deliver(Subscription subscription, BridgeEvent event) {
        SessionObserver observer = subscription.getObserver();
        int attempts = Math.max(maxDeliveryAttempts, 1);
        for (int attempt = 1; attempt <= attempts; attempt++) {
            try {
                observer.onEvent(event);
                deliveredCount.incrementAndGet();
                return true;
            } catch (Exception e) {
                if (!observer.isConnected()) {
                    subscription.cancel();
                    droppedCount.incrementAndGet();
                    logger.info("Observer {} disconnected during delivery of {}", subscription.getId(), event.getOperationId());
                    return false;
                }
                logger.warn("Delivery attempt {}/{} of {} to observer {} failed: {}",
                        attempt, attempts, event.getOperationId(), subscription.getId(), e.getMessage());
            }
        }
        failedCount.incrementAndGet();
        return true;
    }

    private BridgeEvent cacheUpdatedEvent(BridgeEvent cause, CacheUpdate update) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("cacheKey", update.getCacheKey());
        payload.put("snapshot", update.getSnapshot());
        payload.put("causeOperationId", cause.getOperationId());
        return BridgeEvent.builder()
                .operationId(cause.getOperationId() + "#" + update.getCacheKey())
                .sessionId(cause.getSessionId())
                .type(BridgeEventType.CACHE_UPDATED)
                .payload(payload)
                .occurredAt(cause.getOccurredAt())
                .build();
    }

    /**
     * Get bridge statistics
     */
    public Map<String, Object> getBridgeStats() {
        Map<String, Object> pool = new LinkedHashMap<>();
        if (deliveryExecutor instanceof ThreadPoolExecutor) {
            ThreadPoolExecutor executor = (ThreadPoolExecutor) deliveryExecutor;
            pool.put("activeCount", executor.getActiveCount());
            pool.put("poolSize", executor.getPoolSize());
            pool.put("maxPoolSize", executor.getMaximumPoolSize());
            pool.put("queueSize", executor.getQueue().size());
            pool.put("completedTasks", executor.getCompletedTaskCount());
        }
        int observers = subscriptions.values().stream().mapToInt(Map::size).sum();
        return Map.of(
            "deliveryThreads", pool,
            "subscriptions", Map.of(
                "sessions", subscriptions.size(),
                "observers", observers
            ),
            "events", Map.of(
                "published", publishedCount.get(),
                "delivered", deliveredCount.get(),
                "failed", failedCount.get(),
                "dropped", droppedCount.get()
            ),
            "configuration", Map.of(
                "maxDeliveryAttempts", maxDeliveryAttempts,
                "dedupeWindow", dedupeWindow
            )
        );
    }

    @PreDestroy
    public void shutdown() {
        deliveryExecutor.shutdown();
    }
}
