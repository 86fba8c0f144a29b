package com.example.learningsession.controller;

import com.example.learningsession.bridge.BridgeEvent;
import com.example.learningsession.bridge.SessionObserver;
import com.example.learningsession.ledger.LedgerEntry;
import com.example.learningsession.session.SessionAttachment;
import com.example.learningsession.session.SessionRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Subscription feed of a session over Server-Sent Events. The first event is a
 * {@code snapshot} of the context and ledger; every later event is a bridge
 * event named after its type. A reconnecting client passes the last sequence
 * number it applied as {@code after}.
 */
@RestController
public class SessionStreamController {

    private static final Logger logger = LoggerFactory.getLogger(SessionStreamController.class);

    private final SessionRegistry sessionRegistry;

    public SessionStreamController(SessionRegistry sessionRegistry) {
        this.sessionRegistry = sessionRegistry;
    }

    @GetMapping(value = "/sessions/{sessionId}/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public Flux<ServerSentEvent<Object>> stream(@PathVariable String sessionId,
                                                @RequestParam(required = false, defaultValue = "0") long after) {
        SinkObserver observer = new SinkObserver();
        SessionAttachment attachment = sessionRegistry.get(sessionId).attach(observer);
        List<LedgerEntry> entries = attachment.getEntries().stream()
                .filter(e -> e.getSequenceNumber() > after)
                .collect(Collectors.toList());
        logger.debug("Observer {} attached to session {} with {} ledger entries",
                attachment.getSubscription().getId(), sessionId, entries.size());

        ServerSentEvent<Object> snapshot = ServerSentEvent.<Object>builder()
                .event("snapshot")
                .data(Map.of("context", attachment.getContext(), "entries", entries))
                .build();

        return Flux.just(snapshot)
                .concatWith(observer.sink.asFlux())
                .doFinally(signal -> {
                    observer.connected = false;
                    attachment.getSubscription().cancel();
                    logger.debug("Observer {} left session {} ({})", attachment.getSubscription().getId(), sessionId, signal);
                });
    }

    static class SinkObserver implements SessionObserver {

        private final Sinks.Many<ServerSentEvent<Object>> sink = Sinks.many().unicast().onBackpressureBuffer();
        private volatile boolean connected = true;

        @Override
        public void onEvent(BridgeEvent event) {
            Sinks.EmitResult result = sink.tryEmitNext(ServerSentEvent.<Object>builder()
                    .id(event.getOperationId())
                    .event(event.getType().name())
                    .data(event)
                    .build());
            if (result == Sinks.EmitResult.FAIL_CANCELLED || result == Sinks.EmitResult.FAIL_TERMINATED) {
                connected = false;
            }
            if (result.isFailure()) {
                throw new IllegalStateException("Could not emit " + event.getOperationId() + ": " + result);
            }
        }

        @Override
        public boolean isConnected() {
            return connected;
        }
    }
}
