package com.example.learningsession.ledger;

import com.example.learningsession.model.LifecycleState;
import com.example.learningsession.model.Message;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Append-only record of what happened in one viewing session.
 *
 * <p>Every append receives a sequence number. A lifecycle transition is an
 * append of a new revision of an existing message; earlier revisions stay in
 * the log. {@link #query(MessageFilter)} answers with the latest revision of
 * each message, ordered by origin timestamp and, on ties, by the sequence
 * number of the message's first append.
 *
 * <p>Not thread-safe. A ledger belongs to exactly one
 * {@link com.example.learningsession.session.SessionStateMachine}, which
 * serializes access to it.
 */
public class MessageLedger {

    private static final Logger logger = LoggerFactory.getLogger(MessageLedger.class);

    private final String sessionId;
    private final List<LedgerEntry> entries = new ArrayList<>();
    private final Map<String, Message> latest = new HashMap<>();
    private final Map<String, Long> firstSequence = new HashMap<>();
    private long nextSequence = 1;

    public MessageLedger(String sessionId) {
        this.sessionId = sessionId;
    }

    public String getSessionId() {
        return sessionId;
    }

    public long append(Message message) {
        Objects.requireNonNull(message, "message");
        if (message.getId() == null || message.getKind() == null
                || message.getLifecycleState() == null || message.getOriginTimestamp() == null) {
            throw new IllegalArgumentException("Message requires id, kind, lifecycleState and originTimestamp");
        }
        if (latest.containsKey(message.getId())) {
            throw new IllegalArgumentException("Message already in ledger: " + message.getId());
        }
        long sequence = nextSequence++;
        entries.add(new LedgerEntry(sequence, message));
        latest.put(message.getId(), message);
        firstSequence.put(message.getId(), sequence);
        logger.debug("Ledger {} appended {} {} as #{}", sessionId, message.getKind(), message.getId(), sequence);
        return sequence;
    }

    /**
     * Appends a revision of {@code messageId} in state {@code next}.
     *
     * @throws IllegalStateException if the lifecycle does not allow the move
     */
    public LedgerEntry recordTransition(String messageId, LifecycleState next) {
        Message current = latest.get(messageId);
        if (current == null) {
            throw new NoSuchElementException("Unknown message: " + messageId);
        }
        if (!current.getLifecycleState().canTransitionTo(next)) {
            throw new IllegalStateException("Illegal transition " + current.getLifecycleState()
                    + " -> " + next + " for message " + messageId);
        }
        Message revised = current.withLifecycleState(next);
        long sequence = nextSequence++;
        LedgerEntry entry = new LedgerEntry(sequence, revised);
        entries.add(entry);
        latest.put(messageId, revised);
        logger.debug("Ledger {} moved {} to {} as #{}", sessionId, messageId, next, sequence);
        return entry;
    }

    public Optional<Message> find(String messageId) {
        return Optional.ofNullable(latest.get(messageId));
    }

    public List<Message> query(MessageFilter filter) {
        MessageFilter effective = filter == null ? MessageFilter.ALL : filter;
        return latest.values().stream()
                .filter(effective::matches)
                .sorted(Comparator.comparing(Message::getOriginTimestamp)
                        .thenComparing(m -> firstSequence.get(m.getId())))
                .collect(Collectors.toList());
    }

    /**
     * Raw log entries with a sequence number greater than {@code sequenceNumber},
     * in append order. Used to catch up a reconnecting observer.
     */
    public List<LedgerEntry> entriesAfter(long sequenceNumber) {
        return entries.stream()
                .filter(e -> e.getSequenceNumber() > sequenceNumber)
                .collect(Collectors.toList());
    }

    public long lastSequenceNumber() {
        return nextSequence - 1;
    }

    public int messageCount() {
        return latest.size();
    }
}
