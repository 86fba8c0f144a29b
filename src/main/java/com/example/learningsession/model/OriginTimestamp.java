package com.example.learningsession.model;

import lombok.Value;

import java.time.Instant;
import java.util.Comparator;

/**
 * Logical sequence plus wall-clock time of the event that produced a message.
 * Ordering is by logical sequence first, wall clock second.
 */
@Value
public class OriginTimestamp implements Comparable<OriginTimestamp> {

    private static final Comparator<OriginTimestamp> ORDER = Comparator
            .comparingLong(OriginTimestamp::getLogicalSequence)
            .thenComparing(OriginTimestamp::getWallClock);

    long logicalSequence;
    Instant wallClock;

    public static OriginTimestamp of(long logicalSequence, Instant wallClock) {
        return new OriginTimestamp(logicalSequence, wallClock);
    }

    @Override
    public int compareTo(OriginTimestamp other) {
        return ORDER.compare(this, other);
    }
}
