package com.example.learningsession.bridge;

import lombok.Value;

import java.util.Map;

@Value
public class DeliveryReport {
    String operationId;
    int observers;
    int droppedObservers;
    int cacheUpdates;
    boolean processorFailed;

    public Map<String, Object> toMap() {
        return Map.of(
            "operationId", operationId,
            "observers", observers,
            "droppedObservers", droppedObservers,
            "cacheUpdates", cacheUpdates,
            "processorFailed", processorFailed
        );
    }
}
