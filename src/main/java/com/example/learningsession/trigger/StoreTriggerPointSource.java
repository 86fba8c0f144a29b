package com.example.learningsession.trigger;

import com.example.learningsession.exception.TriggerConfigurationException;
import com.example.learningsession.model.AgentType;
import com.example.learningsession.store.StoreClient;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Reads trigger points from the authoring collection, one document per point:
 * <pre>
 * { "videoId": "...", "triggerId": "...", "timestampSeconds": 120,
 *   "agentType": "quiz", "agentPayload": { ... } }
 * </pre>
 */
@Component
public class StoreTriggerPointSource implements TriggerPointSource {

    private final StoreClient store;
    private final String collection;

    public StoreTriggerPointSource(StoreClient store,
                                   @Value("${app.triggers.collection:video_triggers}") String collection) {
        this.store = store;
        this.collection = collection;
    }

    @Override
    public List<TriggerPoint> findByVideoId(String videoId) {
        List<Map<String, Object>> docs = store.find(collection, Map.of("videoId", videoId),
                Map.of("timestampSeconds", 1), null);
        List<TriggerPoint> points = new ArrayList<>();
        for (Map<String, Object> doc : docs) {
            points.add(toTriggerPoint(videoId, doc));
        }
        return points;
    }

    @SuppressWarnings("unchecked")
    private TriggerPoint toTriggerPoint(String videoId, Map<String, Object> doc) {
        Object ts = doc.get("timestampSeconds");
        if (!(ts instanceof Number)) {
            throw new TriggerConfigurationException(videoId, "timestampSeconds must be numeric, got " + ts);
        }
        AgentType agentType;
        try {
            agentType = AgentType.parse((String) doc.get("agentType"));
        } catch (IllegalArgumentException | ClassCastException e) {
            throw new TriggerConfigurationException(videoId, "Unknown agent type " + doc.get("agentType"), e);
        }
        Object payload = doc.get("agentPayload");
        if (payload != null && !(payload instanceof Map)) {
            throw new TriggerConfigurationException(videoId, "agentPayload must be an object");
        }
        double timestamp = ((Number) ts).doubleValue();
        Object authoredId = doc.get("triggerId");
        String id = authoredId != null
                ? authoredId.toString()
                : TriggerPoint.defaultId(videoId, timestamp, agentType);
        return TriggerPoint.builder()
                .id(id)
                .timestampSeconds(timestamp)
                .agentType(agentType)
                .agentPayload(payload == null ? Map.of() : (Map<String, Object>) payload)
                .build();
    }
}
