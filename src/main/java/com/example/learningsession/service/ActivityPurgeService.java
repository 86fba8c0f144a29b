package com.example.learningsession.service;

import com.example.learningsession.bridge.BridgeEvent;
import com.example.learningsession.bridge.BridgeEventType;
import com.example.learningsession.bridge.DeliveryReport;
import com.example.learningsession.bridge.EventBroadcastBridge;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Cascade deletion of activity records when a video or course goes away. The
 * caches follow through an {@code ACTIVITY_PURGED} event on the course channel.
 */
@Service
public class ActivityPurgeService {

    private static final Logger logger = LoggerFactory.getLogger(ActivityPurgeService.class);

    private final ActivityStore activityStore;
    private final EventBroadcastBridge bridge;

    public ActivityPurgeService(ActivityStore activityStore, EventBroadcastBridge bridge) {
        this.activityStore = activityStore;
        this.bridge = bridge;
    }

    public Map<String, Object> purgeVideo(String videoId, String courseId) {
        long deleted = activityStore.deleteForVideo(videoId);
        return announce(courseId, videoId, deleted);
    }

    public Map<String, Object> purgeCourse(String courseId) {
        long deleted = activityStore.deleteForCourse(courseId);
        return announce(courseId, null, deleted);
    }

    private Map<String, Object> announce(String courseId, String videoId, long deleted) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("courseId", courseId);
        if (videoId != null) {
            payload.put("videoId", videoId);
        }
        payload.put("deletedRecords", deleted);
        DeliveryReport report = bridge.publish(BridgeEvent.builder()
                .operationId("purge:" + courseId + ":" + UUID.randomUUID())
                .sessionId(courseChannel(courseId))
                .type(BridgeEventType.ACTIVITY_PURGED)
                .payload(payload)
                .build());
        if (report.isProcessorFailed()) {
            logger.error("Caches of course {} not rebuilt after purge; verification will flag them", courseId);
        }
        Map<String, Object> result = new LinkedHashMap<>(payload);
        result.put("cacheUpdates", report.getCacheUpdates());
        result.put("cacheRebuilt", !report.isProcessorFailed());
        return result;
    }

    /**
     * Bridge channel for course-wide events that belong to no viewing session.
     */
    public static String courseChannel(String courseId) {
        return "course:" + courseId;
    }
}
