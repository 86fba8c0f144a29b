package com.example.learningsession.service;

import com.example.learningsession.bridge.BridgeEvent;
import com.example.learningsession.bridge.BridgeEventProcessor;
import com.example.learningsession.bridge.BridgeEventType;
import com.example.learningsession.bridge.CacheUpdate;
import com.example.learningsession.kv.KvClient;
import com.example.learningsession.model.ActivityRecord;
import com.example.learningsession.model.CourseActivitySnapshot;
import com.example.learningsession.model.VideoActivitySnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.*;
import java.util.stream.Collectors;

import static com.example.learningsession.service.CacheSnapshotCodec.courseKey;
import static com.example.learningsession.service.CacheSnapshotCodec.videoKey;

/**
 * Keeps the per-video and per-course activity caches in step.
 *
 * <p>Every event touches both dimensions: snapshots are read with one MGET and
 * written back with one MSET, under this instance's lock, so a reader sees
 * either both old values or both new ones. Each snapshot remembers the
 * operation ids it has absorbed; a redelivered operation changes nothing.
 */
@Service
public class CacheSynchronizer implements BridgeEventProcessor {

    private static final Logger logger = LoggerFactory.getLogger(CacheSynchronizer.class);

    private final KvClient kvClient;
    private final ActivityStore activityStore;
    private final CacheSnapshotCodec codec;

    @Value("${app.cache.applied-operation-memory:100}")
    private int appliedOperationMemory = 100;

    public CacheSynchronizer(KvClient kvClient, ActivityStore activityStore, CacheSnapshotCodec codec) {
        this.kvClient = kvClient;
        this.activityStore = activityStore;
        this.codec = codec;
    }

    @Override
    public boolean supports(BridgeEventType type) {
        return type == BridgeEventType.ACTIVITY_COMPLETED || type == BridgeEventType.ACTIVITY_PURGED;
    }

    @Override
    public List<CacheUpdate> process(BridgeEvent event) {
        switch (event.getType()) {
            case ACTIVITY_COMPLETED:
                return applyActivity(event.getOperationId(),
                        required(event, "recordId"), required(event, "videoId"), required(event, "courseId"));
            case ACTIVITY_PURGED:
                return rebuildCourse(required(event, "courseId"), event.getOperationId());
            default:
                return List.of();
        }
    }

    private static String required(BridgeEvent event, String key) {
        String value = event.payloadString(key);
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(event.getType() + " " + event.getOperationId() + " lacks " + key);
        }
        return value;
    }

    public synchronized List<CacheUpdate> applyActivity(String operationId, String recordId, String videoId, String courseId) {
        String vKey = videoKey(videoId);
        String cKey = courseKey(courseId);
        Map<String, String> current = kvClient.mget(List.of(vKey, cKey));
        VideoActivitySnapshot video = codec.readVideo(current.get(vKey))
                .orElseGet(() -> VideoActivitySnapshot.empty(videoId, courseId));
        CourseActivitySnapshot course = codec.readCourse(current.get(cKey))
                .orElseGet(() -> CourseActivitySnapshot.empty(courseId));

        if (video.getAppliedOperationIds().contains(operationId)) {
            logger.debug("Operation {} already applied to {}", operationId, vKey);
            return List.of();
        }

        Instant now = Instant.now();
        if (!video.getActivityIds().contains(recordId)) {
            video.getActivityIds().add(recordId);
        }
        video.setCourseId(courseId);
        video.setActivityCount(video.getActivityIds().size());
        remember(video.getAppliedOperationIds(), operationId);
        video.setVersion(video.getVersion() + 1);
        video.setUpdatedAt(now);

        course.getVideoCounts().put(videoId, video.getActivityCount());
        course.recount();
        remember(course.getAppliedOperationIds(), operationId);
        course.setVersion(course.getVersion() + 1);
        course.setUpdatedAt(now);

        Map<String, String> writes = new LinkedHashMap<>();
        writes.put(vKey, codec.write(video));
        writes.put(cKey, codec.write(course));
        kvClient.mset(writes);

        logger.debug("Applied {} to {} ({}) and {} ({})", operationId, vKey, video.getActivityCount(),
                cKey, course.getActivityCount());
        return List.of(new CacheUpdate(vKey, video), new CacheUpdate(cKey, course));
    }

    /**
     * Recounts a course and every video it covers from the activity store and
     * rewrites all of their keys in one MSET. Videos that no longer have
     * records are written with a zero count.
     */
    public synchronized List<CacheUpdate> rebuildCourse(String courseId, String operationId) {
        Map<String, List<String>> idsByVideo = activityStore.findByCourse(courseId).stream()
                .collect(Collectors.groupingBy(ActivityRecord::getVideoId, TreeMap::new,
                        Collectors.mapping(ActivityRecord::getId, Collectors.toList())));

        String cKey = courseKey(courseId);
        CourseActivitySnapshot previousCourse = codec.readCourse(kvClient.get(cKey).orElse(null))
                .orElseGet(() -> CourseActivitySnapshot.empty(courseId));

        Set<String> videoIds = new TreeSet<>(idsByVideo.keySet());
        videoIds.addAll(previousCourse.getVideoCounts().keySet());
        List<String> keys = new ArrayList<>();
        videoIds.forEach(v -> keys.add(videoKey(v)));
        Map<String, String> previousVideos = keys.isEmpty() ? Map.of() : kvClient.mget(keys);

        Instant now = Instant.now();
        Map<String, String> writes = new LinkedHashMap<>();
        List<CacheUpdate> updates = new ArrayList<>();
        CourseActivitySnapshot course = CourseActivitySnapshot.builder()
                .courseId(courseId)
                .appliedOperationIds(new ArrayList<>(previousCourse.getAppliedOperationIds()))
                .version(previousCourse.getVersion() + 1)
                .updatedAt(now)
                .build();

        for (String videoId : videoIds) {
            String vKey = videoKey(videoId);
            VideoActivitySnapshot previous = codec.readVideo(previousVideos.get(vKey))
                    .orElseGet(() -> VideoActivitySnapshot.empty(videoId, courseId));
            List<String> ids = idsByVideo.getOrDefault(videoId, List.of());
            VideoActivitySnapshot video = VideoActivitySnapshot.builder()
                    .videoId(videoId)
                    .courseId(courseId)
                    .activityIds(new ArrayList<>(ids))
                    .activityCount(ids.size())
                    .appliedOperationIds(new ArrayList<>(previous.getAppliedOperationIds()))
                    .version(previous.getVersion() + 1)
                    .updatedAt(now)
                    .build();
            if (operationId != null) {
                remember(video.getAppliedOperationIds(), operationId);
            }
            course.getVideoCounts().put(videoId, ids.size());
            writes.put(vKey, codec.write(video));
            updates.add(new CacheUpdate(vKey, video));
        }
        course.recount();
        if (operationId != null) {
            remember(course.getAppliedOperationIds(), operationId);
        }
        writes.put(cKey, codec.write(course));
        updates.add(new CacheUpdate(cKey, course));

        kvClient.mset(writes);
        logger.info("Rebuilt cache for course {}: {} activities across {} video(s)",
                courseId, course.getActivityCount(), videoIds.size());
        return updates;
    }

    private void remember(List<String> applied, String operationId) {
        applied.add(operationId);
        while (applied.size() > Math.max(appliedOperationMemory, 1)) {
            applied.remove(0);
        }
    }
}
