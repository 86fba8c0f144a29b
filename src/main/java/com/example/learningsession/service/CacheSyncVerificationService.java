package com.example.learningsession.service;

import com.example.learningsession.kv.KvClient;
import com.example.learningsession.model.ActivityRecord;
import com.example.learningsession.model.CourseActivitySnapshot;
import com.example.learningsession.model.VideoActivitySnapshot;
import com.example.learningsession.repo.OutboxRepo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.*;
import java.util.stream.Collectors;

import static com.example.learningsession.service.CacheSnapshotCodec.courseKey;
import static com.example.learningsession.service.CacheSnapshotCodec.videoKey;

@Service
public class CacheSyncVerificationService {

    private static final Logger logger = LoggerFactory.getLogger(CacheSyncVerificationService.class);

    private final KvClient kvClient;
    private final ActivityStore activityStore;
    private final CacheSynchronizer cacheSynchronizer;
    private final CacheSnapshotCodec codec;
    private final OutboxRepo outboxRepo;

    @Value("${app.cache.health-check.max-courses:500}")
    private int maxCoursesPerCheck = 500;

    @Value("${app.cache.health-check.auto-repair:false}")
    private boolean autoRepair;

    public CacheSyncVerificationService(KvClient kvClient, ActivityStore activityStore,
                                        CacheSynchronizer cacheSynchronizer, CacheSnapshotCodec codec,
                                        OutboxRepo outboxRepo) {
        this.kvClient = kvClient;
        this.activityStore = activityStore;
        this.cacheSynchronizer = cacheSynchronizer;
        this.codec = codec;
        this.outboxRepo = outboxRepo;
    }

    /**
     * Compares one course's cache with its video caches and with the activity store.
     */
    public Map<String, Object> verifyCourse(String courseId) {
        String cKey = courseKey(courseId);
        CourseActivitySnapshot course = codec.readCourse(kvClient.get(cKey).orElse(null))
                .orElseGet(() -> CourseActivitySnapshot.empty(courseId));
        Map<String, Long> storedCounts = activityStore.findByCourse(courseId).stream()
                .collect(Collectors.groupingBy(ActivityRecord::getVideoId, TreeMap::new, Collectors.counting()));

        Set<String> videoIds = new TreeSet<>(course.getVideoCounts().keySet());
        videoIds.addAll(storedCounts.keySet());
        List<String> keys = videoIds.stream().map(CacheSnapshotCodec::videoKey).collect(Collectors.toList());
        Map<String, String> videoValues = keys.isEmpty() ? Map.of() : kvClient.mget(keys);

        List<Map<String, Object>> mismatches = new ArrayList<>();
        for (String videoId : videoIds) {
            int videoCached = codec.readVideo(videoValues.get(videoKey(videoId)))
                    .map(VideoActivitySnapshot::getActivityCount)
                    .orElse(0);
            int courseCached = course.getVideoCounts().getOrDefault(videoId, 0);
            long stored = storedCounts.getOrDefault(videoId, 0L);
            if (videoCached != courseCached || videoCached != stored) {
                Map<String, Object> mismatch = new HashMap<>();
                mismatch.put("videoId", videoId);
                mismatch.put("videoCache", videoCached);
                mismatch.put("courseCache", courseCached);
                mismatch.put("activityStore", stored);
                mismatches.add(mismatch);
            }
        }

        long storedTotal = storedCounts.values().stream().mapToLong(Long::longValue).sum();
        boolean inSync = mismatches.isEmpty() && course.getActivityCount() == storedTotal;
        Map<String, Object> result = new HashMap<>();
        result.put("courseId", courseId);
        result.put("inSync", inSync);
        result.put("cachedActivityCount", course.getActivityCount());
        result.put("storedActivityCount", storedTotal);
        result.put("checkedVideos", videoIds.size());
        result.put("mismatches", mismatches);
        result.put("cacheVersion", course.getVersion());
        return result;
    }

    /**
     * Comprehensive sync verification report
     */
    public Map<String, Object> verifyCacheSync() {
        Map<String, Object> report = new HashMap<>();

        long unprocessedEvents = outboxRepo.countByProcessedFalse();
        report.put("unprocessedOutboxEvents", unprocessedEvents);

        List<String> courseKeys = kvClient.scan(CacheSnapshotCodec.COURSE_PREFIX, maxCoursesPerCheck);
        List<String> outOfSync = new ArrayList<>();
        for (String key : courseKeys) {
            String courseId = key.substring(CacheSnapshotCodec.COURSE_PREFIX.length());
            if (!Boolean.TRUE.equals(verifyCourse(courseId).get("inSync"))) {
                outOfSync.add(courseId);
            }
        }
        report.put("checkedCourses", courseKeys.size());
        report.put("outOfSyncCourses", outOfSync);
        report.put("overallSyncHealth", outOfSync.isEmpty() ? "HEALTHY" : "ISSUES_DETECTED");
        report.put("timestamp", Instant.now());

        logger.info("Cache sync verification completed. Health: {}", report.get("overallSyncHealth"));
        return report;
    }

    /**
     * Force sync repair for a course (emergency use)
     */
    public Map<String, Object> forceSyncRepair(String courseId) {
        try {
            Map<String, Object> before = verifyCourse(courseId);
            if (Boolean.TRUE.equals(before.get("inSync"))) {
                return Map.of("action", "no_repair_needed", "courseId", courseId, "success", true);
            }
            int rewritten = cacheSynchronizer.rebuildCourse(courseId, null).size();
            logger.info("Repaired cache for course {} ({} key(s) rewritten)", courseId, rewritten);
            return Map.of("action", "rebuilt", "courseId", courseId, "success", true, "rewrittenKeys", rewritten);
        } catch (RuntimeException e) {
            logger.error("Error during force sync repair for course: {}", courseId, e);
            return Map.of("action", "repair_failed", "courseId", courseId, "success", false,
                    "error", String.valueOf(e.getMessage()));
        }
    }

    /**
     * Scheduled health check over every cached course.
     */
    @Scheduled(fixedDelayString = "${app.cache.health-check.interval-ms:300000}",
            initialDelayString = "${app.cache.health-check.initial-delay-ms:60000}")
    public void scheduledSyncHealthCheck() {
        try {
            Map<String, Object> report = verifyCacheSync();
            if ("HEALTHY".equals(report.get("overallSyncHealth"))) {
                logger.debug("Cache sync health check passed");
                return;
            }
            logger.warn("Cache sync health check failed: {}", report);
            if (autoRepair) {
                for (Object courseId : (List<?>) report.get("outOfSyncCourses")) {
                    forceSyncRepair(courseId.toString());
                }
            }
        } catch (RuntimeException e) {
            logger.error("Error during scheduled sync health check", e);
        }
    }
}
