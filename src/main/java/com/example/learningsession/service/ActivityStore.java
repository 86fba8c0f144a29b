package com.example.learningsession.service;

import com.example.learningsession.model.ActivityRecord;
import com.example.learningsession.repo.ActivityRecordRepo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Durable home of activity records. Records are single-document inserts and
 * are never updated; they disappear when their video or course is deleted, or
 * when the prompt they answer was dismissed while they were being stored.
 */
@Service
public class ActivityStore {

    private static final Logger logger = LoggerFactory.getLogger(ActivityStore.class);

    private final ActivityRecordRepo activityRecordRepo;

    @Value("${app.activity.max-attempts:3}")
    private int maxAttempts = 3;

    @Value("${app.activity.retry-backoff-ms:100}")
    private long retryBackoffMs = 100L;

    public ActivityStore(ActivityRecordRepo activityRecordRepo) {
        this.activityRecordRepo = activityRecordRepo;
    }

    /**
     * Inserts {@code record}, retrying transient failures. Never throws.
     */
    public PersistResult persistActivity(ActivityRecord record) {
        List<String> missing = record.missingRequiredFields();
        if (!missing.isEmpty()) {
            logger.error("Refusing activity record for message {} without {}", record.getMessageId(), missing);
            return PersistResult.failure("Missing required fields " + missing, false);
        }
        if (record.getCreatedAt() == null) {
            record.setCreatedAt(Instant.now());
        }

        int attempts = Math.max(maxAttempts, 1);
        String lastError = null;
        for (int attempt = 1; attempt <= attempts; attempt++) {
            try {
                ActivityRecord saved = activityRecordRepo.insert(record);
                logger.debug("Stored activity {} for session {} on attempt {}", saved.getId(), saved.getSessionId(), attempt);
                return PersistResult.success(saved.getId());
            } catch (DuplicateKeyException e) {
                // an earlier attempt landed before its acknowledgement was lost
                if (activityRecordRepo.existsById(record.getId())) {
                    logger.info("Activity {} already stored, treating retry as success", record.getId());
                    return PersistResult.success(record.getId());
                }
                return PersistResult.failure("Duplicate key: " + e.getMessage(), false);
            } catch (Exception e) {
                lastError = e.getMessage();
                logger.warn("Attempt {}/{} to store activity {} failed: {}", attempt, attempts, record.getId(), e.getMessage());
                if (attempt < attempts && !backoff(attempt)) {
                    return PersistResult.failure("Interrupted while retrying", true);
                }
            }
        }
        logger.error("Giving up on activity {} after {} attempt(s)", record.getId(), attempts);
        return PersistResult.failure(lastError != null ? lastError : "Activity store unavailable", true);
    }

    private boolean backoff(int attempt) {
        if (retryBackoffMs <= 0) {
            return true;
        }
        try {
            Thread.sleep(retryBackoffMs * attempt);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    /**
     * Removes a record whose prompt was rejected after the insert went through.
     *
     * @return false if the record could not be removed; it then stays until its video is deleted
     */
    public boolean discardActivity(String recordId) {
        try {
            activityRecordRepo.deleteById(recordId);
            logger.debug("Discarded activity {}", recordId);
            return true;
        } catch (Exception e) {
            logger.error("Failed to discard activity {}: {}", recordId, e.getMessage());
            return false;
        }
    }

    public List<ActivityRecord> findBySession(String sessionId) {
        return activityRecordRepo.findBySessionIdOrderByCreatedAtAsc(sessionId);
    }

    public long countBySession(String sessionId) {
        return activityRecordRepo.countBySessionId(sessionId);
    }

    public List<ActivityRecord> findByCourse(String courseId) {
        return activityRecordRepo.findByCourseId(courseId);
    }

    public long deleteForVideo(String videoId) {
        long deleted = activityRecordRepo.deleteByVideoId(videoId);
        logger.info("Deleted {} activity record(s) of video {}", deleted, videoId);
        return deleted;
    }

    public long deleteForCourse(String courseId) {
        long deleted = activityRecordRepo.deleteByCourseId(courseId);
        logger.info("Deleted {} activity record(s) of course {}", deleted, courseId);
        return deleted;
    }

    /**
     * Result class for persist operations
     */
    public static class PersistResult {
        private final boolean success;
        private final String id;
        private final String reason;
        private final boolean retryable;

        private PersistResult(boolean success, String id, String reason, boolean retryable) {
            this.success = success;
            this.id = id;
            this.reason = reason;
            this.retryable = retryable;
        }

        public static PersistResult success(String id) {
            return new PersistResult(true, id, null, false);
        }

        public static PersistResult failure(String reason, boolean retryable) {
            return new PersistResult(false, null, reason, retryable);
        }

        public boolean isSuccess() { return success; }
        public String getId() { return id; }
        public String getReason() { return reason; }
        public boolean isRetryable() { return retryable; }

        public Map<String, Object> toMap() {
            return success
                    ? Map.of("success", true, "id", id)
                    : Map.of("success", false, "reason", reason, "retryable", retryable);
        }
    }
}
