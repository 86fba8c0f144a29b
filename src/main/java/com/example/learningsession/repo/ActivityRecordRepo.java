package com.example.learningsession.repo;

import com.example.learningsession.model.ActivityRecord;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

public interface ActivityRecordRepo extends MongoRepository<ActivityRecord, String> {
    List<ActivityRecord> findBySessionIdOrderByCreatedAtAsc(String sessionId);
    List<ActivityRecord> findByCourseId(String courseId);
    long countBySessionId(String sessionId);
    long deleteByVideoId(String videoId);
    long deleteByCourseId(String courseId);
}
