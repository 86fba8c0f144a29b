package com.example.learningsession.mcp;

import com.example.learningsession.service.CacheSyncVerificationService;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.stereotype.Service;

import java.util.Map;

@Service
public class SyncVerificationTools {

    private final CacheSyncVerificationService syncVerificationService;

    public SyncVerificationTools(CacheSyncVerificationService syncVerificationService) {
        this.syncVerificationService = syncVerificationService;
    }

    @Tool(description = "Verify that every cached course agrees with its video caches and the activity store")
    public Map<String, Object> verify_cache_sync() {
        return syncVerificationService.verifyCacheSync();
    }

    @Tool(description = "Verify cache agreement for one course")
    public Map<String, Object> verify_course_cache(String courseId) {
        return syncVerificationService.verifyCourse(courseId);
    }

    @Tool(description = "Rebuild the video and course caches of a course from the activity store (emergency use only)")
    public Map<String, Object> force_cache_repair(String courseId) {
        return syncVerificationService.forceSyncRepair(courseId);
    }
}
