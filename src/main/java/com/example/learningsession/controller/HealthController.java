package com.example.learningsession.controller;

import com.example.learningsession.kv.KvClient;
import com.example.learningsession.repo.ActivityRecordRepo;
import com.example.learningsession.session.SessionRegistry;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.HashMap;
import java.util.Map;

@RestController
public class HealthController {

    private final KvClient kvClient;
    private final ActivityRecordRepo activityRecordRepo;
    private final SessionRegistry sessionRegistry;

    public HealthController(KvClient kvClient, ActivityRecordRepo activityRecordRepo, SessionRegistry sessionRegistry) {
        this.kvClient = kvClient;
        this.activityRecordRepo = activityRecordRepo;
        this.sessionRegistry = sessionRegistry;
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> health = new HashMap<>();
        health.put("status", "UP");
        health.put("service", "learning-session-coordinator");
        health.put("version", "0.1.0");
        health.put("openSessions", sessionRegistry.activeSessionCount());

        try {
            kvClient.get("health-check");
            health.put("redis", "UP");
        } catch (Exception e) {
            health.put("redis", "DOWN");
            health.put("redisError", e.getMessage());
        }

        try {
            activityRecordRepo.count();
            health.put("mongodb", "UP");
        } catch (Exception e) {
            health.put("mongodb", "DOWN");
            health.put("mongodbError", e.getMessage());
        }

        return ResponseEntity.ok(health);
    }
}
