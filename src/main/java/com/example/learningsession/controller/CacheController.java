package com.example.learningsession.controller;

import com.example.learningsession.model.CourseActivitySnapshot;
import com.example.learningsession.service.ActivityCacheReader;
import com.example.learningsession.service.CacheSyncVerificationService;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/caches")
public class CacheController {

    private final ActivityCacheReader cacheReader;
    private final CacheSyncVerificationService verificationService;

    public CacheController(ActivityCacheReader cacheReader, CacheSyncVerificationService verificationService) {
        this.cacheReader = cacheReader;
        this.verificationService = verificationService;
    }

    @GetMapping("/videos/{videoId}")
    public ActivityCacheReader.ActivityCacheView video(@PathVariable String videoId, @RequestParam String courseId) {
        return cacheReader.read(videoId, courseId);
    }

    @GetMapping("/courses/{courseId}")
    public CourseActivitySnapshot course(@PathVariable String courseId) {
        return cacheReader.readCourse(courseId);
    }

    @GetMapping("/courses/{courseId}/verify")
    public Map<String, Object> verify(@PathVariable String courseId) {
        return verificationService.verifyCourse(courseId);
    }

    @PostMapping("/courses/{courseId}/repair")
    public Map<String, Object> repair(@PathVariable String courseId) {
        return verificationService.forceSyncRepair(courseId);
    }
}
