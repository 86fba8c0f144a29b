package com.example.learningsession.controller;

import com.example.learningsession.service.ActivityPurgeService;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/activities")
public class ActivityController {

    private final ActivityPurgeService purgeService;

    public ActivityController(ActivityPurgeService purgeService) {
        this.purgeService = purgeService;
    }

    @DeleteMapping("/videos/{videoId}")
    public Map<String, Object> deleteVideo(@PathVariable String videoId, @RequestParam String courseId) {
        return purgeService.purgeVideo(videoId, courseId);
    }

    @DeleteMapping("/courses/{courseId}")
    public Map<String, Object> deleteCourse(@PathVariable String courseId) {
        return purgeService.purgeCourse(courseId);
    }
}
