package com.example.learningsession.service;

import com.example.learningsession.model.CourseActivitySnapshot;
import com.example.learningsession.model.VideoActivitySnapshot;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Key layout and JSON form of the activity caches.
 */
@Component
public class CacheSnapshotCodec {

    public static final String VIDEO_PREFIX = "cache:video:";
    public static final String COURSE_PREFIX = "cache:course:";

    private final ObjectMapper objectMapper;

    public CacheSnapshotCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public static String videoKey(String videoId) {
        return VIDEO_PREFIX + videoId;
    }

    public static String courseKey(String courseId) {
        return COURSE_PREFIX + courseId;
    }

    public Optional<VideoActivitySnapshot> readVideo(String json) {
        return read(json, VideoActivitySnapshot.class);
    }

    public Optional<CourseActivitySnapshot> readCourse(String json) {
        return read(json, CourseActivitySnapshot.class);
    }

    public String write(Object snapshot) {
        try {
            return objectMapper.writeValueAsString(snapshot);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize " + snapshot.getClass().getSimpleName(), e);
        }
    }

    private <T> Optional<T> read(String json, Class<T> type) {
        if (json == null || json.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(json, type));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt " + type.getSimpleName() + " in cache", e);
        }
    }
}
