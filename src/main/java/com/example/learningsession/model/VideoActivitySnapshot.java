package com.example.learningsession.model;

import lombok.*;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Cached activity state for one video, stored under {@code cache:video:<videoId>}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class VideoActivitySnapshot {
    private String videoId;
    private String courseId;
    private int activityCount;
    @Builder.Default
    private List<String> activityIds = new ArrayList<>();
    @Builder.Default
    private List<String> appliedOperationIds = new ArrayList<>();
    private long version;
    private Instant updatedAt;

    public static VideoActivitySnapshot empty(String videoId, String courseId) {
        return VideoActivitySnapshot.builder()
                .videoId(videoId)
                .courseId(courseId)
                .build();
    }
}
