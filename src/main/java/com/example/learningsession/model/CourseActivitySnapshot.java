package com.example.learningsession.model;

import lombok.*;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Cached activity state for one course, stored under {@code cache:course:<courseId>}.
 * {@link #videoCounts} must always agree with the video snapshots it summarizes.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CourseActivitySnapshot {
    private String courseId;
    private int activityCount;
    @Builder.Default
    private Map<String, Integer> videoCounts = new LinkedHashMap<>();
    @Builder.Default
    private List<String> appliedOperationIds = new ArrayList<>();
    private long version;
    private Instant updatedAt;

    public static CourseActivitySnapshot empty(String courseId) {
        return CourseActivitySnapshot.builder()
                .courseId(courseId)
                .build();
    }

    public void recount() {
        this.activityCount = videoCounts.values().stream().mapToInt(Integer::intValue).sum();
    }
}
