package com.example.learningsession.model;

import lombok.*;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@Document("activity_records")
@CompoundIndex(name = "session_video_trigger", def = "{'sessionId': 1, 'videoId': 1, 'triggerTimestampSeconds': 1}")
public class ActivityRecord {
    @Id
    private String id;
    private String sessionId;
    private String userId;
    private String videoId;
    private String courseId;
    private String messageId;
    private String triggerId;
    private AgentType activityType;
    private double triggerTimestampSeconds;
    private Map<String, Object> resultPayload;
    private Instant createdAt;

    /**
     * Names of the required ownership fields that are missing. Records with
     * any missing field are never written.
     */
    public List<String> missingRequiredFields() {
        List<String> missing = new ArrayList<>();
        if (isBlank(id)) missing.add("id");
        if (isBlank(sessionId)) missing.add("sessionId");
        if (isBlank(videoId)) missing.add("videoId");
        if (isBlank(courseId)) missing.add("courseId");
        return missing;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
