package com.example.learningsession.model;

import lombok.*;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@Document("viewing_sessions")
public class ViewingSession {
    @Id
    private String sessionId;
    private String userId;
    private String videoId;
    private String courseId;
    private String status; // OPEN | CLOSED
    private Instant startedAt;
    private Instant lastActivityAt;
    private Instant closedAt;
    private Integer activityCount;
}
