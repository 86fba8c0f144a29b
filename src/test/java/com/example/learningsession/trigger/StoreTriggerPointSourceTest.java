package com.example.learningsession.trigger;

import com.example.learningsession.exception.TriggerConfigurationException;
import com.example.learningsession.model.AgentType;
import com.example.learningsession.store.StoreClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class StoreTriggerPointSourceTest {

    @Mock
    private StoreClient storeClient;

    private StoreTriggerPointSource source;

    @BeforeEach
    void setUp() {
        source = new StoreTriggerPointSource(storeClient, "video_triggers");
    }

    @Test
    void testFindByVideoId_ParsesDocuments() {
        // Given
        when(storeClient.find(eq("video_triggers"), eq(Map.of("videoId", "v1")), anyMap(), isNull()))
                .thenReturn(List.of(
                        Map.of("videoId", "v1", "triggerId", "t1", "timestampSeconds", 120, "agentType", "quiz",
                                "agentPayload", Map.of("questions", List.of(Map.of("correctAnswer", 0)))),
                        Map.of("videoId", "v1", "timestampSeconds", 30.5, "agentType", "reflect")));

        // When
        List<TriggerPoint> points = source.findByVideoId("v1");

        // Then
        assertEquals(2, points.size());
        assertEquals("t1", points.get(0).getId());
        assertEquals(AgentType.QUIZ, points.get(0).getAgentType());
        assertEquals(120.0, points.get(0).getTimestampSeconds());
        assertEquals(AgentType.REFLECTION, points.get(1).getAgentType());
        assertEquals("v1@30.5:REFLECTION", points.get(1).getId());
    }

    @Test
    void testFindByVideoId_UnknownAgentType() {
        // Given
        when(storeClient.find(eq("video_triggers"), anyMap(), anyMap(), isNull()))
                .thenReturn(List.of(Map.of("timestampSeconds", 10, "agentType", "dance")));

        // When / Then
        assertThrows(TriggerConfigurationException.class, () -> source.findByVideoId("v1"));
    }
}
