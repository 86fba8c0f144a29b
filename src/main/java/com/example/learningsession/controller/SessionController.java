package com.example.learningsession.controller;

import com.example.learningsession.ledger.MessageFilter;
import com.example.learningsession.ledger.MessageView;
import com.example.learningsession.model.AgentType;
import com.example.learningsession.model.Message;
import com.example.learningsession.session.SessionContext;
import com.example.learningsession.session.SessionRegistry;
import com.example.learningsession.session.SessionStateMachine;
import com.example.learningsession.session.TransitionResult;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * Inbound surface of the playback UI.
 */
@RestController
@RequestMapping("/sessions")
public class SessionController {

    private final SessionRegistry sessionRegistry;

    public SessionController(SessionRegistry sessionRegistry) {
        this.sessionRegistry = sessionRegistry;
    }

    @PostMapping
    public ResponseEntity<SessionContext> open(@RequestBody Map<String, Object> body) {
        SessionStateMachine machine = sessionRegistry.open(
                text(body, "sessionId"), text(body, "userId"), text(body, "videoId"), text(body, "courseId"));
        return ResponseEntity.status(HttpStatus.CREATED).body(machine.getContext());
    }

    @GetMapping("/{sessionId}")
    public SessionContext context(@PathVariable String sessionId) {
        return sessionRegistry.get(sessionId).getContext();
    }

    @DeleteMapping("/{sessionId}")
    public SessionContext close(@PathVariable String sessionId) {
        return sessionRegistry.close(sessionId);
    }

    @PostMapping("/{sessionId}/time")
    public Map<String, Object> timeUpdate(@PathVariable String sessionId, @RequestBody Map<String, Object> body) {
        SessionStateMachine machine = sessionRegistry.get(sessionId);
        List<Message> prompts = machine.onTimeUpdate(number(body, "positionSeconds"));
        return Map.of("prompts", prompts, "context", machine.getContext());
    }

    @PostMapping("/{sessionId}/pause")
    public Map<String, Object> pause(@PathVariable String sessionId, @RequestBody Map<String, Object> body) {
        return sessionRegistry.get(sessionId).onManualPause(number(body, "positionSeconds")).toMap();
    }

    @PostMapping("/{sessionId}/agents")
    @SuppressWarnings("unchecked")
    public Map<String, Object> requestAgent(@PathVariable String sessionId, @RequestBody Map<String, Object> body) {
        AgentType agentType = AgentType.parse(text(body, "agentType"));
        Object payload = body.get("payload");
        TransitionResult result = sessionRegistry.get(sessionId)
                .requestAgent(agentType, payload instanceof Map ? (Map<String, Object>) payload : Map.of());
        return result.toMap();
    }

    @PostMapping("/{sessionId}/messages/{messageId}/response")
    public Map<String, Object> respond(@PathVariable String sessionId, @PathVariable String messageId,
                                       @RequestBody Map<String, Object> body) {
        return sessionRegistry.get(sessionId).onUserResponse(messageId, body).toMap();
    }

    @PostMapping("/{sessionId}/messages/{messageId}/dismiss")
    public Map<String, Object> dismiss(@PathVariable String sessionId, @PathVariable String messageId) {
        return sessionRegistry.get(sessionId).onUserDismiss(messageId).toMap();
    }

    @PostMapping("/{sessionId}/chat")
    public Message chat(@PathVariable String sessionId, @RequestBody Map<String, Object> body) {
        return sessionRegistry.get(sessionId).appendConversation(text(body, "role"), text(body, "text"));
    }

    @GetMapping("/{sessionId}/messages")
    public List<Message> messages(@PathVariable String sessionId, @RequestParam(required = false) String view) {
        MessageFilter filter = view == null || view.isBlank()
                ? MessageFilter.ALL
                : MessageFilter.forView(MessageView.valueOf(view.trim().toUpperCase()));
        return sessionRegistry.get(sessionId).query(filter);
    }

    private static String text(Map<String, Object> body, String key) {
        Object value = body == null ? null : body.get(key);
        return value == null ? null : value.toString();
    }

    private static double number(Map<String, Object> body, String key) {
        Object value = body == null ? null : body.get(key);
        if (!(value instanceof Number)) {
            throw new IllegalArgumentException(key + " must be a number");
        }
        return ((Number) value).doubleValue();
    }
}
