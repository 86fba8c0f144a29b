package com.example.learningsession.service;

import com.example.learningsession.exception.InvalidResponseException;
import com.example.learningsession.model.AgentType;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Turns a user's submission for a prompt into the payload of its activity record.
 *
 * <p>Quiz answers are scored against the authored {@code questions}: each
 * question carries a {@code correctAnswer} option index and the submission an
 * {@code answers} list with one index per question.
 */
@Component
public class ActivityResultEvaluator {

    public Map<String, Object> evaluate(AgentType agentType, Map<String, Object> agentPayload, Map<String, Object> response) {
        if (agentType == null) {
            throw new InvalidResponseException("Message is not an agent prompt");
        }
        Map<String, Object> submitted = response == null ? Map.of() : response;
        switch (agentType) {
            case QUIZ:
                return scoreQuiz(agentPayload, submitted);
            case REFLECTION:
                return reflection(submitted);
            case CHECKPOINT:
            case HINT:
            case PATH:
                return new LinkedHashMap<>(submitted);
            default:
                throw new IllegalStateException("Unhandled agent type " + agentType);
        }
    }

    private Map<String, Object> scoreQuiz(Map<String, Object> agentPayload, Map<String, Object> response) {
        List<?> questions = agentPayload == null ? null : asList(agentPayload.get("questions"));
        if (questions == null || questions.isEmpty()) {
            throw new InvalidResponseException("Quiz has no questions");
        }
        List<?> answers = asList(response.get("answers"));
        if (answers == null) {
            throw new InvalidResponseException("Quiz response requires an answers list");
        }
        if (answers.size() != questions.size()) {
            throw new InvalidResponseException("Expected " + questions.size() + " answers, got " + answers.size());
        }

        int score = 0;
        List<Integer> userAnswers = new ArrayList<>();
        for (int i = 0; i < questions.size(); i++) {
            Object answer = answers.get(i);
            if (!(answer instanceof Number)) {
                throw new InvalidResponseException("Answer " + (i + 1) + " must be an option index");
            }
            int chosen = ((Number) answer).intValue();
            userAnswers.add(chosen);
            Object question = questions.get(i);
            Object correct = question instanceof Map ? ((Map<?, ?>) question).get("correctAnswer") : null;
            if (correct instanceof Number && ((Number) correct).intValue() == chosen) {
                score++;
            }
        }

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("score", score);
        result.put("totalQuestions", questions.size());
        result.put("percentage", Math.round(score * 100.0 / questions.size()));
        result.put("userAnswers", userAnswers);
        return result;
    }

    private Map<String, Object> reflection(Map<String, Object> response) {
        String content = text(response.get("content"));
        String mediaUrl = text(response.get("mediaUrl"));
        if (content == null && mediaUrl == null) {
            throw new InvalidResponseException("Reflection requires content or mediaUrl");
        }
        Map<String, Object> result = new LinkedHashMap<>();
        if (content != null) {
            result.put("content", content);
        }
        if (mediaUrl != null) {
            result.put("mediaUrl", mediaUrl);
            result.put("mediaType", Objects.toString(response.get("mediaType"), "audio"));
        }
        Object duration = response.get("durationSeconds");
        if (duration != null) {
            if (!(duration instanceof Number) || ((Number) duration).doubleValue() < 0) {
                throw new InvalidResponseException("durationSeconds must be a non-negative number");
            }
            result.put("durationSeconds", ((Number) duration).doubleValue());
        }
        return result;
    }

    private static List<?> asList(Object value) {
        return value instanceof List ? (List<?>) value : null;
    }

    private static String text(Object value) {
        if (value == null) return null;
        String s = value.toString().trim();
        return s.isEmpty() ? null : s;
    }
}
