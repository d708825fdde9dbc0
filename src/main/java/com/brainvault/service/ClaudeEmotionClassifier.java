package com.brainvault.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.model.ChatResponse;

import java.util.Locale;
import java.util.Map;

/**
 * Emotion classifier using Claude through Spring AI.
 *
 * Claude is asked for a one-field JSON document naming the dominant emotion of an idea.
 * The reply is parsed with Jackson after stripping markdown code fences; a label outside
 * {@link EmotionClassifier#LABELS} is normalized to "neutral".
 *
 * Expected Output:
 * <pre>{ "emotion": "excited" }</pre>
 *
 * Error Handling:
 * - Empty reply or invalid JSON: throws RuntimeException
 * - API errors: throws RuntimeException with details
 * - EnrichmentService catches all of these and falls back to "neutral"
 *
 * Registered by SpringAIConfig only when an Anthropic API key is configured.
 */
@Slf4j
@RequiredArgsConstructor
public class ClaudeEmotionClassifier implements EmotionClassifier {

    private final ChatClient claudeClient;
    private final ObjectMapper objectMapper;

    private static final String SYSTEM_PROMPT = """
            You classify the emotional tone of short personal notes and ideas.

            Choose exactly one label from: excited, happy, curious, concerned, frustrated, neutral.

            Rules:
            - Pick the single dominant emotion expressed by the author
            - Use neutral when no emotion is clearly expressed
            - Return ONLY valid JSON, no additional text or explanations

            Output format (JSON):
            { "emotion": "<label>" }
            """;

    @Override
    public String classify(String content) {
        if (content == null || content.trim().isEmpty()) {
            throw new IllegalArgumentException("Content cannot be null or empty");
        }

        log.debug("Classifying emotion: contentLength={}", content.length());

        ChatResponse response;
        try {
            response = claudeClient.prompt()
                    .system(SYSTEM_PROMPT)
                    .user(content)
                    .call()
                    .chatResponse();
        } catch (Exception e) {
            throw new RuntimeException("Emotion classification failed: " + e.getMessage(), e);
        }

        String jsonResponse = response != null && response.getResult() != null
                ? response.getResult().getOutput().getText()
                : null;

        if (jsonResponse == null || jsonResponse.trim().isEmpty()) {
            throw new RuntimeException("Emotion classification failed: empty response from model");
        }

        try {
            Map<String, Object> parsed = parseJsonResponse(jsonResponse);
            return normalize(parsed.get("emotion"));
        } catch (JsonProcessingException e) {
            throw new RuntimeException(
                    "Emotion classification failed: Invalid JSON response from AI model. " + e.getMessage(),
                    e
            );
        }
    }

    private Map<String, Object> parseJsonResponse(String jsonResponse) throws JsonProcessingException {
        // Strip markdown code fences if present
        String cleanedJson = jsonResponse.trim();
        if (cleanedJson.startsWith("```json")) {
            cleanedJson = cleanedJson.substring(7);
        } else if (cleanedJson.startsWith("```")) {
            cleanedJson = cleanedJson.substring(3);
        }
        if (cleanedJson.endsWith("```")) {
            cleanedJson = cleanedJson.substring(0, cleanedJson.length() - 3);
        }
        cleanedJson = cleanedJson.trim();

        return objectMapper.readValue(cleanedJson, new TypeReference<>() {});
    }

    private String normalize(Object label) {
        if (!(label instanceof String)) {
            log.warn("Emotion classifier returned no label, defaulting to '{}'", NEUTRAL);
            return NEUTRAL;
        }
        String emotion = ((String) label).trim().toLowerCase(Locale.ROOT);
        if (!LABELS.contains(emotion)) {
            log.warn("Unknown emotion '{}' detected, defaulting to '{}'", emotion, NEUTRAL);
            return NEUTRAL;
        }
        return emotion;
    }
}
