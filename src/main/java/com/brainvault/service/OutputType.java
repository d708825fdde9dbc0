package com.brainvault.service;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Kinds of derived text the transformation engine produces.
 *
 * Each kind carries its instruction template and the local fallback returned when no
 * generation provider is configured or the provider call fails.
 */
public enum OutputType {

    CONTENT("content",
            """
            Transform this idea into engaging content:

            Original idea: %s

            Please create compelling content that expands on this idea, making it more detailed and engaging for readers.
            """,
            "This is a generated content based on your idea. In a production environment, "
                    + "this would be enhanced by AI-powered content generation."),

    IP("ip",
            """
            Transform this idea into intellectual property content:

            Original idea: %s

            Please create detailed intellectual property content including:
            - Patentable concepts
            - Copyrightable material
            - Trademark considerations
            - Trade secret elements
            """,
            "Intellectual Property Analysis:\n- Patent considerations\n- Copyright elements\n"
                    + "- Trademark opportunities\n- Trade secret aspects"),

    TASKS("tasks",
            """
            Transform this idea into actionable tasks:

            Original idea: %s

            Please break down this idea into specific, actionable tasks that can be executed to bring this idea to life.
            Include timelines, priorities, and resource requirements.
            """,
            "Actionable Tasks:\n1. Research and validate the idea\n2. Create a detailed plan\n"
                    + "3. Identify required resources\n4. Set milestones and timelines");

    public static final String ALLOWED_VALUES_PATTERN = "content|ip|tasks";

    private final String value;
    private final String promptTemplate;
    private final String fallback;

    OutputType(String value, String promptTemplate, String fallback) {
        this.value = value;
        this.promptTemplate = promptTemplate;
        this.fallback = fallback;
    }

    public String getValue() {
        return value;
    }

    public String getFallback() {
        return fallback;
    }

    /**
     * Build the user instruction for this kind, embedding the idea content verbatim.
     */
    public String buildPrompt(String ideaContent) {
        // Content goes in as an argument, never as part of the format string
        return String.format(promptTemplate, ideaContent);
    }

    /**
     * Resolve a wire value.
     *
     * @throws IllegalArgumentException if the value is not one of content, ip, tasks
     */
    public static OutputType fromValue(String value) {
        if (value != null) {
            String normalized = value.trim().toLowerCase(Locale.ROOT);
            for (OutputType type : values()) {
                if (type.value.equals(normalized)) {
                    return type;
                }
            }
        }
        throw new IllegalArgumentException("Invalid output type. Must be one of: " + allowedValues());
    }

    private static String allowedValues() {
        return Arrays.stream(values()).map(OutputType::getValue).collect(Collectors.joining(", "));
    }
}
