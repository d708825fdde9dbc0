package com.brainvault.dto.response;

import com.brainvault.entity.Idea;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Response DTO for an idea.
 *
 * Enrichment fields are null until the enrichment pipeline (or an explicit update) has set
 * them; transformed_output holds the latest transformation result.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IdeaResponse {

    private Long id;

    private String userId;

    private String content;

    private String source;

    /**
     * Creation time of the idea.
     */
    private LocalDateTime timestamp;

    private String project;

    private String theme;

    private String emotion;

    private String transformedOutput;

    public static IdeaResponse from(Idea idea) {
        return IdeaResponse.builder()
                .id(idea.getId())
                .userId(idea.getUserId())
                .content(idea.getContent())
                .source(idea.getSource())
                .timestamp(idea.getCreatedAt())
                .project(idea.getProject())
                .theme(idea.getTheme())
                .emotion(idea.getEmotion())
                .transformedOutput(idea.getTransformedOutput())
                .build();
    }
}
