package com.brainvault.dto.response;

import com.brainvault.entity.Idea;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Enrichment view of a single idea.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IdeaAnalysisResponse {

    private Long id;

    private String content;

    private String project;

    private String theme;

    private String emotion;

    public static IdeaAnalysisResponse from(Idea idea) {
        return IdeaAnalysisResponse.builder()
                .id(idea.getId())
                .content(idea.getContent())
                .project(idea.getProject())
                .theme(idea.getTheme())
                .emotion(idea.getEmotion())
                .build();
    }
}
