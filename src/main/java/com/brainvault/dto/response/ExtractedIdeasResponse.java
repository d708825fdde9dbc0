package com.brainvault.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Response of POST /api/v1/voice/extract-ideas.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExtractedIdeasResponse {

    /**
     * Candidate ideas in transcript order, at most 10.
     */
    private List<String> ideas;

    private String transcription;

    private String storageUrl;

    /**
     * Ideas captured when save=true, empty otherwise.
     */
    private List<IdeaResponse> savedIdeas;
}
