package com.brainvault.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Per-owner idea statistics.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IdeaStatsResponse {

    private long totalIdeas;

    /**
     * Ideas created since the first instant of the current calendar month (server time zone).
     */
    private long ideasThisMonth;

    private long projectsCount;

    private long themesCount;

    private long emotionsCount;
}
