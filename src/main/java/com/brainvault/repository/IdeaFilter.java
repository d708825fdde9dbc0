package com.brainvault.repository;

import lombok.Builder;
import lombok.Value;

/**
 * Optional equality filters for listing ideas. Null fields are ignored; present fields
 * are combined with AND.
 */
@Value
@Builder
public class IdeaFilter {

    String project;
    String theme;
    String emotion;

    public static IdeaFilter none() {
        return IdeaFilter.builder().build();
    }
}
