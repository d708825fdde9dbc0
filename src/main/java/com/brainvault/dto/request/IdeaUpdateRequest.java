package com.brainvault.dto.request;

import com.brainvault.entity.Idea;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.validator.constraints.CodePointLength;

/**
 * Partial update of an idea. Null fields are left untouched; an empty body is a valid no-op.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IdeaUpdateRequest {

    @CodePointLength(min = 1, max = Idea.MAX_CONTENT_LENGTH, message = "Content must be between 1 and 10000 characters")
    private String content;

    @Size(max = 100, message = "Project must be at most 100 characters")
    private String project;

    @Size(max = 100, message = "Theme must be at most 100 characters")
    private String theme;

    @Size(max = 50, message = "Emotion must be at most 50 characters")
    private String emotion;

    private String transformedOutput;

    public boolean isEmpty() {
        return content == null && project == null && theme == null
                && emotion == null && transformedOutput == null;
    }
}
