package com.brainvault.dto.request;

import com.brainvault.entity.Idea;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.validator.constraints.CodePointLength;

/**
 * Request body for capturing a new idea.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class IdeaCreateRequest {

    @NotNull(message = "Content is required")
    @CodePointLength(min = 1, max = Idea.MAX_CONTENT_LENGTH, message = "Content must be between 1 and 10000 characters")
    private String content;

    /**
     * Origin tag, e.g. "manual" or "voice". Defaults to "manual".
     */
    @Size(max = 50, message = "Source must be at most 50 characters")
    private String source;
}
