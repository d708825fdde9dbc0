package com.brainvault.dto.request;

import com.brainvault.service.OutputType;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request body for POST /api/v1/transform.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class TransformRequest {

    @NotNull(message = "Idea id is required")
    private Long ideaId;

    @NotBlank(message = "Output type is required")
    @Pattern(regexp = OutputType.ALLOWED_VALUES_PATTERN, message = "Output type must be one of: content, ip, tasks")
    private String outputType;
}
