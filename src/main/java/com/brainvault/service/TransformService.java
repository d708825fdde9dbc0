package com.brainvault.service;

import com.brainvault.dto.response.TransformResponse;
import com.brainvault.entity.Idea;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Turns an idea into derived text: engaging content, an intellectual property outline, or
 * a task breakdown.
 *
 * Transformation Flow:
 * 1. Resolve the output type; unknown types fail before anything else happens
 * 2. Load the idea for the caller (404 if absent or foreign)
 * 3. Build the type-specific instruction embedding the idea content
 * 4. Call the first configured generation provider (xAI, then OpenAI)
 * 5. On no provider, a failed call or an empty reply, use the type's local fallback text
 * 6. Overwrite the idea's transformed_output and return the result
 *
 * The operation fails only when the idea itself cannot be loaded or stored.
 *
 * @see GenerationProvider
 * @see OutputType
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class TransformService {

    static final String SYSTEM_PROMPT = "You are an AI assistant that helps transform ideas into actionable content.";

    private final IdeaService ideaService;
    private final ObjectProvider<GenerationProvider> generationProviders;

    /**
     * @param ideaId id of the caller's idea
     * @param owner the caller's external auth id
     * @param outputType one of content, ip, tasks
     * @throws IllegalArgumentException if outputType is not supported
     * @throws com.brainvault.exception.ResourceNotFoundException if the idea is not visible to the caller
     */
    public TransformResponse transform(Long ideaId, String owner, String outputType) {
        OutputType type = OutputType.fromValue(outputType);
        Idea idea = ideaService.getIdea(ideaId, owner);

        log.info("Transforming idea: id={}, user={}, outputType={}", ideaId, owner, type.getValue());

        String transformed = generate(type, type.buildPrompt(idea.getContent()));

        ideaService.saveTransformedOutput(ideaId, owner, transformed);
        log.info("Transformation stored: id={}, outputType={}, length={}", ideaId, type.getValue(), transformed.length());

        return TransformResponse.builder()
                .transformedContent(transformed)
                .ideaId(ideaId)
                .outputType(type.getValue())
                .build();
    }

    private String generate(OutputType type, String prompt) {
        Optional<GenerationProvider> provider = generationProviders.orderedStream().findFirst();
        if (provider.isEmpty()) {
            log.info("No generation provider configured, using local fallback: outputType={}", type.getValue());
            return type.getFallback();
        }

        GenerationProvider selected = provider.get();
        try {
            String generated = selected.generate(SYSTEM_PROMPT, prompt);
            if (generated == null || generated.trim().isEmpty()) {
                log.warn("Generation provider {} returned empty text, using local fallback", selected.getName());
                return type.getFallback();
            }
            log.info("Generated with provider: {}", selected.getName());
            return generated;
        } catch (Exception e) {
            log.warn("Generation provider {} failed, using local fallback: {}", selected.getName(), e.getMessage());
            return type.getFallback();
        }
    }
}
