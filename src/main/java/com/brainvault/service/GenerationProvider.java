package com.brainvault.service;

import org.springframework.core.Ordered;

/**
 * An external text generation capability.
 *
 * Implementations are ranked through {@link Ordered}; the lowest order value is the primary
 * provider. Only configured providers are registered as beans, so the first one in order is
 * the one TransformService calls.
 */
public interface GenerationProvider extends Ordered {

    /**
     * @return short provider name used in logs (e.g. "xai")
     */
    String getName();

    /**
     * Generate text for the given instructions.
     *
     * @param systemPrompt system instruction
     * @param userPrompt user instruction, embedding the idea content
     * @return generated text, possibly empty
     * @throws RuntimeException if the provider call fails
     */
    String generate(String systemPrompt, String userPrompt);
}
