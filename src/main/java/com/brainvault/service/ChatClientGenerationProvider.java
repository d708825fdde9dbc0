package com.brainvault.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.metadata.Usage;
import org.springframework.ai.chat.model.ChatResponse;

/**
 * {@link GenerationProvider} backed by a Spring AI {@link ChatClient}.
 *
 * One instance is created per configured provider in SpringAIConfig. Token budget and
 * temperature are carried by the chat model's default options, so every call uses the
 * same fixed parameters.
 */
@Slf4j
public class ChatClientGenerationProvider implements GenerationProvider {

    private final String name;
    private final int order;
    private final ChatClient chatClient;

    public ChatClientGenerationProvider(String name, int order, ChatClient chatClient) {
        this.name = name;
        this.order = order;
        this.chatClient = chatClient;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public int getOrder() {
        return order;
    }

    @Override
    public String generate(String systemPrompt, String userPrompt) {
        log.debug("Calling generation provider: provider={}, promptLength={}", name, userPrompt.length());

        ChatResponse response = chatClient.prompt()
                .system(systemPrompt)
                .user(userPrompt)
                .call()
                .chatResponse();

        if (response == null || response.getResult() == null || response.getResult().getOutput() == null) {
            log.warn("Generation provider {} returned no result", name);
            return null;
        }

        logUsage(response);
        return response.getResult().getOutput().getText();
    }

    private void logUsage(ChatResponse response) {
        if (response.getMetadata() == null) {
            return;
        }
        Usage usage = response.getMetadata().getUsage();
        if (usage != null) {
            log.debug("Token usage - provider: {}, prompt: {}, completion: {}, total: {}",
                    name, usage.getPromptTokens(), usage.getCompletionTokens(), usage.getTotalTokens());
        }
    }
}
