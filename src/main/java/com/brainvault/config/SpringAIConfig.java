package com.brainvault.config;

import com.brainvault.service.ChatClientGenerationProvider;
import com.brainvault.service.ClaudeEmotionClassifier;
import com.brainvault.service.EmotionClassifier;
import com.brainvault.service.GenerationProvider;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.anthropic.AnthropicChatModel;
import org.springframework.ai.anthropic.AnthropicChatOptions;
import org.springframework.ai.anthropic.api.AnthropicApi;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.openai.OpenAiAudioTranscriptionModel;
import org.springframework.ai.openai.OpenAiAudioTranscriptionOptions;
import org.springframework.ai.openai.OpenAiChatModel;
import org.springframework.ai.openai.OpenAiChatOptions;
import org.springframework.ai.openai.api.OpenAiApi;
import org.springframework.ai.openai.api.OpenAiAudioApi;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClient;

import java.time.Duration;

/**
 * Spring AI configuration for the external model clients.
 *
 * Every client is created only when its API key is configured, so an environment without
 * keys starts normally and each caller falls back to its local behavior:
 *
 * 1. xAI Grok (OpenAI-compatible API) - primary generation provider for transformations
 * 2. OpenAI - secondary generation provider, and Whisper speech-to-text
 * 3. Anthropic Claude - emotion classification during enrichment
 *
 * Call Bounds:
 * - Every HTTP call is bounded by app.ai.timeout (connect and read)
 * - Retries are disabled; a failed call goes straight to the caller's fallback path
 * - Generation uses a fixed token budget and temperature (app.ai.generation.*)
 *
 * Provider Priority:
 * - xAI has order 0, OpenAI order 1
 * - TransformService calls only the first configured provider
 *
 * @see com.brainvault.service.TransformService
 * @see com.brainvault.service.WhisperService
 * @see com.brainvault.service.EnrichmentService
 */
@Configuration
@Slf4j
public class SpringAIConfig {

    static final int XAI_ORDER = 0;
    static final int OPENAI_ORDER = 1;

    @Value("${app.ai.xai.api-key:}")
    private String xaiApiKey;

    @Value("${app.ai.xai.base-url:https://api.x.ai}")
    private String xaiBaseUrl;

    @Value("${app.ai.xai.model:grok-3-mini}")
    private String xaiModel;

    @Value("${app.ai.openai.api-key:}")
    private String openAiApiKey;

    @Value("${app.ai.openai.base-url:https://api.openai.com}")
    private String openAiBaseUrl;

    @Value("${app.ai.openai.model:gpt-4o-mini}")
    private String openAiModel;

    @Value("${app.ai.anthropic.api-key:}")
    private String anthropicApiKey;

    @Value("${app.ai.anthropic.base-url:https://api.anthropic.com}")
    private String anthropicBaseUrl;

    @Value("${app.ai.anthropic.model:claude-3-5-haiku-latest}")
    private String claudeModel;

    @Value("${app.ai.generation.max-tokens:1000}")
    private int maxTokens;

    @Value("${app.ai.generation.temperature:0.7}")
    private double temperature;

    @Value("${app.ai.timeout:30s}")
    private Duration timeout;

    @Value("${app.ai.transcription.model:whisper-1}")
    private String transcriptionModel;

    @Value("${app.ai.transcription.language:en}")
    private String transcriptionLanguage;

    @Value("${app.ai.transcription.prompt:}")
    private String transcriptionPrompt;

    /**
     * Primary generation provider: xAI Grok through its OpenAI-compatible endpoint.
     */
    @Bean
    @ConditionalOnExpression("'${app.ai.xai.api-key:}' != ''")
    public GenerationProvider xaiGenerationProvider() {
        log.info("Configuring xAI generation provider: model={}, baseUrl={}", xaiModel, xaiBaseUrl);
        return new ChatClientGenerationProvider("xai", XAI_ORDER,
                ChatClient.create(openAiCompatibleChatModel(xaiBaseUrl, xaiApiKey, xaiModel)));
    }

    /**
     * Secondary generation provider: OpenAI chat completions.
     */
    @Bean
    @ConditionalOnExpression("'${app.ai.openai.api-key:}' != ''")
    public GenerationProvider openAiGenerationProvider() {
        log.info("Configuring OpenAI generation provider: model={}, baseUrl={}", openAiModel, openAiBaseUrl);
        return new ChatClientGenerationProvider("openai", OPENAI_ORDER,
                ChatClient.create(openAiCompatibleChatModel(openAiBaseUrl, openAiApiKey, openAiModel)));
    }

    /**
     * Whisper speech-to-text model.
     *
     * Model: whisper-1
     * - Handles formats: MP3, WAV, OGG and others
     * - Language hint from app.ai.transcription.language
     */
    @Bean
    @ConditionalOnExpression("'${app.ai.openai.api-key:}' != ''")
    public OpenAiAudioTranscriptionModel whisperTranscriptionModel() {
        log.info("Configuring Whisper transcription model: model={}, baseUrl={}", transcriptionModel, openAiBaseUrl);

        OpenAiAudioApi openAiAudioApi = OpenAiAudioApi.builder()
                .baseUrl(openAiBaseUrl)
                .apiKey(openAiApiKey)
                .restClientBuilder(timeoutRestClientBuilder())
                .build();

        OpenAiAudioTranscriptionOptions.Builder options = OpenAiAudioTranscriptionOptions.builder()
                .model(transcriptionModel)
                .language(transcriptionLanguage);
        if (StringUtils.hasText(transcriptionPrompt)) {
            options.prompt(transcriptionPrompt);
        }

        return new OpenAiAudioTranscriptionModel(openAiAudioApi, options.build(), noRetry());
    }

    /**
     * Claude chat model used by the emotion classifier.
     */
    @Bean
    @ConditionalOnExpression("'${app.ai.anthropic.api-key:}' != ''")
    public EmotionClassifier emotionClassifier(ObjectMapper objectMapper) {
        log.info("Configuring Claude emotion classifier: model={}, baseUrl={}", claudeModel, anthropicBaseUrl);

        AnthropicApi anthropicApi = AnthropicApi.builder()
                .baseUrl(anthropicBaseUrl)
                .apiKey(anthropicApiKey)
                .restClientBuilder(timeoutRestClientBuilder())
                .build();

        AnthropicChatOptions options = AnthropicChatOptions.builder()
                .model(claudeModel)
                .maxTokens(50)
                .temperature(0.0)
                .build();

        AnthropicChatModel claudeChatModel = AnthropicChatModel.builder()
                .anthropicApi(anthropicApi)
                .defaultOptions(options)
                .retryTemplate(noRetry())
                .build();

        return new ClaudeEmotionClassifier(ChatClient.create(claudeChatModel), objectMapper);
    }

    private OpenAiChatModel openAiCompatibleChatModel(String baseUrl, String apiKey, String model) {
        OpenAiApi openAiApi = OpenAiApi.builder()
                .baseUrl(baseUrl)
                .apiKey(apiKey)
                .restClientBuilder(timeoutRestClientBuilder())
                .build();

        OpenAiChatOptions options = OpenAiChatOptions.builder()
                .model(model)
                .maxTokens(maxTokens)
                .temperature(temperature)
                .build();

        return OpenAiChatModel.builder()
                .openAiApi(openAiApi)
                .defaultOptions(options)
                .retryTemplate(noRetry())
                .build();
    }

    private RestClient.Builder timeoutRestClientBuilder() {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(timeout);
        requestFactory.setReadTimeout(timeout);
        return RestClient.builder().requestFactory(requestFactory);
    }

    private RetryTemplate noRetry() {
        return RetryTemplate.builder().maxAttempts(1).build();
    }
}
