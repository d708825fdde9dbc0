package com.brainvault.service;

import com.brainvault.dto.response.TransformResponse;
import com.brainvault.entity.Idea;
import com.brainvault.exception.ResourceNotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.beans.factory.ObjectProvider;

import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Unit tests for TransformService.
 *
 * The provider chain is mocked through ObjectProvider.orderedStream(); an empty stream is
 * the "no API key configured" case.
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("TransformService Unit Tests")
class TransformServiceTest {

    private static final String OWNER = "auth0|owner";

    @Mock
    private IdeaService ideaService;

    @Mock
    private ObjectProvider<GenerationProvider> generationProviders;

    @Mock
    private GenerationProvider xai;

    @Mock
    private GenerationProvider openAi;

    private TransformService transformService;

    private Idea idea;

    @BeforeEach
    void setUp() {
        transformService = new TransformService(ideaService, generationProviders);

        idea = new Idea(OWNER, "A marketplace for used lab equipment", "manual");
        idea.setId(5L);
    }

    @Test
    @DisplayName("Without providers the fixed fallback text is returned and stored")
    void testFallbackWithoutProviders() {
        // Arrange
        when(ideaService.getIdea(5L, OWNER)).thenReturn(idea);
        when(generationProviders.orderedStream()).thenReturn(Stream.empty());

        // Act
        TransformResponse response = transformService.transform(5L, OWNER, "ip");

        // Assert
        assertEquals(OutputType.IP.getFallback(), response.getTransformedContent());
        assertTrue(response.getTransformedContent().startsWith("Intellectual Property Analysis:"));
        assertEquals(5L, response.getIdeaId());
        assertEquals("ip", response.getOutputType());
        verify(ideaService, times(1)).saveTransformedOutput(5L, OWNER, OutputType.IP.getFallback());
    }

    @Test
    @DisplayName("Highest priority provider generates the output")
    void testFirstProviderIsUsed() {
        when(ideaService.getIdea(5L, OWNER)).thenReturn(idea);
        when(generationProviders.orderedStream()).thenReturn(Stream.of(xai, openAi));
        when(xai.generate(eq(TransformService.SYSTEM_PROMPT), anyString())).thenReturn("1. Survey labs");

        TransformResponse response = transformService.transform(5L, OWNER, "tasks");

        assertEquals("1. Survey labs", response.getTransformedContent());
        verifyNoInteractions(openAi);

        ArgumentCaptor<String> promptCaptor = ArgumentCaptor.forClass(String.class);
        verify(xai).generate(eq(TransformService.SYSTEM_PROMPT), promptCaptor.capture());
        assertTrue(promptCaptor.getValue().contains("Original idea: A marketplace for used lab equipment"));
        verify(ideaService).saveTransformedOutput(5L, OWNER, "1. Survey labs");
    }

    @Test
    @DisplayName("Provider failure falls back instead of trying the next provider")
    void testProviderFailureFallsBack() {
        when(ideaService.getIdea(5L, OWNER)).thenReturn(idea);
        when(generationProviders.orderedStream()).thenReturn(Stream.of(xai, openAi));
        when(xai.generate(anyString(), anyString())).thenThrow(new RuntimeException("401 Unauthorized"));
        when(xai.getName()).thenReturn("xai");

        TransformResponse response = transformService.transform(5L, OWNER, "content");

        assertEquals(OutputType.CONTENT.getFallback(), response.getTransformedContent());
        verifyNoInteractions(openAi);
    }

    @Test
    @DisplayName("Blank generated text is replaced by the fallback")
    void testEmptyGenerationFallsBack() {
        when(ideaService.getIdea(5L, OWNER)).thenReturn(idea);
        when(generationProviders.orderedStream()).thenReturn(Stream.of(xai));
        when(xai.generate(anyString(), anyString())).thenReturn("   ");
        when(xai.getName()).thenReturn("xai");

        TransformResponse response = transformService.transform(5L, OWNER, "tasks");

        assertEquals(OutputType.TASKS.getFallback(), response.getTransformedContent());
    }

    @Test
    @DisplayName("Unknown output type is rejected before the idea is loaded")
    void testInvalidOutputType() {
        IllegalArgumentException exception = assertThrows(IllegalArgumentException.class,
                () -> transformService.transform(5L, OWNER, "poem"));

        assertEquals("Invalid output type. Must be one of: content, ip, tasks", exception.getMessage());
        verifyNoInteractions(ideaService);
        verifyNoInteractions(generationProviders);
    }

    @Test
    @DisplayName("Idea of another user is not found and nothing is generated")
    void testForeignIdea() {
        when(ideaService.getIdea(5L, "auth0|other")).thenThrow(ResourceNotFoundException.idea());

        assertThrows(ResourceNotFoundException.class,
                () -> transformService.transform(5L, "auth0|other", "content"));

        verifyNoInteractions(generationProviders);
        verify(ideaService, never()).saveTransformedOutput(any(), any(), any());
    }
}
