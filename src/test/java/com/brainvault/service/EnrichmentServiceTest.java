package com.brainvault.service;

import com.brainvault.entity.Idea;
import com.brainvault.repository.IdeaRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.beans.factory.ObjectProvider;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("EnrichmentService Unit Tests")
class EnrichmentServiceTest {

    @Mock
    private IdeaRepository ideaRepository;

    @Mock
    private IdeaService ideaService;

    @Mock
    private ObjectProvider<EmotionClassifier> emotionClassifierProvider;

    @Mock
    private EmotionClassifier emotionClassifier;

    private EnrichmentService enrichmentService;

    private Idea idea;

    @BeforeEach
    void setUp() {
        enrichmentService = new EnrichmentService(ideaRepository, ideaService, new IdeaCategorizer(),
                emotionClassifierProvider);

        idea = new Idea("auth0|owner", "Launch a startup selling solar panels", "manual");
        idea.setId(7L);
    }

    @Test
    @DisplayName("Enrichment writes project, theme and classified emotion")
    void testSuccessfulEnrichment() {
        // Arrange
        when(ideaRepository.findById(7L)).thenReturn(Optional.of(idea));
        when(emotionClassifierProvider.getIfAvailable()).thenReturn(emotionClassifier);
        when(emotionClassifier.classify(idea.getContent())).thenReturn("excited");
        when(ideaService.applyEnrichment(7L, "Startup Ideas", "general", "excited")).thenReturn(true);

        // Act
        boolean enriched = enrichmentService.enrich(7L);

        // Assert
        assertTrue(enriched);
        verify(ideaService, times(1)).applyEnrichment(7L, "Startup Ideas", "general", "excited");
    }

    @Test
    @DisplayName("Missing classifier results in neutral emotion")
    void testNoClassifierConfigured() {
        when(ideaRepository.findById(7L)).thenReturn(Optional.of(idea));
        when(emotionClassifierProvider.getIfAvailable()).thenReturn(null);
        when(ideaService.applyEnrichment(7L, "Startup Ideas", "general", "neutral")).thenReturn(true);

        assertTrue(enrichmentService.enrich(7L));
        verify(ideaService).applyEnrichment(7L, "Startup Ideas", "general", "neutral");
    }

    @Test
    @DisplayName("Classifier failure results in neutral emotion rather than an error")
    void testClassifierFailure() {
        when(ideaRepository.findById(7L)).thenReturn(Optional.of(idea));
        when(emotionClassifierProvider.getIfAvailable()).thenReturn(emotionClassifier);
        when(emotionClassifier.classify(anyString())).thenThrow(new RuntimeException("timeout"));
        when(ideaService.applyEnrichment(7L, "Startup Ideas", "general", "neutral")).thenReturn(true);

        assertDoesNotThrow(() -> enrichmentService.enrich(7L));
        verify(ideaService).applyEnrichment(7L, "Startup Ideas", "general", "neutral");
    }

    @Test
    @DisplayName("Idea deleted before enrichment is skipped")
    void testIdeaNoLongerExists() {
        when(ideaRepository.findById(7L)).thenReturn(Optional.empty());

        assertFalse(enrichmentService.enrich(7L));
        verify(ideaService, never()).applyEnrichment(any(), any(), any(), any());
        verifyNoInteractions(emotionClassifierProvider);
    }
}
