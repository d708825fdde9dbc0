package com.brainvault.service;

import com.brainvault.entity.Idea;
import com.brainvault.repository.IdeaRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Derives project, theme and emotion for a captured idea and writes them back.
 *
 * Enrichment Flow:
 * 1. Load the idea by id (no owner check: the id comes from a freshly stored idea)
 * 2. Project from keyword buckets, theme from entity recognition (IdeaCategorizer)
 * 3. Emotion from the external classifier when configured
 * 4. Write the three fields through IdeaService.applyEnrichment
 *
 * Emotion is best effort: no classifier or any classifier failure yields "neutral" and a
 * warning in the log. Nothing is retried.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class EnrichmentService {

    private final IdeaRepository ideaRepository;
    private final IdeaService ideaService;
    private final IdeaCategorizer ideaCategorizer;
    private final ObjectProvider<EmotionClassifier> emotionClassifierProvider;

    /**
     * Enrich one idea.
     *
     * @param ideaId id of a stored idea
     * @return false if the idea no longer exists
     */
    public boolean enrich(Long ideaId) {
        Optional<Idea> found = ideaRepository.findById(ideaId);
        if (found.isEmpty()) {
            return false;
        }

        String content = found.get().getContent();
        String project = ideaCategorizer.categorizeProject(content);
        String theme = ideaCategorizer.extractTheme(content);
        String emotion = classifyEmotion(ideaId, content);

        boolean updated = ideaService.applyEnrichment(ideaId, project, theme, emotion);
        log.info("Idea enriched: id={}, project='{}', theme='{}', emotion='{}', updated={}",
                ideaId, project, theme, emotion, updated);
        return updated;
    }

    private String classifyEmotion(Long ideaId, String content) {
        EmotionClassifier classifier = emotionClassifierProvider.getIfAvailable();
        if (classifier == null) {
            return EmotionClassifier.NEUTRAL;
        }
        try {
            return classifier.classify(content);
        } catch (Exception e) {
            log.warn("Emotion classification failed, using '{}': ideaId={}, error={}",
                    EmotionClassifier.NEUTRAL, ideaId, e.getMessage());
            return EmotionClassifier.NEUTRAL;
        }
    }
}
