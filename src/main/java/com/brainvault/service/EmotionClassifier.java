package com.brainvault.service;

import java.util.List;

/**
 * External emotion classification for idea content.
 */
public interface EmotionClassifier {

    String NEUTRAL = "neutral";

    List<String> LABELS = List.of("excited", "happy", "curious", "concerned", "frustrated", NEUTRAL);

    /**
     * Classify the dominant emotion of a text.
     *
     * @param content idea content
     * @return one of {@link #LABELS}
     * @throws RuntimeException if the classifier call fails
     */
    String classify(String content);
}
