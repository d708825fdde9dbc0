package com.brainvault.messaging;

import com.brainvault.service.EnrichmentService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.rabbit.annotation.RabbitListener;
import org.springframework.stereotype.Component;

/**
 * RabbitMQ consumer for idea enrichment tasks.
 *
 * Processing Flow:
 * 1. Receive the idea id from idea.enrichment.queue
 * 2. Delegate to EnrichmentService (categorize, classify, write back)
 * 3. Log the outcome
 *
 * Delivery Semantics:
 * - At-most-once: the listener never rethrows, so a message is never requeued
 * - No ordering across ideas; up to four listener threads run concurrently
 * - A failed enrichment leaves the idea with null project/theme/emotion
 *
 * @see IdeaEnrichmentProducer
 * @see EnrichmentService
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class IdeaEnrichmentConsumer {

    private final EnrichmentService enrichmentService;

    @RabbitListener(
            queues = "${app.rabbitmq.queue.enrichment:idea.enrichment.queue}",
            concurrency = "${app.rabbitmq.listener.concurrency:2-4}"
    )
    public void processEnrichment(Long ideaId) {
        log.info("Received enrichment task from queue: ideaId={}", ideaId);

        if (ideaId == null) {
            log.error("Received null idea ID from queue, discarding");
            return;
        }

        try {
            boolean enriched = enrichmentService.enrich(ideaId);
            if (!enriched) {
                log.warn("Idea no longer exists, enrichment skipped: ideaId={}", ideaId);
            }
        } catch (Exception e) {
            // Best effort: never requeue
            log.error("Enrichment failed, idea stays unenriched: ideaId={}, error={}",
                    ideaId, e.getMessage(), e);
        }
    }
}
