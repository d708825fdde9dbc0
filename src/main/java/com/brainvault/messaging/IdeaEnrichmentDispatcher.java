package com.brainvault.messaging;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Bridges idea capture to the enrichment queue.
 *
 * Runs after the capture transaction commits, so the consumer never looks up an idea that
 * is not yet visible. A failed publish (broker down, queue full) is logged and dropped:
 * the capture has already succeeded and the idea simply stays unenriched.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class IdeaEnrichmentDispatcher {

    private final IdeaEnrichmentProducer ideaEnrichmentProducer;

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void onIdeaCaptured(IdeaCapturedEvent event) {
        try {
            ideaEnrichmentProducer.sendEnrichmentTask(event.getIdeaId());
        } catch (Exception e) {
            log.warn("Enrichment trigger lost, idea stays unenriched: ideaId={}, error={}",
                    event.getIdeaId(), e.getMessage());
        }
    }
}
