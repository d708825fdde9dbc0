package com.brainvault.messaging;

import org.springframework.context.ApplicationEvent;

/**
 * Published by IdeaService when a new idea has been stored. Delivered to
 * {@link IdeaEnrichmentDispatcher} after the capturing transaction commits.
 */
public class IdeaCapturedEvent extends ApplicationEvent {

    private final Long ideaId;

    public IdeaCapturedEvent(Object source, Long ideaId) {
        super(source);
        this.ideaId = ideaId;
    }

    public Long getIdeaId() {
        return ideaId;
    }
}
