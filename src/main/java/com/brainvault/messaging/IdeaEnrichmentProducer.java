package com.brainvault.messaging;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.AmqpException;
import org.springframework.amqp.rabbit.connection.CorrelationData;
import org.springframework.amqp.rabbit.core.RabbitTemplate;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * RabbitMQ producer for idea enrichment tasks.
 *
 * Sends the id of a newly captured idea to the enrichment queue. The message body is the
 * idea id only; the consumer reloads the idea from the store.
 *
 * Message Flow:
 * 1. IdeaService stores the idea and publishes IdeaCapturedEvent
 * 2. IdeaEnrichmentDispatcher calls this producer after commit
 * 3. The id is sent to ideas.exchange with routing key idea.enrich and the broker confirm is awaited
 * 4. IdeaEnrichmentConsumer picks it up and runs the enrichment
 *
 * @see IdeaEnrichmentConsumer
 * @see com.brainvault.config.RabbitMQConfig
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class IdeaEnrichmentProducer {

    private final RabbitTemplate rabbitTemplate;

    @Value("${app.rabbitmq.exchange.ideas:ideas.exchange}")
    private String ideasExchange;

    @Value("${app.rabbitmq.routing-key.enrichment:idea.enrich}")
    private String enrichmentRoutingKey;

    @Value("${app.rabbitmq.confirm-timeout-ms:5000}")
    private long confirmTimeoutMs;

    /**
     * Send an enrichment task for the given idea and wait for the broker's publisher confirm.
     *
     * A full queue (x-overflow=reject-publish) comes back as a nack, and a confirm that does not
     * arrive within app.rabbitmq.confirm-timeout-ms is treated as a failure as well.
     *
     * @param ideaId the id of the stored idea
     * @throws IllegalArgumentException if ideaId is null
     * @throws RuntimeException if the message cannot be sent or the broker does not ack it
     */
    public void sendEnrichmentTask(Long ideaId) {
        if (ideaId == null) {
            log.error("Attempted to send null idea ID to enrichment queue");
            throw new IllegalArgumentException("Idea ID cannot be null");
        }

        CorrelationData correlation = new CorrelationData("idea-" + ideaId);
        try {
            log.info("Sending enrichment task to queue: ideaId={}, exchange={}, routingKey={}",
                    ideaId, ideasExchange, enrichmentRoutingKey);

            rabbitTemplate.convertAndSend(ideasExchange, enrichmentRoutingKey, ideaId, correlation);

            CorrelationData.Confirm confirm = correlation.getFuture().get(confirmTimeoutMs, TimeUnit.MILLISECONDS);
            if (!confirm.isAck()) {
                throw new AmqpException("Broker refused enrichment task: " + confirm.getReason());
            }
            log.debug("Enrichment task confirmed: ideaId={}", ideaId);

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RuntimeException("Failed to send enrichment task for idea: " + ideaId, e);
        } catch (Exception e) {
            log.error("Failed to send enrichment task: ideaId={}, error={}", ideaId, e.getMessage(), e);
            throw new RuntimeException("Failed to send enrichment task for idea: " + ideaId, e);
        }
    }
}
