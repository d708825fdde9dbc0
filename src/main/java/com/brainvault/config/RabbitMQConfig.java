package com.brainvault.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.core.AmqpAdmin;
import org.springframework.amqp.core.Binding;
import org.springframework.amqp.core.BindingBuilder;
import org.springframework.amqp.core.DirectExchange;
import org.springframework.amqp.core.Queue;
import org.springframework.amqp.core.QueueBuilder;
import org.springframework.amqp.rabbit.connection.ConnectionFactory;
import org.springframework.amqp.rabbit.core.RabbitAdmin;
import org.springframework.amqp.rabbit.core.RabbitTemplate;
import org.springframework.amqp.support.converter.Jackson2JsonMessageConverter;
import org.springframework.amqp.support.converter.MessageConverter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * RabbitMQ topology for idea enrichment.
 *
 * Captured idea ids are published to a direct exchange and consumed by
 * {@link com.brainvault.messaging.IdeaEnrichmentConsumer}.
 *
 * Topology:
 * - Exchange: ideas.exchange (direct, durable)
 * - Queue: idea.enrichment.queue (durable, bounded, TTL)
 * - DLQ: idea.enrichment.dlq (expired and unconvertible messages)
 * - Routing key: idea.enrich
 *
 * Backpressure:
 * - x-max-length caps the backlog
 * - x-overflow=reject-publish makes the broker nack new publishes when full instead of
 *   dropping the oldest pending idea. IdeaEnrichmentProducer waits for that confirm, so a
 *   nack or a missing confirm reaches IdeaEnrichmentDispatcher as an exception
 *
 * Delivery is at-most-once: the consumer never requeues, and a lost trigger leaves the
 * idea unenriched.
 */
@Configuration
@Slf4j
public class RabbitMQConfig {

    @Value("${app.rabbitmq.exchange.ideas:ideas.exchange}")
    private String ideasExchange;

    @Value("${app.rabbitmq.queue.enrichment:idea.enrichment.queue}")
    private String enrichmentQueue;

    @Value("${app.rabbitmq.queue.enrichment-dlq:idea.enrichment.dlq}")
    private String enrichmentDLQ;

    @Value("${app.rabbitmq.routing-key.enrichment:idea.enrich}")
    private String enrichmentRoutingKey;

    @Value("${app.rabbitmq.routing-key.dlq:idea.enrich.dlq}")
    private String dlqRoutingKey;

    @Value("${app.rabbitmq.queue.ttl:3600000}")
    private long queueTTL;

    @Value("${app.rabbitmq.queue.max-length:1000}")
    private int queueMaxLength;

    @Bean
    public MessageConverter jsonMessageConverter() {
        return new Jackson2JsonMessageConverter();
    }

    /**
     * RabbitTemplate with JSON conversion, publisher confirms and returns.
     * Requires spring.rabbitmq.publisher-confirm-type=correlated and publisher-returns=true.
     * The confirm callback only logs; the producer reads the outcome from its CorrelationData.
     */
    @Bean
    public RabbitTemplate rabbitTemplate(ConnectionFactory connectionFactory, MessageConverter jsonMessageConverter) {
        RabbitTemplate rabbitTemplate = new RabbitTemplate(connectionFactory);
        rabbitTemplate.setMessageConverter(jsonMessageConverter);
        rabbitTemplate.setMandatory(true);

        rabbitTemplate.setConfirmCallback((correlationData, ack, cause) -> {
            if (ack) {
                log.debug("Enrichment message confirmed by broker: {}", correlationData != null ? correlationData.getId() : null);
            } else {
                log.error("Enrichment message rejected by broker: {}", cause);
            }
        });

        rabbitTemplate.setReturnsCallback(returned ->
                log.error("Enrichment message returned - Exchange: {}, RoutingKey: {}, ReplyText: {}",
                        returned.getExchange(),
                        returned.getRoutingKey(),
                        returned.getReplyText()));

        log.info("RabbitTemplate configured with JSON message converter and publisher confirms");
        return rabbitTemplate;
    }

    @Bean
    public Queue enrichmentDLQ() {
        log.info("Configuring DLQ: {} (durable=true)", enrichmentDLQ);
        return QueueBuilder.durable(enrichmentDLQ).build();
    }

    @Bean
    public Queue enrichmentQueue() {
        log.info("Configuring queue: {} (durable=true, ttl={}, maxLength={})",
                enrichmentQueue, queueTTL, queueMaxLength);

        return QueueBuilder.durable(enrichmentQueue)
                .ttl((int) queueTTL)
                .maxLength(queueMaxLength)
                .overflow(QueueBuilder.Overflow.rejectPublish)
                .deadLetterExchange(ideasExchange)
                .deadLetterRoutingKey(dlqRoutingKey)
                .build();
    }

    @Bean
    public DirectExchange ideasExchange() {
        log.info("Configuring direct exchange: {} (durable=true)", ideasExchange);
        return new DirectExchange(ideasExchange, true, false);
    }

    @Bean
    public Binding dlqBinding() {
        return BindingBuilder
                .bind(enrichmentDLQ())
                .to(ideasExchange())
                .with(dlqRoutingKey);
    }

    @Bean
    public Binding enrichmentBinding() {
        log.debug("Binding queue {} to exchange {} with routing key {}",
                enrichmentQueue, ideasExchange, enrichmentRoutingKey);

        return BindingBuilder
                .bind(enrichmentQueue())
                .to(ideasExchange())
                .with(enrichmentRoutingKey);
    }

    @Bean
    public AmqpAdmin amqpAdmin(ConnectionFactory connectionFactory) {
        return new RabbitAdmin(connectionFactory);
    }
}
