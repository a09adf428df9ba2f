package com.clapgrow.dispatch.api.config;

import org.springframework.amqp.rabbit.connection.ConnectionFactory;
import org.springframework.amqp.rabbit.core.RabbitTemplate;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * RabbitMQ template owned by the dispatch service. Only created when {@code messaging.rabbitmq.enabled=true}.
 *
 * Sends are only reported successful once the broker confirms them, so the connection factory must
 * run with {@code spring.rabbitmq.publisher-confirm-type=correlated} and
 * {@code spring.rabbitmq.publisher-returns=true}.
 */
@Configuration
@ConditionalOnProperty(prefix = "messaging.rabbitmq", name = "enabled", havingValue = "true")
public class RabbitConfig {

    @Bean
    public RabbitTemplate dispatchRabbitTemplate(ConnectionFactory connectionFactory) {
        if (!connectionFactory.isPublisherConfirms() || !connectionFactory.isPublisherReturns()) {
            throw new IllegalStateException(
                "RabbitMQ dispatch requires spring.rabbitmq.publisher-confirm-type=correlated " +
                "and spring.rabbitmq.publisher-returns=true");
        }
        RabbitTemplate template = new RabbitTemplate(connectionFactory);
        // Unroutable messages come back as returns instead of being dropped by the broker
        template.setMandatory(true);
        return template;
    }
}
