package com.clapgrow.dispatch.api.config;

import com.clapgrow.dispatch.common.retry.RetryPolicy;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Configuration properties for message dispatch.
 *
 * Maps to:
 * messaging:
 *   provider: kafka
 *   dispatch:
 *     request-timeout: 30s
 *   retry:
 *     max-retries: 3
 *     base-delay: 1s
 *     max-delay: 30s
 *     exponential-backoff: true
 *     send-to-dlq-on-exhaustion: true
 *   kafka:
 *     enabled: true
 *     dlq-suffix: .dlq
 *     health-timeout: 5s
 *   sqs:
 *     enabled: false
 *     dlq-suffix: -dlq
 *   rabbitmq:
 *     enabled: false
 *     exchange: ""
 *     dlq-suffix: .dlq
 */
@Configuration
@ConfigurationProperties(prefix = "messaging")
@Data
public class MessagingProperties {

    /**
     * Provider bound at startup (noop, kafka, sqs, rabbitmq). Unknown or unregistered values fall back to noop.
     */
    private String provider = "noop";

    private Dispatch dispatch = new Dispatch();

    private Retry retry = new Retry();

    private Kafka kafka = new Kafka();

    private Sqs sqs = new Sqs();

    private RabbitMq rabbitmq = new RabbitMq();

    @Data
    public static class Dispatch {
        /**
         * Deadline applied to every HTTP-initiated dispatch, backoff waits included.
         */
        private Duration requestTimeout = Duration.ofSeconds(30);
    }

    @Data
    public static class Retry {
        private int maxRetries = 3;
        private Duration baseDelay = Duration.ofSeconds(1);
        private Duration maxDelay = Duration.ofSeconds(30);
        private boolean exponentialBackoff = true;
        private boolean sendToDlqOnExhaustion = true;

        public RetryPolicy toPolicy() {
            return new RetryPolicy(maxRetries, baseDelay, maxDelay, exponentialBackoff, sendToDlqOnExhaustion);
        }
    }

    @Data
    public static class Kafka {
        private boolean enabled = false;
        private String dlqSuffix = ".dlq";
        private Duration healthTimeout = Duration.ofSeconds(5);
    }

    @Data
    public static class Sqs {
        private boolean enabled = false;
        /**
         * SQS queue names cannot contain dots.
         */
        private String dlqSuffix = "-dlq";
    }

    @Data
    public static class RabbitMq {
        private boolean enabled = false;
        /**
         * Exchange messages are published to. The default exchange routes by queue name,
         * so the message topic doubles as the queue.
         */
        private String exchange = "";
        private String dlqSuffix = ".dlq";
    }
}
