package com.clapgrow.dispatch.common.provider;

/**
 * Provider name enumeration.
 *
 * Identifies messaging backends in a type-safe manner and keys the adapter registry.
 * The display name is what ends up in {@code MessageResult.provider()}.
 *
 * Example usage:
 * <pre>
 * ProviderName provider = ProviderName.fromString("kafka");
 * String dlqTag = provider.dlqDisplayName(); // "Kafka-DLQ"
 * </pre>
 */
public enum ProviderName {
    /**
     * Simulated backend used when nothing real is configured
     */
    NOOP("No-Op (Development)"),

    /**
     * Apache Kafka
     */
    KAFKA("Kafka"),

    /**
     * Amazon Simple Queue Service
     */
    SQS("Amazon SQS"),

    /**
     * RabbitMQ over AMQP 0-9-1
     */
    RABBITMQ("RabbitMQ");

    private static final String DLQ_SUFFIX = "-DLQ";

    private final String displayName;

    ProviderName(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * @return display name tagged as the dead-letter variant, e.g. "Kafka-DLQ"
     */
    public String dlqDisplayName() {
        return displayName + DLQ_SUFFIX;
    }

    /**
     * Get provider name as lowercase string for configuration.
     *
     * @return Lowercase provider name (e.g., "kafka", "sqs", "rabbitmq")
     */
    public String toConfigValue() {
        return name().toLowerCase();
    }

    /**
     * Parse provider name from string (case-insensitive).
     *
     * @param name Provider name string
     * @return ProviderName enum value
     * @throws IllegalArgumentException if name doesn't match any provider
     */
    public static ProviderName fromString(String name) {
        if (name == null || name.trim().isEmpty()) {
            throw new IllegalArgumentException("Provider name cannot be null or empty");
        }
        try {
            return valueOf(name.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(
                "Unknown provider name: " + name + ". Available: " +
                java.util.Arrays.toString(values()), e);
        }
    }
}
