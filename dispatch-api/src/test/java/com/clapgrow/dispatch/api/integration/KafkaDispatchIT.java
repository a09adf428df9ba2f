package com.clapgrow.dispatch.api.integration;

import com.clapgrow.dispatch.api.DispatchApiApplication;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.ConsumerRecords;
import org.apache.kafka.clients.consumer.KafkaConsumer;
import org.apache.kafka.common.serialization.ByteArrayDeserializer;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.servlet.MockMvc;
import org.testcontainers.containers.KafkaContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * End-to-end dispatch through a real Kafka broker.
 */
@SpringBootTest(
    classes = DispatchApiApplication.class,
    webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT
)
@AutoConfigureMockMvc
@ActiveProfiles("test")
@Testcontainers
@DisplayName("Kafka Dispatch Integration Tests")
class KafkaDispatchIT {

    @Container
    static KafkaContainer kafka = new KafkaContainer(
        DockerImageName.parse("confluentinc/cp-kafka:7.5.0")
    );

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.kafka.bootstrap-servers", kafka::getBootstrapServers);
    }

    @Autowired
    private MockMvc mockMvc;

    @Test
    void testHealth_ReportsKafkaHealthy() throws Exception {
        mockMvc.perform(get("/api/v1/messaging/health"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.healthy").value(true))
            .andExpect(jsonPath("$.data.provider").value("Kafka"));
    }

    @Test
    void testSendWithRetry_RecordReachesTopicWithHeaders() throws Exception {
        String topic = "orders-" + UUID.randomUUID();

        mockMvc.perform(post("/api/v1/messaging/send-with-retry")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"topic\": \"" + topic + "\", \"payload\": {\"orderId\": 7}, \"correlationId\": \"req-42\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.success").value(true))
            .andExpect(jsonPath("$.data.provider").value("Kafka"));

        List<ConsumerRecord<String, byte[]>> records = consume(topic, 1);
        ConsumerRecord<String, byte[]> record = records.get(0);
        assertEquals("req-42", record.key());
        assertEquals("{\"orderId\":7}", new String(record.value(), StandardCharsets.UTF_8));
        assertNotNull(record.headers().lastHeader("MessageId"));
        assertEquals("req-42", new String(record.headers().lastHeader("CorrelationId").value(), StandardCharsets.UTF_8));
    }

    @Test
    void testSendToDlq_RecordReachesDlqTopic() throws Exception {
        String topic = "payments-" + UUID.randomUUID();

        mockMvc.perform(post("/api/v1/messaging/dlq")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"topic\": \"" + topic + "\", \"payload\": {\"id\": 1}, \"reason\": \"poison\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.provider").value("Kafka-DLQ"));

        ConsumerRecord<String, byte[]> record = consume(topic + ".dlq", 1).get(0);
        assertEquals("poison", new String(record.headers().lastHeader("DLQ-Reason").value(), StandardCharsets.UTF_8));
        assertEquals(topic, new String(record.headers().lastHeader("Original-Topic").value(), StandardCharsets.UTF_8));
    }

    @Test
    void testSendBatch_AllRecordsDelivered() throws Exception {
        String topic = "events-" + UUID.randomUUID();

        mockMvc.perform(post("/api/v1/messaging/batch")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"messages\": ["
                    + "{\"topic\": \"" + topic + "\", \"payload\": 1},"
                    + "{\"topic\": \"" + topic + "\", \"payload\": 2},"
                    + "{\"topic\": \"" + topic + "\", \"payload\": 3}]}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.total").value(3))
            .andExpect(jsonPath("$.data.succeeded").value(3));

        assertEquals(3, consume(topic, 3).size());
    }

    private List<ConsumerRecord<String, byte[]>> consume(String topic, int expected) {
        Map<String, Object> props = Map.of(
            ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, kafka.getBootstrapServers(),
            ConsumerConfig.GROUP_ID_CONFIG, "dispatch-it-" + UUID.randomUUID(),
            ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, "earliest",
            ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class,
            ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, ByteArrayDeserializer.class);
        List<ConsumerRecord<String, byte[]>> received = new ArrayList<>();
        try (KafkaConsumer<String, byte[]> consumer = new KafkaConsumer<>(props)) {
            consumer.subscribe(List.of(topic));
            long deadline = System.currentTimeMillis() + 30000;
            while (received.size() < expected && System.currentTimeMillis() < deadline) {
                ConsumerRecords<String, byte[]> records = consumer.poll(Duration.ofMillis(500));
                records.forEach(received::add);
            }
        }
        assertEquals(expected, received.size(), "records received from " + topic);
        return received;
    }
}
