package com.flagship.fund_quarantine.outbox;

import com.flagship.fund_quarantine.quarantine.QuarantineService;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.ConsumerRecords;
import org.apache.kafka.clients.consumer.KafkaConsumer;
import org.apache.kafka.common.header.Header;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.KafkaContainer;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Outbox publisher against a real Kafka broker.
 */
@SpringBootTest
@Testcontainers(disabledWithoutDocker = true)
class OutboxPublisherTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16")
            .withDatabaseName("fund_quarantine_test")
            .withUsername("test")
            .withPassword("test");

    @Container
    static KafkaContainer kafka = new KafkaContainer(
            DockerImageName.parse("confluentinc/cp-kafka:7.5.0"));

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        registry.add("spring.kafka.bootstrap-servers", kafka::getBootstrapServers);
        // Keep the scheduled poll out of the way, we trigger manually
        registry.add("outbox.publisher.poll-interval-ms", () -> "3600000");
    }

    @Autowired
    private OutboxService outboxService;

    @Autowired
    private OutboxPublisher outboxPublisher;

    @Autowired
    private OutboxEventRepository outboxEventRepository;

    @MockBean
    private StringRedisTemplate redisTemplate;

    @Value("${kafka.topic.quarantines:fund-quarantine}")
    private String quarantinesTopic;

    private KafkaConsumer<String, String> consumer;

    @BeforeEach
    void setUp() {
        outboxEventRepository.deleteAll();

        Properties props = new Properties();
        props.put(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, kafka.getBootstrapServers());
        props.put(ConsumerConfig.GROUP_ID_CONFIG, "test-group-" + UUID.randomUUID());
        props.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class.getName());
        props.put(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class.getName());
        props.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, "earliest");
        props.put(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, "true");

        consumer = new KafkaConsumer<>(props);
        consumer.subscribe(Collections.singletonList(quarantinesTopic));
    }

    @AfterEach
    void tearDown() {
        consumer.close();
    }

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    private List<ConsumerRecord<String, String>> pollFor(UUID aggregateId, int expected) {
        List<ConsumerRecord<String, String>> matching = new ArrayList<>();
        long deadline = System.currentTimeMillis() + 30_000;
        while (matching.size() < expected && System.currentTimeMillis() < deadline) {
            ConsumerRecords<String, String> records = consumer.poll(Duration.ofMillis(500));
            for (ConsumerRecord<String, String> record : records) {
                if (aggregateId.toString().equals(record.key())) {
                    matching.add(record);
                }
            }
        }
        return matching;
    }

    private static String header(ConsumerRecord<String, String> record, String name) {
        Header header = record.headers().lastHeader(name);
        return header != null ? new String(header.value(), StandardCharsets.UTF_8) : null;
    }

    @Test
    @DisplayName("Publisher sends events keyed by quarantine ID and marks them published")
    void testPublishesToKafka() {
        printTestHeader("Publish To Kafka");

        UUID quarantineId = UUID.randomUUID();
        OutboxEvent created = outboxService.enqueue(QuarantineService.AGGREGATE_TYPE, quarantineId,
                "quarantine.created", Map.of("quarantineId", quarantineId.toString()));
        outboxService.enqueue(QuarantineService.AGGREGATE_TYPE, quarantineId,
                "quarantine.released", Map.of("quarantineId", quarantineId.toString()));

        outboxPublisher.triggerPublish();

        List<ConsumerRecord<String, String>> records = pollFor(quarantineId, 2);
        assertEquals(2, records.size());
        assertEquals("quarantine.created", header(records.get(0), "event_type"));
        assertEquals(created.getId().toString(), header(records.get(0), "event_id"));
        assertEquals("quarantine.released", header(records.get(1), "event_type"));
        assertTrue(records.get(0).value().contains(quarantineId.toString()));

        assertEquals(0, outboxService.countUnpublished());
        printSuccess("Events published in order on one partition key");
    }
}
