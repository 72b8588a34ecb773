package com.flagship.fund_quarantine.outbox;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.fund_quarantine.quarantine.NewQuarantine;
import com.flagship.fund_quarantine.quarantine.Quarantine;
import com.flagship.fund_quarantine.quarantine.QuarantineService;
import com.flagship.fund_quarantine.quarantine.event.QuarantineCreatedEvent;
import com.flagship.fund_quarantine.quarantine.event.QuarantineReleasedEvent;
import com.flagship.fund_quarantine.quarantine.exception.InsufficientCapacityException;
import com.flagship.fund_quarantine.support.PlanFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Outbox storage: enqueue, retrieval for publishing, retry tracking and the
 * lifecycle events written by quarantine operations.
 */
@SpringBootTest
@Testcontainers(disabledWithoutDocker = true)
class OutboxServiceTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16")
            .withDatabaseName("fund_quarantine_test")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        // Disable outbox publisher during tests
        registry.add("outbox.publisher.enabled", () -> "false");
        // Disable Kafka for these tests
        registry.add("spring.kafka.bootstrap-servers", () -> "localhost:9999");
        registry.add("kafka.topic.auto-create", () -> "false");
    }

    private static final String AGGREGATE_TYPE = QuarantineService.AGGREGATE_TYPE;

    @Autowired
    private OutboxService outboxService;

    @Autowired
    private OutboxEventRepository outboxEventRepository;

    @Autowired
    private QuarantineService quarantineService;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @Autowired
    private ObjectMapper objectMapper;

    @MockBean
    private StringRedisTemplate redisTemplate;

    private PlanFixtures fixtures;
    private UUID budgetLineId;

    @BeforeEach
    void setUp() {
        fixtures = new PlanFixtures(jdbcTemplate);
        fixtures.deleteAll();
        budgetLineId = fixtures.budgetLine(UUID.randomUUID(), "CORE", 100_000, 0);
    }

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    private Quarantine createQuarantine(long cents) {
        return quarantineService.create(NewQuarantine.builder()
            .budgetLineId(budgetLineId)
            .providerId(UUID.randomUUID())
            .quarantinedCents(cents)
            .actorId("planner-1")
            .build(), null);
    }

    @Test
    @DisplayName("Enqueued event is stored unpublished with its JSON payload")
    void testEnqueue() throws Exception {
        printTestHeader("Enqueue Event");

        UUID aggregateId = UUID.randomUUID();
        OutboxEvent event = outboxService.enqueue(AGGREGATE_TYPE, aggregateId, "quarantine.test",
                java.util.Map.of("quarantineId", aggregateId.toString(), "amount", 42));

        assertNotNull(event.getId());
        assertFalse(event.isPublished());
        assertEquals(0, event.getRetryCount());
        JsonNode payload = objectMapper.readTree(event.getPayload());
        assertEquals(42, payload.get("amount").asInt());
        assertEquals(1, outboxService.countUnpublished());
        printSuccess("Event stored for the publisher");
    }

    @Test
    @DisplayName("Published events are no longer handed to the publisher")
    void testMarkPublished() {
        printTestHeader("Mark Published");

        OutboxEvent event = outboxService.enqueue(AGGREGATE_TYPE, UUID.randomUUID(), "quarantine.test", "{}");
        assertEquals(1, outboxService.findPublishableEvents(10, 5).size());

        outboxService.markPublished(event.getId());

        assertTrue(outboxService.findPublishableEvents(10, 5).isEmpty());
        assertEquals(0, outboxService.countUnpublished());
        assertNotNull(outboxEventRepository.findById(event.getId()).orElseThrow().getPublishedAt());
    }

    @Test
    @DisplayName("Failures increment retry count until the event is dead-lettered")
    void testRetryAndDeadLetter() {
        printTestHeader("Retry And Dead Letter");

        OutboxEvent event = outboxService.enqueue(AGGREGATE_TYPE, UUID.randomUUID(), "quarantine.test", "{}");
        int maxRetries = 3;

        for (int i = 0; i < maxRetries; i++) {
            outboxService.markFailed(event.getId(), "broker unavailable");
        }

        OutboxEventEntity stored = outboxEventRepository.findById(event.getId()).orElseThrow();
        assertEquals(3, stored.getRetryCount());
        assertEquals("broker unavailable", stored.getLastError());
        assertTrue(outboxService.findPublishableEvents(10, maxRetries).isEmpty());
        assertEquals(1, outboxService.getDeadLetterEvents(maxRetries).size());
        printSuccess("Event parked after max retries");
    }

    @Test
    @DisplayName("Create and release write their events in order for the quarantine")
    void testLifecycleEvents() throws Exception {
        printTestHeader("Lifecycle Events");

        Quarantine created = createQuarantine(12_500);
        quarantineService.release(created.getId(), "planner-1");

        List<OutboxEvent> events = outboxService.getEventsForAggregate(AGGREGATE_TYPE, created.getId());
        assertEquals(2, events.size());
        assertEquals(QuarantineCreatedEvent.EVENT_TYPE, events.get(0).getEventType());
        assertEquals(QuarantineReleasedEvent.EVENT_TYPE, events.get(1).getEventType());

        JsonNode createdPayload = objectMapper.readTree(events.get(0).getPayload());
        assertEquals(created.getId().toString(), createdPayload.get("quarantineId").asText());
        assertEquals(12_500, createdPayload.get("quarantinedCents").asLong());
        assertEquals(QuarantineCreatedEvent.EVENT_TYPE, createdPayload.get("eventType").asText());
        printSuccess("Events follow the order of the committed transitions");
    }

    @Test
    @DisplayName("Rejected operation leaves no event behind")
    void testNoEventOnRejection() {
        assertThrows(InsufficientCapacityException.class, () -> createQuarantine(100_001));
        assertEquals(0, outboxService.countUnpublished());
    }
}
