package com.flagship.inventory_ledger.outbox;

import com.flagship.inventory_ledger.inventory.ItemService;
import com.flagship.inventory_ledger.inventory.ItemType;
import com.flagship.inventory_ledger.inventory.UnitType;
import com.flagship.inventory_ledger.party.CounterpartyRole;
import com.flagship.inventory_ledger.party.PartyService;
import com.flagship.inventory_ledger.purchase.PurchaseInvoice;
import com.flagship.inventory_ledger.purchase.PurchaseLine;
import com.flagship.inventory_ledger.purchase.PurchaseService;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.ConsumerRecords;
import org.apache.kafka.clients.consumer.KafkaConsumer;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.KafkaContainer;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Properties;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Outbox events reach their Kafka topic keyed by aggregate id and are then
 * marked published.
 */
@SpringBootTest
@Testcontainers
class OutboxPublisherTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16")
            .withDatabaseName("inventory_ledger_test")
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
        registry.add("spring.data.redis.port", () -> "6390");
        registry.add("spring.data.redis.timeout", () -> "200ms");
        registry.add("management.health.redis.enabled", () -> "false");
        // Publisher bean stays, polling is triggered by hand
        registry.add("outbox.publisher.poll-interval-ms", () -> "3600000");
    }

    @Autowired
    private OutboxService outboxService;

    @Autowired
    private OutboxPublisher outboxPublisher;

    @Autowired
    private OutboxEventRepository outboxEventRepository;

    @Autowired
    private PurchaseService purchaseService;

    @Autowired
    private PartyService partyService;

    @Autowired
    private ItemService itemService;

    private String supplierId;
    private String itemId;
    private KafkaConsumer<String, String> consumer;

    @BeforeEach
    void setUp() {
        outboxEventRepository.deleteAll();

        supplierId = partyService.createCounterparty("Supplier " + shortId(), CounterpartyRole.SUPPLIER).getId();
        itemId = itemService.createItem("Raw " + shortId(), ItemType.RAW_MATERIAL, UnitType.PCS).getId();

        Properties props = new Properties();
        props.put(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, kafka.getBootstrapServers());
        props.put(ConsumerConfig.GROUP_ID_CONFIG, "test-group-" + UUID.randomUUID());
        props.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class.getName());
        props.put(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class.getName());
        props.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, "earliest");
        props.put(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, "true");

        consumer = new KafkaConsumer<>(props);
        consumer.subscribe(Collections.singletonList(outboxPublisher.topicFor("PurchaseInvoice")));
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

    @Test
    @DisplayName("Publisher sends purchase events to Kafka and marks them published")
    void testPublisher_SendsToKafka() {
        printTestHeader("Publisher Sends Events to Kafka");
        PurchaseInvoice invoice = purchase();

        assertEquals(1, outboxService.countUnpublished());
        outboxPublisher.triggerPublish();
        assertEquals(0, outboxService.countUnpublished());

        List<ConsumerRecord<String, String>> records = consumeRecords(1, 10000);
        System.out.println("Records received: " + records.size());

        assertEquals(1, records.size());
        ConsumerRecord<String, String> record = records.get(0);
        assertEquals(invoice.getId(), record.key());
        assertTrue(record.value().contains("PurchaseRecorded"));
        assertTrue(record.value().contains(supplierId));

        OutboxEvent stored = outboxService.getEventsForAggregate("PurchaseInvoice", invoice.getId()).get(0);
        assertTrue(stored.isPublished());
        printSuccess("Event published and marked as published");
    }

    @Test
    @DisplayName("Events of each invoice are keyed by its id")
    void testPublisher_UsesAggregateIdAsKey() {
        printTestHeader("Publisher Uses Aggregate ID as Key");
        List<String> invoiceIds = new ArrayList<>();
        for (int i = 0; i < 3; i++) {
            invoiceIds.add(purchase().getId());
        }

        outboxPublisher.triggerPublish();

        List<ConsumerRecord<String, String>> records = consumeRecords(3, 10000);
        assertEquals(3, records.size());
        for (ConsumerRecord<String, String> record : records) {
            System.out.println("Key: " + record.key() + ", Partition: " + record.partition());
            assertTrue(invoiceIds.contains(record.key()));
        }
        printSuccess("Events keyed by invoice id");
    }

    @Test
    @DisplayName("Each aggregate family has its own topic")
    void testTopicFor() {
        assertEquals("inventory.purchases", outboxPublisher.topicFor("PurchaseInvoice"));
        assertEquals("inventory.payments", outboxPublisher.topicFor("Payment"));
        assertEquals("inventory.production", outboxPublisher.topicFor("ProductionBatch"));
        assertEquals("inventory.stock", outboxPublisher.topicFor("Item"));
        assertThrows(IllegalArgumentException.class, () -> outboxPublisher.topicFor("Unknown"));
    }

    private PurchaseInvoice purchase() {
        return purchaseService.createPurchase(supplierId,
                List.of(PurchaseLine.of(itemId, 3, new BigDecimal("4.00"))), null, null);
    }

    private List<ConsumerRecord<String, String>> consumeRecords(int expected, long timeoutMs) {
        List<ConsumerRecord<String, String>> allRecords = new ArrayList<>();
        long endTime = System.currentTimeMillis() + timeoutMs;

        while (System.currentTimeMillis() < endTime && allRecords.size() < expected) {
            ConsumerRecords<String, String> records = consumer.poll(Duration.ofMillis(100));
            for (ConsumerRecord<String, String> record : records) {
                allRecords.add(record);
            }
        }
        return allRecords;
    }

    private static String shortId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }
}
