package com.flagship.vault_ledger.outbox;

import com.flagship.vault_ledger.asset.AssetId;
import com.flagship.vault_ledger.event.DepositRecordedEvent;
import com.flagship.vault_ledger.event.WithdrawalRecordedEvent;
import com.flagship.vault_ledger.settlement.CustodyWalletRepository;
import com.flagship.vault_ledger.vault.VaultBootstrap;
import com.flagship.vault_ledger.vault.VaultService;
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
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.KafkaContainer;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.math.BigInteger;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Properties;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Outbox events written by vault operations reach a real Kafka broker,
 * keyed by user address, and are marked published afterwards.
 */
@SpringBootTest
@Testcontainers
class OutboxKafkaPublishingTest {

    private static final String STABLE_TOKEN = "0xa0b86991c6218b36c1d19d4a2e9eb0ce3606eb48";

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16")
            .withDatabaseName("vault_ledger_test")
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
        registry.add("vault.stable-token-address", () -> STABLE_TOKEN);
        // Publisher bean stays, but the schedule never fires again after startup; tests trigger it
        registry.add("outbox.publisher.enabled", () -> "true");
        registry.add("outbox.publisher.poll-interval-ms", () -> "3600000");
    }

    @Autowired
    private OutboxPublisher outboxPublisher;

    @Autowired
    private OutboxService outboxService;

    @Autowired
    private VaultService vaultService;

    @Autowired
    private VaultBootstrap bootstrap;

    @Autowired
    private CustodyWalletRepository custodyWallets;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @Value("${kafka.topic.vault-events:vault-events}")
    private String vaultEventsTopic;

    private KafkaConsumer<String, String> consumer;
    private String user;

    @BeforeEach
    void setUp() {
        jdbcTemplate.update("DELETE FROM outbox_events");
        jdbcTemplate.update("DELETE FROM vault_balances");
        jdbcTemplate.update("DELETE FROM vault_counters");
        jdbcTemplate.update("DELETE FROM custody_wallets");
        bootstrap.initialize();
        // Fresh user per test: records from earlier tests carry other keys
        user = "0x00000000" + UUID.randomUUID().toString().replace("-", "");
        custodyWallets.credit(user, AssetId.STABLE, BigInteger.valueOf(1_000));

        Properties props = new Properties();
        props.put(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, kafka.getBootstrapServers());
        props.put(ConsumerConfig.GROUP_ID_CONFIG, "test-group-" + UUID.randomUUID());
        props.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class.getName());
        props.put(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class.getName());
        props.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, "earliest");
        props.put(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, "true");

        consumer = new KafkaConsumer<>(props);
        consumer.subscribe(Collections.singletonList(vaultEventsTopic));
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
    @DisplayName("Deposit event is sent to Kafka keyed by user and marked published")
    void depositEventReachesBroker() {
        printTestHeader("Deposit Event Published to Kafka");

        vaultService.deposit(user, STABLE_TOKEN, BigInteger.valueOf(25));
        assertEquals(1, outboxService.countUnpublished());

        outboxPublisher.publishPendingEvents();

        assertEquals(0, outboxService.countUnpublished());

        List<ConsumerRecord<String, String>> records = consumeRecords(1, 10000);
        assertEquals(1, records.size());

        ConsumerRecord<String, String> record = records.get(0);
        System.out.println("Record key: " + record.key() + ", value: " + record.value());
        assertEquals(user, record.key());
        assertTrue(record.value().contains(DepositRecordedEvent.EVENT_TYPE));
        assertTrue(record.value().contains("\"amount\":\"25\""));
        printSuccess("Event delivered and marked published");
    }

    @Test
    @DisplayName("Events of one user keep their order on the topic")
    void eventsOfOneUserStayOrdered() {
        printTestHeader("Per-User Ordering");

        vaultService.deposit(user, STABLE_TOKEN, BigInteger.valueOf(40));
        vaultService.withdraw(user, STABLE_TOKEN, BigInteger.valueOf(15));
        vaultService.deposit(user, STABLE_TOKEN, BigInteger.valueOf(5));

        outboxPublisher.publishPendingEvents();

        List<ConsumerRecord<String, String>> records = consumeRecords(3, 10000);
        assertEquals(3, records.size());
        assertTrue(records.get(0).value().contains(DepositRecordedEvent.EVENT_TYPE));
        assertTrue(records.get(1).value().contains(WithdrawalRecordedEvent.EVENT_TYPE));
        assertTrue(records.get(2).value().contains(DepositRecordedEvent.EVENT_TYPE));
        // One key, one partition
        assertEquals(1, records.stream().map(ConsumerRecord::partition).distinct().count());
        printSuccess("Deposit, withdrawal, deposit arrived in order");
    }

    private List<ConsumerRecord<String, String>> consumeRecords(int expected, long timeoutMs) {
        List<ConsumerRecord<String, String>> allRecords = new ArrayList<>();
        long endTime = System.currentTimeMillis() + timeoutMs;

        while (System.currentTimeMillis() < endTime && allRecords.size() < expected) {
            ConsumerRecords<String, String> records = consumer.poll(Duration.ofMillis(100));
            for (ConsumerRecord<String, String> record : records) {
                if (user.equals(record.key())) {
                    allRecords.add(record);
                }
            }
        }

        return allRecords;
    }
}
