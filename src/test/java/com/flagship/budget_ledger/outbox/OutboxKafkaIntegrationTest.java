package com.flagship.budget_ledger.outbox;

import com.flagship.budget_ledger.account.Account;
import com.flagship.budget_ledger.account.AccountCategory;
import com.flagship.budget_ledger.account.AccountService;
import com.flagship.budget_ledger.account.CreateAccountCommand;
import com.flagship.budget_ledger.event.TransferPostedEvent;
import com.flagship.budget_ledger.ledger.LedgerService;
import com.flagship.budget_ledger.ledger.Transfer;
import com.flagship.budget_ledger.ledger.TransferCommand;
import com.flagship.budget_ledger.period.PeriodService;
import com.flagship.budget_ledger.settings.ConfigureOwnerCommand;
import com.flagship.budget_ledger.settings.OwnerSettingsService;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.consumer.ConsumerRecord;
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

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.time.DayOfWeek;
import java.time.Duration;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Collections;
import java.util.List;
import java.util.Properties;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Outbox rows written by a ledger command reach Kafka through the scheduled publisher.
 */
@SpringBootTest
@Testcontainers(disabledWithoutDocker = true)
class OutboxKafkaIntegrationTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:15-alpine")
            .withDatabaseName("budget_ledger_kafka_test")
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
        registry.add("outbox.publisher.enabled", () -> "true");
        registry.add("outbox.publisher.poll-interval-ms", () -> "200");
    }

    @MockBean
    private StringRedisTemplate redisTemplate;

    @Autowired
    private OutboxService outboxService;

    @Autowired
    private OwnerSettingsService settingsService;

    @Autowired
    private AccountService accountService;

    @Autowired
    private PeriodService periodService;

    @Autowired
    private LedgerService ledgerService;

    @Value("${kafka.topic.ledger-events:budget-ledger-events}")
    private String topic;

    private KafkaConsumer<String, String> consumer;

    @BeforeEach
    void setUp() {
        Properties props = new Properties();
        props.put(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, kafka.getBootstrapServers());
        props.put(ConsumerConfig.GROUP_ID_CONFIG, "test-group-" + UUID.randomUUID());
        props.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class.getName());
        props.put(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class.getName());
        props.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, "earliest");

        consumer = new KafkaConsumer<>(props);
        consumer.subscribe(Collections.singletonList(topic));
    }

    @AfterEach
    void tearDown() {
        consumer.close();
    }

    @Test
    @DisplayName("Posted transfer is published keyed by transfer id and marked published")
    void testTransferEventReachesKafka() throws InterruptedException {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: Transfer event reaches Kafka");
        System.out.println("=".repeat(80));

        // Given
        UUID ownerId = UUID.randomUUID();
        LocalDate today = LocalDate.now(ZoneOffset.UTC);
        settingsService.configure(ownerId, ConfigureOwnerCommand.builder()
            .epochDate(today.minusDays(7))
            .weekStartDay(DayOfWeek.MONDAY)
            .build());
        List<Account> roots = accountService.setupDefaultAccounts(ownerId);
        UUID income = rootId(roots, AccountCategory.INCOME);
        UUID savings = rootId(roots, AccountCategory.SAVINGS);
        Account paycheck = accountService.createAccount(ownerId, CreateAccountCommand.builder()
            .name("Paycheck").parentId(income).build());
        Account fund = accountService.createAccount(ownerId, CreateAccountCommand.builder()
            .name("Vacation").parentId(savings).build());

        // When
        Transfer transfer = ledgerService.postTransfer(ownerId, TransferCommand.builder()
            .sourceAccountId(paycheck.getId())
            .destinationAccountId(fund.getId())
            .periodId(periodService.currentPeriod(ownerId, today).getId())
            .amount(new BigDecimal("75.00"))
            .build());

        // Then
        ConsumerRecord<String, String> received = awaitRecord(transfer.getTransferId().toString());
        assertNotNull(received, "TransferPosted event should be consumed within the timeout");
        Header eventType = received.headers().lastHeader(OutboxPublisher.EVENT_TYPE_HEADER);
        assertEquals(TransferPostedEvent.EVENT_TYPE, new String(eventType.value(), StandardCharsets.UTF_8));
        assertTrue(received.value().contains(transfer.getTransferId().toString()));

        OutboxEvent stored = awaitPublished(transfer.getTransferId());
        assertTrue(stored.isPublished());
        System.out.println("✓ SUCCESS: Event published to partition " + received.partition());
    }

    private ConsumerRecord<String, String> awaitRecord(String key) {
        long deadline = System.currentTimeMillis() + 30_000;
        while (System.currentTimeMillis() < deadline) {
            for (ConsumerRecord<String, String> record : consumer.poll(Duration.ofMillis(500))) {
                if (key.equals(record.key())) {
                    return record;
                }
            }
        }
        return null;
    }

    private OutboxEvent awaitPublished(UUID transferId) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 10_000;
        OutboxEvent event = null;
        while (System.currentTimeMillis() < deadline) {
            event = outboxService.eventsForAggregate(TransferPostedEvent.AGGREGATE_TYPE, transferId).get(0);
            if (event.isPublished()) {
                return event;
            }
            Thread.sleep(200);
        }
        return event;
    }

    private static UUID rootId(List<Account> roots, AccountCategory category) {
        return roots.stream()
            .filter(account -> account.getCategory() == category)
            .findFirst()
            .orElseThrow()
            .getId();
    }
}
