package com.flagship.budget_ledger;

import com.flagship.budget_ledger.account.Account;
import com.flagship.budget_ledger.account.AccountCategory;
import com.flagship.budget_ledger.account.AccountService;
import com.flagship.budget_ledger.account.CreateAccountCommand;
import com.flagship.budget_ledger.period.PeriodService;
import com.flagship.budget_ledger.period.WeeklyPeriod;
import com.flagship.budget_ledger.settings.ConfigureOwnerCommand;
import com.flagship.budget_ledger.settings.OwnerSettingsService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.UUID;

/**
 * Base class for tests against a real PostgreSQL.
 *
 * One container is shared by every test class so cached Spring contexts keep pointing
 * at a live database. Tests never clean up: each one works on a fresh random owner,
 * and every query is owner-scoped.
 *
 * Redis is mocked; idempotency lookups fall back to the database. The outbox
 * publisher is disabled and Kafka points at a closed port.
 */
@SpringBootTest
public abstract class PostgresIntegrationTest {

    protected static final PostgreSQLContainer<?> POSTGRES = new PostgreSQLContainer<>("postgres:15-alpine")
            .withDatabaseName("budget_ledger_test")
            .withUsername("test")
            .withPassword("test");

    static {
        POSTGRES.start();
    }

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", POSTGRES::getJdbcUrl);
        registry.add("spring.datasource.username", POSTGRES::getUsername);
        registry.add("spring.datasource.password", POSTGRES::getPassword);
        // Disable Kafka and outbox publisher for these tests
        registry.add("spring.kafka.bootstrap-servers", () -> "localhost:9999");
        registry.add("spring.kafka.admin.auto-create", () -> "false");
        registry.add("outbox.publisher.enabled", () -> "false");
    }

    @MockBean
    protected StringRedisTemplate redisTemplate;

    @Autowired
    protected JdbcTemplate jdbcTemplate;

    @Autowired
    protected AccountService accountService;

    @Autowired
    protected PeriodService periodService;

    @Autowired
    protected OwnerSettingsService settingsService;

    protected static LocalDate today() {
        return LocalDate.now(ZoneOffset.UTC);
    }

    /**
     * A new owner with default root accounts and an epoch two weeks back, so the
     * current period is the third one.
     */
    protected UUID newOwner() {
        UUID ownerId = UUID.randomUUID();
        settingsService.configure(ownerId, ConfigureOwnerCommand.builder()
            .epochDate(today().minusDays(14))
            .weekStartDay(DayOfWeek.MONDAY)
            .build());
        accountService.setupDefaultAccounts(ownerId);
        return ownerId;
    }

    protected WeeklyPeriod currentPeriod(UUID ownerId) {
        return periodService.currentPeriod(ownerId, today());
    }

    protected Account root(UUID ownerId, AccountCategory category) {
        return accountService.listAccounts(ownerId, true).stream()
            .filter(account -> account.isRootAccount() && account.getCategory() == category)
            .findFirst()
            .orElseThrow();
    }

    protected Account createAccount(UUID ownerId, String name, UUID parentId) {
        return accountService.createAccount(ownerId, CreateAccountCommand.builder()
            .name(name)
            .parentId(parentId)
            .build());
    }

    // Helper methods for test output
    protected void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    protected void printInput(String label, Object value) {
        System.out.println("INPUT  - " + label + ": " + value);
    }

    protected void printOutput(String label, Object value) {
        System.out.println("OUTPUT - " + label + ": " + value);
    }

    protected void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    protected void printExpectedException(String exceptionType, String reason) {
        System.out.println("⚠ EXPECTED EXCEPTION: " + exceptionType);
        System.out.println("  Reason: " + reason);
    }
}
