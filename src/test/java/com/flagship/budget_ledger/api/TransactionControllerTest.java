package com.flagship.budget_ledger.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.budget_ledger.PostgresIntegrationTest;
import com.flagship.budget_ledger.account.Account;
import com.flagship.budget_ledger.account.AccountCategory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import java.math.BigDecimal;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@AutoConfigureMockMvc
class TransactionControllerTest extends PostgresIntegrationTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    private UUID ownerId;
    private UUID periodId;
    private Account paycheck;
    private Account groceries;

    @BeforeEach
    void setUp() {
        ownerId = newOwner();
        periodId = currentPeriod(ownerId).getId();
        paycheck = createAccount(ownerId, "Paycheck", root(ownerId, AccountCategory.INCOME).getId());
        groceries = createAccount(ownerId, "Groceries", root(ownerId, AccountCategory.EXPENSE).getId());
    }

    @Test
    @DisplayName("Repeated Idempotency-Key returns the original transfer without moving money twice")
    void testTransferIsIdempotent() throws Exception {
        printTestHeader("Idempotent transfer over HTTP");

        // Given
        postIncome(paycheck.getId(), "500.00", UUID.randomUUID().toString());
        String key = UUID.randomUUID().toString();
        String body = transferJson(paycheck.getId(), groceries.getId(), "120.00");
        printInput("Idempotency-Key", key);

        // When
        MvcResult first = mockMvc.perform(post("/api/owners/{ownerId}/transfers", ownerId)
                .contentType(MediaType.APPLICATION_JSON)
                .header("Idempotency-Key", key)
                .content(body))
            .andExpect(status().isCreated())
            .andReturn();
        MvcResult replay = mockMvc.perform(post("/api/owners/{ownerId}/transfers", ownerId)
                .contentType(MediaType.APPLICATION_JSON)
                .header("Idempotency-Key", key)
                .content(body))
            .andExpect(status().isOk())
            .andReturn();

        // Then
        JsonNode created = objectMapper.readTree(first.getResponse().getContentAsString());
        JsonNode replayed = objectMapper.readTree(replay.getResponse().getContentAsString());
        printOutput("Created", created);
        assertEquals(created.get("transfer_id").asText(), replayed.get("transfer_id").asText());
        assertEquals(0, new BigDecimal("-120.00").compareTo(created.get("debit").get("amount").decimalValue()));
        assertEquals(0, new BigDecimal("380.00").compareTo(balanceOf(paycheck.getId())));
        assertEquals(0, new BigDecimal("120.00").compareTo(balanceOf(groceries.getId())));
        printSuccess("Replay returned the same transfer and balances moved once");
    }

    @Test
    @DisplayName("Same key on different resource types creates two independent results")
    void testIdempotencyKeyScopedPerResource() throws Exception {
        printTestHeader("Key scoping");

        String key = "shared-key-" + UUID.randomUUID();
        postIncome(paycheck.getId(), "200.00", key);

        mockMvc.perform(post("/api/owners/{ownerId}/transfers", ownerId)
                .contentType(MediaType.APPLICATION_JSON)
                .header("Idempotency-Key", key)
                .content(transferJson(paycheck.getId(), groceries.getId(), "50.00")))
            .andExpect(status().isCreated());

        assertEquals(0, new BigDecimal("150.00").compareTo(balanceOf(paycheck.getId())));
        printSuccess("Transaction and transfer keys do not collide");
    }

    @Test
    @DisplayName("Transfer without Idempotency-Key is rejected with 400")
    void testMissingIdempotencyKey() throws Exception {
        printTestHeader("Missing Idempotency-Key");

        mockMvc.perform(post("/api/owners/{ownerId}/transfers", ownerId)
                .contentType(MediaType.APPLICATION_JSON)
                .content(transferJson(paycheck.getId(), groceries.getId(), "10.00")))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("Missing Required Header"));

        printExpectedException("MissingRequestHeaderException", "Header is mandatory for writes");
    }

    @Test
    @DisplayName("Unknown destination account maps to 404 UNKNOWN_ACCOUNT")
    void testUnknownAccount() throws Exception {
        printTestHeader("Unknown account");

        mockMvc.perform(post("/api/owners/{ownerId}/transfers", ownerId)
                .contentType(MediaType.APPLICATION_JSON)
                .header("Idempotency-Key", UUID.randomUUID().toString())
                .content(transferJson(paycheck.getId(), UUID.randomUUID(), "10.00")))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.kind").value("UNKNOWN_ACCOUNT"));

        printExpectedException("UnknownAccountException", "Destination does not exist");
    }

    @Test
    @DisplayName("Transfer to the same account maps to 400 SAME_ACCOUNT")
    void testSameAccountTransfer() throws Exception {
        printTestHeader("Same account transfer");

        mockMvc.perform(post("/api/owners/{ownerId}/transfers", ownerId)
                .contentType(MediaType.APPLICATION_JSON)
                .header("Idempotency-Key", UUID.randomUUID().toString())
                .content(transferJson(paycheck.getId(), paycheck.getId(), "10.00")))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.kind").value("SAME_ACCOUNT"));
    }

    @Test
    @DisplayName("Amount with more than two decimals maps to 400 INVALID_AMOUNT")
    void testInvalidAmount() throws Exception {
        printTestHeader("Invalid amount");

        mockMvc.perform(post("/api/owners/{ownerId}/transfers", ownerId)
                .contentType(MediaType.APPLICATION_JSON)
                .header("Idempotency-Key", UUID.randomUUID().toString())
                .content(transferJson(paycheck.getId(), groceries.getId(), "10.005")))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.kind").value("INVALID_AMOUNT"));
    }

    @Test
    @DisplayName("Malformed JSON body is rejected with 400")
    void testMalformedBody() throws Exception {
        printTestHeader("Malformed body");

        mockMvc.perform(post("/api/owners/{ownerId}/transactions", ownerId)
                .contentType(MediaType.APPLICATION_JSON)
                .header("Idempotency-Key", UUID.randomUUID().toString())
                .content("{\"account_id\": \"not-a-uuid\", \"amount\": }"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("Malformed Request"));
    }

    @Test
    @DisplayName("Missing required fields are reported as validation errors")
    void testValidationFailure() throws Exception {
        printTestHeader("Validation failure");

        mockMvc.perform(post("/api/owners/{ownerId}/transactions", ownerId)
                .contentType(MediaType.APPLICATION_JSON)
                .header("Idempotency-Key", UUID.randomUUID().toString())
                .content("{\"description\": \"no account\"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("Validation Failed"));
    }

    @Test
    @DisplayName("Second reversal of a transaction maps to 409 ALREADY_REVERSED")
    void testReverseTwice() throws Exception {
        printTestHeader("Double reversal");

        // Given
        JsonNode income = postIncome(paycheck.getId(), "75.00", UUID.randomUUID().toString());
        String transactionId = income.get("id").asText();

        // When
        mockMvc.perform(post("/api/owners/{ownerId}/transactions/{id}/reversal", ownerId, transactionId)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"description\": \"entered twice\"}"))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$[0].reverses_id").value(transactionId));

        // Then
        mockMvc.perform(post("/api/owners/{ownerId}/transactions/{id}/reversal", ownerId, transactionId))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.kind").value("ALREADY_REVERSED"));
        assertEquals(0, BigDecimal.ZERO.compareTo(balanceOf(paycheck.getId())));
        printSuccess("Reversal is applied exactly once");
    }

    @Test
    @DisplayName("Transactions and transfers are readable by id and scoped to the owner")
    void testLookups() throws Exception {
        printTestHeader("Lookups");

        JsonNode income = postIncome(paycheck.getId(), "40.00", UUID.randomUUID().toString());
        String id = income.get("id").asText();

        mockMvc.perform(get("/api/owners/{ownerId}/transactions/{id}", ownerId, id))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.kind").value("INCOME"))
            .andExpect(jsonPath("$.period_id").value(periodId.toString()));

        mockMvc.perform(get("/api/owners/{ownerId}/transactions/{id}", UUID.randomUUID(), id))
            .andExpect(status().isNotFound());

        mockMvc.perform(get("/api/owners/{ownerId}/transfers/{id}", ownerId, UUID.randomUUID()))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.kind").value("UNKNOWN_REFERENCE"));
    }

    private JsonNode postIncome(UUID accountId, String amount, String key) throws Exception {
        String body = String.format(
            "{\"account_id\": \"%s\", \"period_id\": \"%s\", \"amount\": %s, \"kind\": \"INCOME\"}",
            accountId, periodId, amount);
        MvcResult result = mockMvc.perform(post("/api/owners/{ownerId}/transactions", ownerId)
                .contentType(MediaType.APPLICATION_JSON)
                .header("Idempotency-Key", key)
                .content(body))
            .andExpect(status().isCreated())
            .andReturn();
        return objectMapper.readTree(result.getResponse().getContentAsString());
    }

    private String transferJson(UUID source, UUID destination, String amount) {
        return String.format(
            "{\"source_account_id\": \"%s\", \"destination_account_id\": \"%s\", \"period_id\": \"%s\", \"amount\": %s}",
            source, destination, periodId, amount);
    }

    private BigDecimal balanceOf(UUID accountId) throws Exception {
        MvcResult result = mockMvc.perform(get("/api/owners/{ownerId}/accounts/{id}/balance", ownerId, accountId))
            .andExpect(status().isOk())
            .andReturn();
        return objectMapper.readTree(result.getResponse().getContentAsString()).get("balance").decimalValue();
    }
}
