package com.flagship.payday.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.flagship.payday.command.SettleInvoice;
import com.flagship.payday.node.NodeException;
import com.flagship.payday.payment.Amount;
import com.flagship.payday.support.PaydayTestHarness;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.http.converter.json.MappingJackson2HttpMessageConverter;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.UUID;

import static org.hamcrest.Matchers.startsWith;
import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Invoice API tests against in-memory stores and simulated nodes.
 *
 * These tests verify:
 * - Same request with the same Idempotency-Key returns the same invoice
 * - Idempotency key is required
 * - Validation and domain errors map to the documented status codes
 */
class InvoiceControllerTest {

    private PaydayTestHarness harness;
    private MockMvc mockMvc;

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printInput(String label, Object value) {
        System.out.println("INPUT  - " + label + ": " + value);
    }

    private void printOutput(String label, Object value) {
        System.out.println("OUTPUT - " + label + ": " + value);
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    @BeforeEach
    void setUp() {
        harness = new PaydayTestHarness();
        mockMvc = MockMvcBuilders
            .standaloneSetup(new InvoiceController(harness.commandHandler, harness.repository, harness.paymentMetrics))
            .setControllerAdvice(new GlobalExceptionHandler())
            .setMessageConverters(new MappingJackson2HttpMessageConverter(harness.objectMapper))
            .build();
    }

    private static String invoiceJson(String method, long sats) {
        return String.format("{\"method\":\"%s\",\"amount_sats\":%d,\"expiry_seconds\":600,\"memo\":\"coffee\"}",
            method, sats);
    }

    private JsonNode createInvoice(String key, String body) throws Exception {
        MvcResult result = mockMvc.perform(post("/api/invoices")
                .header(IdempotencyKeys.HEADER, key)
                .contentType(MediaType.APPLICATION_JSON)
                .content(body))
            .andExpect(status().isCreated())
            .andReturn();
        return harness.objectMapper.readTree(result.getResponse().getContentAsString());
    }

    @Test
    @DisplayName("Same Idempotency-Key returns the invoice created the first time")
    void createInvoiceIdempotent() throws Exception {
        printTestHeader("Same Idempotency-Key returns the invoice created the first time");
        String key = "order-" + UUID.randomUUID();
        String body = invoiceJson("LIGHTNING", 21_000);
        printInput("Idempotency-Key", key);
        printInput("Body", body);

        JsonNode first = createInvoice(key, body);
        printOutput("First response", first);

        assertEquals("AWAITING_PAYMENT", first.get("status").asText());
        assertEquals("INCOMING", first.get("direction").asText());
        assertEquals(21_000, first.get("amount_requested_sats").asLong());
        assertTrue(first.get("payment_request").asText().startsWith("lnsim1:"));
        assertEquals("2026-01-15T10:10:00Z", first.get("expires_at").asText());

        mockMvc.perform(post("/api/invoices")
                .header(IdempotencyKeys.HEADER, key)
                .contentType(MediaType.APPLICATION_JSON)
                .content(body))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.id").value(first.get("id").asText()))
            .andExpect(jsonPath("$.payment_request").value(first.get("payment_request").asText()));

        assertEquals(1.0, harness.meterRegistry.counter("payday.idempotency", "result", "hit").count());
        assertEquals(1.0, harness.meterRegistry.counter("payday.idempotency", "result", "miss").count());

        printSuccess("Replay answered with the original invoice");
    }

    @Test
    @DisplayName("On-chain invoice exposes its address")
    void createOnChainInvoice() throws Exception {
        JsonNode invoice = createInvoice("onchain-" + UUID.randomUUID(), invoiceJson("ON_CHAIN", 100_000));

        assertEquals("ON_CHAIN", invoice.get("method").asText());
        assertTrue(invoice.get("payment_request").asText().startsWith("bcrt1"));
        assertEquals(invoice.get("payment_request").asText(), invoice.get("node_reference").asText());
    }

    @Test
    @DisplayName("Missing Idempotency-Key is rejected with 400")
    void missingIdempotencyKey() throws Exception {
        mockMvc.perform(post("/api/invoices")
                .contentType(MediaType.APPLICATION_JSON)
                .content(invoiceJson("LIGHTNING", 1_000)))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("Missing Required Header"));
    }

    @Test
    @DisplayName("Invalid body fields are reported per field")
    void validationErrors() throws Exception {
        mockMvc.perform(post("/api/invoices")
                .header(IdempotencyKeys.HEADER, "bad-" + UUID.randomUUID())
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"amount_sats\":-5}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("Validation Failed"))
            .andExpect(jsonPath("$.details.amountSats").exists())
            .andExpect(jsonPath("$.details.method").exists());
    }

    @Test
    @DisplayName("Unreadable JSON and unknown enum values are rejected with 400")
    void malformedBody() throws Exception {
        mockMvc.perform(post("/api/invoices")
                .header(IdempotencyKeys.HEADER, "bad-" + UUID.randomUUID())
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"method\":\"CARRIER_PIGEON\",\"amount_sats\":5}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("Malformed Request"));
    }

    @Test
    @DisplayName("Node failure while creating the invoice maps to 502")
    void nodeFailure() throws Exception {
        harness.lightningNode.failNextCall(new NodeException("sim-lightning", "connection refused"));

        mockMvc.perform(post("/api/invoices")
                .header(IdempotencyKeys.HEADER, "node-down-" + UUID.randomUUID())
                .contentType(MediaType.APPLICATION_JSON)
                .content(invoiceJson("LIGHTNING", 1_000)))
            .andExpect(status().isBadGateway())
            .andExpect(jsonPath("$.error").value("Node Unavailable"));
    }

    @Test
    @DisplayName("GET returns the invoice; unknown ids are 404")
    void getInvoice() throws Exception {
        JsonNode invoice = createInvoice("get-" + UUID.randomUUID(), invoiceJson("LIGHTNING", 3_000));

        mockMvc.perform(get("/api/invoices/" + invoice.get("id").asText()))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("AWAITING_PAYMENT"))
            .andExpect(jsonPath("$.memo").value("coffee"))
            .andExpect(jsonPath("$.payment_request", startsWith("lnsim1:")));

        mockMvc.perform(get("/api/invoices/" + UUID.randomUUID()))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.error").value("Not Found"));

        mockMvc.perform(get("/api/invoices/not-a-uuid"))
            .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("Cancel works while unpaid and is rejected once settled")
    void cancelInvoice() throws Exception {
        JsonNode open = createInvoice("cancel-" + UUID.randomUUID(), invoiceJson("LIGHTNING", 3_000));
        mockMvc.perform(post("/api/invoices/" + open.get("id").asText() + "/cancel")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"reason\":\"customer left\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("CANCELED"))
            .andExpect(jsonPath("$.failure_message").value("customer left"));

        JsonNode paid = createInvoice("paid-" + UUID.randomUUID(), invoiceJson("LIGHTNING", 3_000));
        UUID paidId = UUID.fromString(paid.get("id").asText());
        harness.commandHandler.handle(new SettleInvoice(paidId, Amount.sats(3_000), null));

        mockMvc.perform(post("/api/invoices/" + paidId + "/cancel"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("Invalid Request"));
    }
}
