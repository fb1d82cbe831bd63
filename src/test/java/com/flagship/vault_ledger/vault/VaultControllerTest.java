package com.flagship.vault_ledger.vault;

import com.flagship.vault_ledger.VaultIntegrationTestSupport;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@AutoConfigureMockMvc
class VaultControllerTest extends VaultIntegrationTestSupport {

    private static final String CALLER_HEADER = "X-Caller-Address";

    @Autowired
    private MockMvc mockMvc;

    private String body(String asset, String amount) {
        return "{\"asset\":\"" + asset + "\",\"amount\":" + amount + "}";
    }

    @Test
    @DisplayName("POST /api/vault/deposits credits the caller and returns a receipt")
    void depositReturnsReceipt() throws Exception {
        printTestHeader("Deposit Endpoint");

        mockMvc.perform(post("/api/vault/deposits")
                .header(CALLER_HEADER, USER)
                .contentType(MediaType.APPLICATION_JSON)
                .content(body(NATIVE, "1000000000000000000")))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.operation").value("DEPOSIT"))
            .andExpect(jsonPath("$.asset_id").value("NATIVE"))
            .andExpect(jsonPath("$.amount").value("1000000000000000000"))
            .andExpect(jsonPath("$.stable_amount").value("2000"))
            .andExpect(jsonPath("$.balance_after").value("1000000000000000000"))
            .andExpect(jsonPath("$.event_id").exists());

        mockMvc.perform(get("/api/vault/balances/{user}/{asset}", USER, NATIVE))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.balance").value("1000000000000000000"));

        mockMvc.perform(get("/api/vault/stats"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.total_deposits").value("2000"))
            .andExpect(jsonPath("$.deposit_count").value(1))
            .andExpect(jsonPath("$.withdrawal_count").value(0));
        printSuccess("Deposit credited and reflected in stats");
    }

    @Test
    @DisplayName("Rule violations come back with their typed code and details")
    void insufficientBalanceIsTyped() throws Exception {
        mockMvc.perform(post("/api/vault/deposits")
                .header(CALLER_HEADER, USER)
                .contentType(MediaType.APPLICATION_JSON)
                .content(body(STABLE_TOKEN, "500")))
            .andExpect(status().isCreated());

        mockMvc.perform(post("/api/vault/withdrawals")
                .header(CALLER_HEADER, USER)
                .contentType(MediaType.APPLICATION_JSON)
                .content(body(STABLE_TOKEN, "600")))
            .andExpect(status().isUnprocessableEntity())
            .andExpect(jsonPath("$.code").value("INSUFFICIENT_BALANCE"))
            .andExpect(jsonPath("$.details.available").value("500"))
            .andExpect(jsonPath("$.details.requested").value("600"));
    }

    @Test
    @DisplayName("Zero amount maps to 400 ZERO_AMOUNT")
    void zeroAmountIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/vault/deposits")
                .header(CALLER_HEADER, USER)
                .contentType(MediaType.APPLICATION_JSON)
                .content(body(STABLE_TOKEN, "0")))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.code").value("ZERO_AMOUNT"));
    }

    @Test
    @DisplayName("Stale oracle maps to 503 ORACLE_STALE")
    void staleOracleIsServiceUnavailable() throws Exception {
        publishPrice(ORACLE_REFERENCE, PRICE_2000, Instant.now().getEpochSecond() - 7200);

        mockMvc.perform(post("/api/vault/deposits")
                .header(CALLER_HEADER, USER)
                .contentType(MediaType.APPLICATION_JSON)
                .content(body(NATIVE, "1000000000000000000")))
            .andExpect(status().isServiceUnavailable())
            .andExpect(jsonPath("$.code").value("ORACLE_STALE"));

        mockMvc.perform(get("/api/vault/holdings"))
            .andExpect(status().isServiceUnavailable());
    }

    @Test
    @DisplayName("Missing caller header is rejected")
    void missingCallerHeader() throws Exception {
        mockMvc.perform(post("/api/vault/deposits")
                .contentType(MediaType.APPLICATION_JSON)
                .content(body(STABLE_TOKEN, "5")))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("Missing Required Header"));
    }

    @Test
    @DisplayName("Negative amounts and malformed assets fail validation")
    void invalidBodyFailsValidation() throws Exception {
        mockMvc.perform(post("/api/vault/deposits")
                .header(CALLER_HEADER, USER)
                .contentType(MediaType.APPLICATION_JSON)
                .content(body(STABLE_TOKEN, "-5")))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.details.amount").exists());

        mockMvc.perform(post("/api/vault/deposits")
                .header(CALLER_HEADER, USER)
                .contentType(MediaType.APPLICATION_JSON)
                .content(body("not-an-address", "5")))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.details.asset").exists());
    }

    @Test
    @DisplayName("Unsupported asset maps to 400 UNSUPPORTED_ASSET")
    void unsupportedAsset() throws Exception {
        mockMvc.perform(get("/api/vault/balances/{user}/{asset}", USER, "0x00000000000000000000000000000000000000ff"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.code").value("UNSUPPORTED_ASSET"));
    }

    @Test
    @DisplayName("Admin endpoints reject other callers with 403")
    void adminEndpointRequiresAdmin() throws Exception {
        mockMvc.perform(put("/api/admin/ceilings/global-deposit")
                .header(CALLER_HEADER, USER)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"ceiling\":10}"))
            .andExpect(status().isForbidden())
            .andExpect(jsonPath("$.code").value("UNAUTHORIZED"));

        mockMvc.perform(put("/api/admin/ceilings/global-deposit")
                .header(CALLER_HEADER, ADMIN)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"ceiling\":10}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.global_deposit_ceiling").value("10"));

        mockMvc.perform(put("/api/admin/oracle")
                .header(CALLER_HEADER, ADMIN)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"oracle_reference\":\"\"}"))
            .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("Ceiling wider than the stored column fails validation instead of reaching the database")
    void oversizedCeilingFailsValidation() throws Exception {
        String seventyNineDigits = "1" + "0".repeat(78);

        mockMvc.perform(put("/api/admin/ceilings/bank-capital")
                .header(CALLER_HEADER, ADMIN)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"ceiling\":" + seventyNineDigits + "}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.details.ceiling").exists());

        mockMvc.perform(get("/api/admin/parameters"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.bank_capital_ceiling").value(INITIAL_CEILING.toString()));
    }

    @Test
    @DisplayName("GET /health reports database and oracle status")
    void healthEndpoint() throws Exception {
        mockMvc.perform(get("/health"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("UP"))
            .andExpect(jsonPath("$.database").value("UP"))
            .andExpect(jsonPath("$.oracle").value("UP"));
    }
}
