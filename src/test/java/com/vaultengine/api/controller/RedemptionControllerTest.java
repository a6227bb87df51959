package com.vaultengine.api.controller;

import com.vaultengine.common.VaultErrorCode;
import com.vaultengine.common.VaultException;
import com.vaultengine.journal.RedemptionJournal;
import com.vaultengine.redemption.RedemptionService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.math.BigInteger;
import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Web layer tests for the redemption API and its error mapping.
 */
@WebMvcTest(controllers = RedemptionController.class)
class RedemptionControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private RedemptionService redemptionService;

    @MockBean
    private RedemptionJournal journal;

    @Test
    void testRequestRedeemUsesCallerHeader() throws Exception {
        when(redemptionService.requestRedeem("USDC", BigInteger.valueOf(100), "alice", "alice", "alice"))
            .thenReturn(BigInteger.ZERO);

        mockMvc.perform(post("/api/v1/redemptions/USDC/requests")
                .header("X-Vault-Caller", "alice")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"shares\": 100, \"controller\": \"alice\", \"owner\": \"alice\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.requestId").value(0));
    }

    @Test
    void testCancelWithoutSharesCancelsEverything() throws Exception {
        when(redemptionService.cancelRedeem("USDC", "alice", "alice", "alice")).thenReturn(BigInteger.valueOf(70));

        mockMvc.perform(post("/api/v1/redemptions/USDC/cancel")
                .header("X-Vault-Caller", "alice")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"controller\": \"alice\", \"receiver\": \"alice\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.sharesCanceled").value(70));

        verify(redemptionService, never()).cancelRedeemPartial(any(), any(), any(), any(), any());
    }

    @Test
    void testFulfillBatchSplitsEntries() throws Exception {
        when(redemptionService.fulfillBatch(List.of("USDC", "USDT"),
                List.of(BigInteger.valueOf(100), BigInteger.valueOf(50)), List.of("alice", "bob"), "operator"))
            .thenReturn(List.of(BigInteger.valueOf(99), BigInteger.valueOf(49)));

        mockMvc.perform(post("/api/v1/redemptions/fulfill-batch")
                .header("X-Vault-Caller", "operator")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"entries\": ["
                    + "{\"asset\": \"USDC\", \"controller\": \"alice\", \"shares\": 100},"
                    + "{\"asset\": \"USDT\", \"controller\": \"bob\", \"shares\": 50}]}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$[0]").value(99))
            .andExpect(jsonPath("$[1]").value(49));
    }

    @Test
    void testLedgerErrorMapsToBadRequest() throws Exception {
        when(redemptionService.withdraw(eq("USDC"), any(), any(), any(), any()))
            .thenThrow(new VaultException(VaultErrorCode.INSUFFICIENT_CLAIMABLE_ASSETS, "requested 100, claimable 99"));

        mockMvc.perform(post("/api/v1/redemptions/USDC/withdraw")
                .header("X-Vault-Caller", "alice")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"assets\": 100, \"receiver\": \"alice\", \"controller\": \"alice\"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.code").value("INSUFFICIENT_CLAIMABLE_ASSETS"));
    }

    @Test
    void testUnauthorizedMapsToForbidden() throws Exception {
        when(redemptionService.fulfillRedeem(any(), any(), any(), eq("alice")))
            .thenThrow(new VaultException(VaultErrorCode.UNAUTHORIZED, "alice is not an operator"));

        mockMvc.perform(post("/api/v1/redemptions/USDC/fulfill")
                .header("X-Vault-Caller", "alice")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"controller\": \"alice\", \"shares\": 100}"))
            .andExpect(status().isForbidden())
            .andExpect(jsonPath("$.status").value("403"));
    }

    @Test
    void testPausedMapsToConflict() throws Exception {
        when(redemptionService.fulfillRedeem(any(), any(), any(), any()))
            .thenThrow(new VaultException(VaultErrorCode.VAULT_PAUSED));

        mockMvc.perform(post("/api/v1/redemptions/USDC/fulfill")
                .header("X-Vault-Caller", "operator")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"controller\": \"alice\", \"shares\": 100}"))
            .andExpect(status().isConflict());
    }

    @Test
    void testInvalidBodyRejected() throws Exception {
        mockMvc.perform(post("/api/v1/redemptions/USDC/requests")
                .header("X-Vault-Caller", "alice")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"controller\": \"alice\", \"owner\": \"alice\"}"))
            .andExpect(status().isBadRequest());

        verifyNoInteractions(redemptionService);
    }
}
