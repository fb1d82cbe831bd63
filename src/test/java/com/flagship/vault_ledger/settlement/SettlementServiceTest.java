package com.flagship.vault_ledger.settlement;

import com.flagship.vault_ledger.asset.AssetId;
import com.flagship.vault_ledger.config.VaultProperties;
import com.flagship.vault_ledger.exception.ReentrantCallException;
import com.flagship.vault_ledger.exception.SettlementFailedException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SettlementServiceTest {

    private static final String VAULT = "0x1000000000000000000000000000000000000001";
    private static final String USER = "0x00000000000000000000000000000000000000a1";
    private static final BigInteger AMOUNT = BigInteger.valueOf(250);

    @Mock
    private NativeAssetGateway nativeGateway;

    @Mock
    private StableToken stableToken;

    private SettlementService settlementService;

    @BeforeEach
    void setUp() {
        VaultProperties properties = new VaultProperties();
        properties.setVaultAddress(VAULT.toUpperCase().replace("0X", "0x"));
        settlementService = new SettlementService(nativeGateway, stableToken, properties);
    }

    @Test
    @DisplayName("Native deposit moves value from the user to the vault")
    void nativeDepositPullsIntoVault() {
        when(nativeGateway.transfer(USER, VAULT, AMOUNT)).thenReturn(true);

        settlementService.collectDeposit(USER, AssetId.NATIVE, AMOUNT);

        verify(nativeGateway).transfer(USER, VAULT, AMOUNT);
        verifyNoInteractions(stableToken);
    }

    @Test
    @DisplayName("Stable deposit uses transferFrom into the vault")
    void stableDepositUsesTransferFrom() {
        when(stableToken.transferFrom(USER, VAULT, AMOUNT)).thenReturn(true);

        settlementService.collectDeposit(USER, AssetId.STABLE, AMOUNT);

        verify(stableToken).transferFrom(USER, VAULT, AMOUNT);
        verifyNoInteractions(nativeGateway);
    }

    @Test
    @DisplayName("Stable withdrawal uses transfer from the vault")
    void stableWithdrawalUsesTransfer() {
        when(stableToken.transfer(USER, AMOUNT)).thenReturn(true);

        settlementService.payOut(USER, AssetId.STABLE, AMOUNT);

        verify(stableToken).transfer(USER, AMOUNT);
    }

    @Test
    @DisplayName("A false transfer result is a settlement failure")
    void falseResultFails() {
        when(nativeGateway.transfer(VAULT, USER, AMOUNT)).thenReturn(false);

        SettlementFailedException e = assertThrows(SettlementFailedException.class,
            () -> settlementService.payOut(USER, AssetId.NATIVE, AMOUNT));

        assertEquals(VAULT, e.getDetails().get("from"));
        assertEquals(USER, e.getDetails().get("to"));
        assertEquals("250", e.getDetails().get("amount"));
    }

    @Test
    @DisplayName("Unexpected gateway errors are wrapped with their cause")
    void gatewayErrorIsWrapped() {
        RuntimeException failure = new RuntimeException("connection reset");
        when(stableToken.transferFrom(USER, VAULT, AMOUNT)).thenThrow(failure);

        SettlementFailedException e = assertThrows(SettlementFailedException.class,
            () -> settlementService.collectDeposit(USER, AssetId.STABLE, AMOUNT));

        assertSame(failure, e.getCause());
    }

    @Test
    @DisplayName("Vault errors raised inside a transfer propagate unchanged")
    void vaultErrorsPropagate() {
        when(nativeGateway.transfer(VAULT, USER, AMOUNT)).thenThrow(new ReentrantCallException("withdraw"));

        assertThrows(ReentrantCallException.class, () -> settlementService.payOut(USER, AssetId.NATIVE, AMOUNT));
    }

    @Test
    @DisplayName("Vault balance is read from the custody address")
    void vaultBalanceReadsCustody() {
        when(nativeGateway.balanceOf(VAULT)).thenReturn(AMOUNT);

        assertEquals(AMOUNT, settlementService.vaultBalance(AssetId.NATIVE));
        assertEquals(VAULT, settlementService.getVaultAddress());
    }
}
