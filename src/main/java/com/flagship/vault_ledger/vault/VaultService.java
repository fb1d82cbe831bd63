package com.flagship.vault_ledger.vault;

import com.flagship.vault_ledger.admin.PolicyParametersRepository;
import com.flagship.vault_ledger.asset.Addresses;
import com.flagship.vault_ledger.asset.AssetId;
import com.flagship.vault_ledger.asset.AssetResolver;
import com.flagship.vault_ledger.exception.VaultException;
import com.flagship.vault_ledger.ledger.BalanceEntry;
import com.flagship.vault_ledger.ledger.VaultHoldings;
import com.flagship.vault_ledger.ledger.VaultLedger;
import com.flagship.vault_ledger.observability.CorrelationContext;
import com.flagship.vault_ledger.observability.VaultMetrics;
import com.flagship.vault_ledger.policy.LimitPolicyEngine;
import com.flagship.vault_ledger.settlement.ReentrancyGuard;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.util.List;

/**
 * Entry point for user-facing vault operations.
 *
 * Every mutating call holds the re-entrancy guard for its whole duration,
 * including commit or rollback of its transaction. A nested call from inside
 * a settlement fails with a re-entrant call error and aborts the outer call.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class VaultService {

    private final ReentrancyGuard guard;
    private final VaultTransactionService transactions;
    private final AssetResolver assetResolver;
    private final VaultLedger ledger;
    private final PolicyParametersRepository policyParameters;
    private final LimitPolicyEngine policyEngine;
    private final VaultMetrics vaultMetrics;

    /**
     * Deposits {@code amount} of the asset at {@code assetAddress} for {@code user}.
     *
     * @param assetAddress the zero address for the native asset, or the stable token address
     * @param amount amount in the asset's smallest unit
     */
    public VaultReceipt deposit(String user, String assetAddress, BigInteger amount) {
        String caller = Addresses.requireAccount(user);
        AssetId asset = assetResolver.resolve(assetAddress);
        requireNonNegative(amount);
        long startTime = System.currentTimeMillis();

        String previousUser = MDC.get(CorrelationContext.USER_MDC_KEY);
        String previousOperation = MDC.get(CorrelationContext.OPERATION_MDC_KEY);
        MDC.put(CorrelationContext.USER_MDC_KEY, caller);
        MDC.put(CorrelationContext.OPERATION_MDC_KEY, "deposit");
        try (ReentrancyGuard.Scope ignored = guard.enter("deposit")) {
            VaultReceipt receipt = transactions.deposit(caller, asset, amount);

            long duration = System.currentTimeMillis() - startTime;
            vaultMetrics.recordDeposit(asset.name(), "success");
            vaultMetrics.recordOperationLatency("deposit", duration);
            log.info("Deposit completed: asset={}, amount={}, stableAmount={}, duration={}ms",
                    asset, amount, receipt.getStableAmount(), duration);
            return receipt;

        } catch (VaultException e) {
            vaultMetrics.recordDeposit(asset.name(), e.getCode().name());
            log.warn("Deposit rejected: asset={}, amount={}, code={}", asset, amount, e.getCode());
            throw e;
        } catch (RuntimeException e) {
            vaultMetrics.recordDeposit(asset.name(), "error");
            log.error("Deposit failed: asset={}, amount={}, error={}", asset, amount, e.getMessage());
            throw e;
        } finally {
            restoreMdc(CorrelationContext.USER_MDC_KEY, previousUser);
            restoreMdc(CorrelationContext.OPERATION_MDC_KEY, previousOperation);
        }
    }

    public VaultReceipt withdraw(String user, String assetAddress, BigInteger amount) {
        String caller = Addresses.requireAccount(user);
        AssetId asset = assetResolver.resolve(assetAddress);
        requireNonNegative(amount);
        long startTime = System.currentTimeMillis();

        String previousUser = MDC.get(CorrelationContext.USER_MDC_KEY);
        String previousOperation = MDC.get(CorrelationContext.OPERATION_MDC_KEY);
        MDC.put(CorrelationContext.USER_MDC_KEY, caller);
        MDC.put(CorrelationContext.OPERATION_MDC_KEY, "withdraw");
        try (ReentrancyGuard.Scope ignored = guard.enter("withdraw")) {
            VaultReceipt receipt = transactions.withdraw(caller, asset, amount);

            long duration = System.currentTimeMillis() - startTime;
            vaultMetrics.recordWithdrawal(asset.name(), "success");
            vaultMetrics.recordOperationLatency("withdraw", duration);
            log.info("Withdrawal completed: asset={}, amount={}, duration={}ms", asset, amount, duration);
            return receipt;

        } catch (VaultException e) {
            vaultMetrics.recordWithdrawal(asset.name(), e.getCode().name());
            log.warn("Withdrawal rejected: asset={}, amount={}, code={}", asset, amount, e.getCode());
            throw e;
        } catch (RuntimeException e) {
            vaultMetrics.recordWithdrawal(asset.name(), "error");
            log.error("Withdrawal failed: asset={}, amount={}, error={}", asset, amount, e.getMessage());
            throw e;
        } finally {
            restoreMdc(CorrelationContext.USER_MDC_KEY, previousUser);
            restoreMdc(CorrelationContext.OPERATION_MDC_KEY, previousOperation);
        }
    }

    public BigInteger balanceOf(String user, String assetAddress) {
        return ledger.balanceOf(Addresses.normalize(user), assetResolver.resolve(assetAddress));
    }

    public List<BalanceEntry> balancesOf(String user) {
        return ledger.balancesOf(Addresses.normalize(user));
    }

    public VaultStats stats() {
        return new VaultStats(ledger.counters(), policyParameters.current(), policyEngine.getPerWithdrawalCeiling());
    }

    /**
     * Live valuation of the custody address. Fails while the oracle is stale or compromised.
     */
    public VaultHoldings holdings() {
        return ledger.holdings();
    }

    public AssetId resolveAsset(String assetAddress) {
        return assetResolver.resolve(assetAddress);
    }

    public String assetAddress(AssetId asset) {
        return assetResolver.addressOf(asset);
    }

    private static void requireNonNegative(BigInteger amount) {
        if (amount == null || amount.signum() < 0) {
            throw new IllegalArgumentException("Amount must be zero or positive");
        }
    }

    // Nested calls share this thread's MDC
    private static void restoreMdc(String key, String previous) {
        if (previous == null) {
            MDC.remove(key);
        } else {
            MDC.put(key, previous);
        }
    }
}
