package com.flagship.vault_ledger.vault;

import com.flagship.vault_ledger.admin.PolicyParameters;
import com.flagship.vault_ledger.admin.PolicyParametersRepository;
import com.flagship.vault_ledger.asset.AssetId;
import com.flagship.vault_ledger.event.DepositRecordedEvent;
import com.flagship.vault_ledger.event.WithdrawalRecordedEvent;
import com.flagship.vault_ledger.exception.ZeroAmountException;
import com.flagship.vault_ledger.ledger.LedgerCounters;
import com.flagship.vault_ledger.ledger.VaultLedger;
import com.flagship.vault_ledger.oracle.PriceOracleAdapter;
import com.flagship.vault_ledger.outbox.OutboxService;
import com.flagship.vault_ledger.policy.LimitPolicyEngine;
import com.flagship.vault_ledger.settlement.SettlementService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigInteger;

/**
 * The transactional part of a deposit or withdrawal.
 *
 * Order inside the transaction: admission, ledger mutation, settlement,
 * outbox event. Any failure rolls back all four. Callers go through
 * {@link VaultService}, which holds the re-entrancy guard around this.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class VaultTransactionService {

    private final VaultLedger ledger;
    private final LimitPolicyEngine policyEngine;
    private final PriceOracleAdapter oracle;
    private final PolicyParametersRepository policyParameters;
    private final SettlementService settlementService;
    private final OutboxService outboxService;

    @Transactional
    public VaultReceipt deposit(String user, AssetId asset, BigInteger amount) {
        requirePositive("deposit", user, amount);

        BigInteger stableAmount = asset.isNative() ? oracle.convertVolatileToStable(amount) : amount;

        LedgerCounters counters = ledger.lockCounters();
        PolicyParameters parameters = policyParameters.current();
        policyEngine.checkDeposit(counters.getTotalDeposits(), stableAmount, parameters).orThrow();

        BigInteger balance = ledger.recordDeposit(user, asset, amount, stableAmount);
        settlementService.collectDeposit(user, asset, amount);

        DepositRecordedEvent event = DepositRecordedEvent.of(user, asset, amount, stableAmount);
        outboxService.saveEvent(event);

        log.debug("Deposit recorded: asset={}, amount={}, stableAmount={}, totalDeposits={}",
                asset, amount, stableAmount, counters.getTotalDeposits().add(stableAmount));

        return new VaultReceipt(event.getEventId(), VaultReceipt.Operation.DEPOSIT,
                user, asset, amount, stableAmount, balance, event.getOccurredAt());
    }

    @Transactional
    public VaultReceipt withdraw(String user, AssetId asset, BigInteger amount) {
        requirePositive("withdrawal", user, amount);

        // Serializes against other instances writing the same counters row
        ledger.lockCounters();
        BigInteger available = ledger.balanceOf(user, asset);
        policyEngine.checkWithdrawal(user, asset, amount, available).orThrow();

        BigInteger balance = ledger.recordWithdrawal(user, asset, amount);
        settlementService.payOut(user, asset, amount);

        WithdrawalRecordedEvent event = WithdrawalRecordedEvent.of(user, asset, amount);
        outboxService.saveEvent(event);

        log.debug("Withdrawal recorded: asset={}, amount={}, balanceAfter={}", asset, amount, balance);

        return new VaultReceipt(event.getEventId(), VaultReceipt.Operation.WITHDRAWAL,
                user, asset, amount, null, balance, event.getOccurredAt());
    }

    private void requirePositive(String operation, String user, BigInteger amount) {
        if (amount == null || amount.signum() < 0) {
            throw new IllegalArgumentException("Amount must be zero or positive");
        }
        if (amount.signum() == 0) {
            throw new ZeroAmountException(operation, user);
        }
    }
}
