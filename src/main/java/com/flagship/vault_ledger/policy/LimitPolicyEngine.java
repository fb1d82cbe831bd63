package com.flagship.vault_ledger.policy;

import com.flagship.vault_ledger.admin.PolicyParameters;
import com.flagship.vault_ledger.asset.AssetId;
import com.flagship.vault_ledger.config.VaultProperties;
import com.flagship.vault_ledger.exception.BankCapitalExceededException;
import com.flagship.vault_ledger.exception.GlobalLimitExceededException;
import com.flagship.vault_ledger.exception.InsufficientBalanceException;
import com.flagship.vault_ledger.exception.PerTransactionLimitExceededException;
import org.springframework.stereotype.Component;

import java.math.BigInteger;

/**
 * Admission rules evaluated before any ledger mutation.
 *
 * Ceilings reject only when strictly exceeded: a deposit that lands exactly
 * on a ceiling is admitted.
 */
@Component
public class LimitPolicyEngine {

    private final BigInteger perWithdrawalCeiling;

    public LimitPolicyEngine(VaultProperties properties) {
        this.perWithdrawalCeiling = properties.getPerWithdrawalCeiling();
    }

    /**
     * Checks a deposit already converted to stable units against both capital ceilings.
     * The global deposit ceiling is checked first.
     */
    public Admission checkDeposit(BigInteger totalDeposits, BigInteger stableAmount, PolicyParameters parameters) {
        BigInteger projected = totalDeposits.add(stableAmount);

        if (projected.compareTo(parameters.getGlobalDepositCeiling()) > 0) {
            return Admission.rejected(new GlobalLimitExceededException(
                totalDeposits, stableAmount, parameters.getGlobalDepositCeiling()));
        }
        if (projected.compareTo(parameters.getBankCapitalCeiling()) > 0) {
            return Admission.rejected(new BankCapitalExceededException(
                totalDeposits, stableAmount, parameters.getBankCapitalCeiling()));
        }
        return Admission.admitted();
    }

    /**
     * Checks a withdrawal. The per-transaction ceiling is checked first, so an
     * oversized request fails the same way whatever the caller's balance is.
     */
    public Admission checkWithdrawal(String user, AssetId asset, BigInteger amount, BigInteger balance) {
        if (amount.compareTo(perWithdrawalCeiling) > 0) {
            return Admission.rejected(new PerTransactionLimitExceededException(user, amount, perWithdrawalCeiling));
        }
        if (balance.compareTo(amount) < 0) {
            return Admission.rejected(new InsufficientBalanceException(user, asset, balance, amount));
        }
        return Admission.admitted();
    }

    public BigInteger getPerWithdrawalCeiling() {
        return perWithdrawalCeiling;
    }
}
