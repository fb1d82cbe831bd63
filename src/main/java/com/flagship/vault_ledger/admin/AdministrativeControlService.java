package com.flagship.vault_ledger.admin;

import com.flagship.vault_ledger.asset.Addresses;
import com.flagship.vault_ledger.config.VaultProperties;
import com.flagship.vault_ledger.event.OracleReferenceChangedEvent;
import com.flagship.vault_ledger.event.PolicyCeilingChangedEvent;
import com.flagship.vault_ledger.event.PolicyCeilingChangedEvent.Ceiling;
import com.flagship.vault_ledger.exception.UnauthorizedException;
import com.flagship.vault_ledger.observability.VaultMetrics;
import com.flagship.vault_ledger.outbox.OutboxService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigInteger;

/**
 * Parameter changes reserved to the configured administrator.
 *
 * Changes take effect for the next admitted operation. Ceilings are not
 * checked against current totals: lowering a ceiling below totalDeposits
 * simply blocks further deposits.
 */
@Service
@Slf4j
public class AdministrativeControlService {

    // Ceilings are stored as NUMERIC(78,0)
    private static final BigInteger CEILING_LIMIT = BigInteger.TEN.pow(78);

    private final PolicyParametersRepository repository;
    private final OutboxService outboxService;
    private final VaultMetrics vaultMetrics;
    private final String adminAddress;

    public AdministrativeControlService(PolicyParametersRepository repository,
                                        OutboxService outboxService,
                                        VaultMetrics vaultMetrics,
                                        VaultProperties properties) {
        this.repository = repository;
        this.outboxService = outboxService;
        this.vaultMetrics = vaultMetrics;
        this.adminAddress = Addresses.normalize(properties.getAdminAddress());
    }

    /**
     * Points the oracle adapter at another price feed.
     *
     * @throws UnauthorizedException if the caller is not the administrator
     * @throws IllegalArgumentException if the reference is blank
     */
    @Transactional
    public PolicyParameters setOracleReference(String caller, String newReference) {
        requireAdmin(caller, "setOracleReference");
        if (newReference == null || newReference.isBlank()) {
            throw new IllegalArgumentException("Oracle reference must not be blank");
        }
        String reference = newReference.trim();

        String previous = repository.currentOracleReference();
        repository.updateOracleReference(reference);
        outboxService.saveEvent(OracleReferenceChangedEvent.of(previous, reference, Addresses.normalize(caller)));
        vaultMetrics.recordAdminChange("oracle_reference");

        log.info("Oracle reference changed: previous={}, new={}", previous, reference);
        return repository.current();
    }

    @Transactional
    public PolicyParameters setGlobalDepositCeiling(String caller, BigInteger ceiling) {
        requireAdmin(caller, "setGlobalDepositCeiling");
        requireStorableCeiling(ceiling);

        BigInteger previous = repository.current().getGlobalDepositCeiling();
        repository.updateGlobalDepositCeiling(ceiling);
        outboxService.saveEvent(PolicyCeilingChangedEvent.of(
            Ceiling.GLOBAL_DEPOSIT, previous, ceiling, Addresses.normalize(caller)));
        vaultMetrics.recordAdminChange("global_deposit_ceiling");

        log.info("Global deposit ceiling changed: previous={}, new={}", previous, ceiling);
        return repository.current();
    }

    @Transactional
    public PolicyParameters setBankCapitalCeiling(String caller, BigInteger ceiling) {
        requireAdmin(caller, "setBankCapitalCeiling");
        requireStorableCeiling(ceiling);

        BigInteger previous = repository.current().getBankCapitalCeiling();
        repository.updateBankCapitalCeiling(ceiling);
        outboxService.saveEvent(PolicyCeilingChangedEvent.of(
            Ceiling.BANK_CAPITAL, previous, ceiling, Addresses.normalize(caller)));
        vaultMetrics.recordAdminChange("bank_capital_ceiling");

        log.info("Bank capital ceiling changed: previous={}, new={}", previous, ceiling);
        return repository.current();
    }

    @Transactional(readOnly = true)
    public PolicyParameters currentParameters() {
        return repository.current();
    }

    private void requireAdmin(String caller, String operation) {
        if (caller == null || caller.isBlank() || !Addresses.same(caller, adminAddress)) {
            log.warn("Unauthorized administrative call: caller={}, operation={}", caller, operation);
            throw new UnauthorizedException(String.valueOf(caller), operation);
        }
    }

    private void requireStorableCeiling(BigInteger ceiling) {
        if (ceiling == null || ceiling.signum() < 0) {
            throw new IllegalArgumentException("Ceiling must be zero or positive");
        }
        if (ceiling.compareTo(CEILING_LIMIT) >= 0) {
            throw new IllegalArgumentException("Ceiling must fit in 78 digits");
        }
    }
}
