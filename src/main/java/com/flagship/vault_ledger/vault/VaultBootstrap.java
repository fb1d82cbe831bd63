package com.flagship.vault_ledger.vault;

import com.flagship.vault_ledger.admin.PolicyParametersRepository;
import com.flagship.vault_ledger.config.VaultProperties;
import com.flagship.vault_ledger.ledger.VaultLedger;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * Writes the policy and counters rows on first start.
 *
 * Existing rows are left alone, so ceilings and the oracle reference changed
 * by the administrator survive restarts.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class VaultBootstrap implements ApplicationRunner {

    private final PolicyParametersRepository policyParameters;
    private final VaultLedger ledger;
    private final VaultProperties properties;

    @Override
    @Transactional
    public void run(ApplicationArguments args) {
        initialize();
    }

    public void initialize() {
        boolean created = policyParameters.initializeIfAbsent(
            properties.getInitialGlobalDepositCeiling(),
            properties.getInitialBankCapitalCeiling(),
            properties.getOracle().getInitialReference().trim()
        );
        if (created) {
            log.info("Initialized vault policy: globalDepositCeiling={}, bankCapitalCeiling={}, oracleReference={}",
                properties.getInitialGlobalDepositCeiling(),
                properties.getInitialBankCapitalCeiling(),
                properties.getOracle().getInitialReference());
        }
        ledger.initializeIfAbsent();
    }
}
