package com.flagship.vault_ledger;

import com.flagship.vault_ledger.config.VaultProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
@EnableConfigurationProperties(VaultProperties.class)
public class VaultLedgerApplication {

    public static void main(String[] args) {
        SpringApplication.run(VaultLedgerApplication.class, args);
    }
}
