package com.flagship.vault_ledger.oracle;

/**
 * Resolves an oracle reference into the feed it names.
 */
public interface PriceFeedDirectory {

    PriceFeed resolve(String oracleReference);
}
