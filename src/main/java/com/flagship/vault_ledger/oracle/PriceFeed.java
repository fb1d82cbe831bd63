package com.flagship.vault_ledger.oracle;

import java.util.Optional;

/**
 * Read-only view of an external price feed.
 */
@FunctionalInterface
public interface PriceFeed {

    /**
     * Latest published round, or empty if the feed never published one.
     */
    Optional<RoundData> latestRoundData();
}
