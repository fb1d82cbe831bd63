package com.flagship.vault_ledger.oracle;

import lombok.Value;

import java.math.BigInteger;

/**
 * One answer of a price feed, in the shape aggregator feeds publish.
 * Only {@code answer} and {@code updatedAt} take part in validation.
 */
@Value
public class RoundData {
    BigInteger roundId;
    BigInteger answer;
    long startedAt;
    /** Epoch seconds of the last update. */
    long updatedAt;
    BigInteger answeredInRound;
}
