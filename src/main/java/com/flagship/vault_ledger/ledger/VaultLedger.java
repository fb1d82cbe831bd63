package com.flagship.vault_ledger.ledger;

import com.flagship.vault_ledger.asset.AssetId;
import com.flagship.vault_ledger.oracle.PriceOracleAdapter;
import com.flagship.vault_ledger.settlement.SettlementService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.List;

/**
 * Authoritative record of what the vault owes each user.
 *
 * Owns the (user, asset) balance table and the aggregate counters; nothing
 * else writes them. Mutations must be preceded by a passing admission check
 * and run inside the caller's transaction. Invariants:
 * 1. A balance never goes negative (also enforced by a CHECK constraint)
 * 2. Counters only grow
 * 3. totalDeposits is never decremented
 */
@Service
@Slf4j
public class VaultLedger {

    private static final int COUNTERS_ROW_ID = 1;

    private final JdbcTemplate jdbcTemplate;
    private final PriceOracleAdapter oracle;
    private final SettlementService settlementService;

    public VaultLedger(JdbcTemplate jdbcTemplate, PriceOracleAdapter oracle, SettlementService settlementService) {
        this.jdbcTemplate = jdbcTemplate;
        this.oracle = oracle;
        this.settlementService = settlementService;
    }

    /**
     * Writes the zeroed counters row unless one already exists.
     */
    public void initializeIfAbsent() {
        Integer existing = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM vault_counters WHERE id = ?", Integer.class, COUNTERS_ROW_ID);
        if (existing == null || existing == 0) {
            jdbcTemplate.update(
                "INSERT INTO vault_counters (id, total_deposits, deposit_count, withdrawal_count) VALUES (?, 0, 0, 0)",
                COUNTERS_ROW_ID);
            log.info("Initialized vault counters");
        }
    }

    /**
     * Reads the counters and locks their row until the current transaction ends,
     * so concurrent instances evaluate ceilings against the same totals.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public LedgerCounters lockCounters() {
        return readCounters(" FOR UPDATE");
    }

    public LedgerCounters counters() {
        return readCounters("");
    }

    /**
     * Credits a deposit.
     *
     * @param amount amount in the asset's smallest unit, added to the balance
     * @param stableAmount the same deposit in stable units, added to totalDeposits
     * @return the user's balance after the deposit
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public BigInteger recordDeposit(String user, AssetId asset, BigInteger amount, BigInteger stableAmount) {
        int updated = jdbcTemplate.update(
            "UPDATE vault_balances SET amount = amount + ?, updated_at = CURRENT_TIMESTAMP " +
            "WHERE user_address = ? AND asset = ?",
            SqlAmounts.toColumn(amount), user, asset.name()
        );
        if (updated == 0) {
            jdbcTemplate.update(
                "INSERT INTO vault_balances (user_address, asset, amount, updated_at) VALUES (?, ?, ?, CURRENT_TIMESTAMP)",
                user, asset.name(), SqlAmounts.toColumn(amount)
            );
        }

        jdbcTemplate.update(
            "UPDATE vault_counters SET total_deposits = total_deposits + ?, deposit_count = deposit_count + 1 " +
            "WHERE id = ?",
            SqlAmounts.toColumn(stableAmount), COUNTERS_ROW_ID
        );

        return balanceOf(user, asset);
    }

    /**
     * Debits a withdrawal.
     *
     * @return the user's balance after the withdrawal
     * @throws IllegalStateException if the balance cannot cover the amount; admission should have caught this
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public BigInteger recordWithdrawal(String user, AssetId asset, BigInteger amount) {
        int updated = jdbcTemplate.update(
            "UPDATE vault_balances SET amount = amount - ?, updated_at = CURRENT_TIMESTAMP " +
            "WHERE user_address = ? AND asset = ? AND amount >= ?",
            SqlAmounts.toColumn(amount), user, asset.name(), SqlAmounts.toColumn(amount)
        );
        if (updated != 1) {
            throw new IllegalStateException(
                String.format("Balance of %s for %s cannot cover withdrawal of %s", asset, user, amount));
        }

        jdbcTemplate.update(
            "UPDATE vault_counters SET withdrawal_count = withdrawal_count + 1 WHERE id = ?",
            COUNTERS_ROW_ID
        );

        return balanceOf(user, asset);
    }

    public BigInteger balanceOf(String user, AssetId asset) {
        List<BigDecimal> rows = jdbcTemplate.queryForList(
            "SELECT amount FROM vault_balances WHERE user_address = ? AND asset = ?",
            BigDecimal.class,
            user,
            asset.name()
        );
        return rows.isEmpty() ? BigInteger.ZERO : SqlAmounts.fromColumn(rows.get(0));
    }

    public List<BalanceEntry> balancesOf(String user) {
        return jdbcTemplate.query(
            "SELECT user_address, asset, amount FROM vault_balances WHERE user_address = ? ORDER BY asset",
            balanceRowMapper(),
            user
        );
    }

    /**
     * Values what the custody address holds at the live oracle price.
     * Unlike totalDeposits this shrinks with withdrawals and moves with the price.
     */
    public VaultHoldings holdings() {
        BigInteger nativeHeld = settlementService.vaultBalance(AssetId.NATIVE);
        BigInteger stableHeld = settlementService.vaultBalance(AssetId.STABLE);
        BigInteger nativeValue = oracle.convertVolatileToStable(nativeHeld);
        return new VaultHoldings(nativeHeld, stableHeld, nativeValue, nativeValue.add(stableHeld));
    }

    public BigInteger totalHeldValue() {
        return holdings().getTotalHeldValue();
    }

    private LedgerCounters readCounters(String lockClause) {
        List<LedgerCounters> rows = jdbcTemplate.query(
            "SELECT total_deposits, deposit_count, withdrawal_count FROM vault_counters WHERE id = ?" + lockClause,
            (rs, rowNum) -> new LedgerCounters(
                SqlAmounts.fromColumn(rs.getBigDecimal("total_deposits")),
                rs.getLong("deposit_count"),
                rs.getLong("withdrawal_count")
            ),
            COUNTERS_ROW_ID
        );
        if (rows.isEmpty()) {
            throw new IllegalStateException("Vault counters have not been initialized");
        }
        return rows.get(0);
    }

    private RowMapper<BalanceEntry> balanceRowMapper() {
        return (rs, rowNum) -> new BalanceEntry(
            rs.getString("user_address"),
            AssetId.valueOf(rs.getString("asset")),
            SqlAmounts.fromColumn(rs.getBigDecimal("amount"))
        );
    }
}
