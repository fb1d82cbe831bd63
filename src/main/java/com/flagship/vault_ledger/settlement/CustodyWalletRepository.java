package com.flagship.vault_ledger.settlement;

import com.flagship.vault_ledger.asset.AssetId;
import com.flagship.vault_ledger.ledger.SqlAmounts;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.List;

/**
 * Balances held by the custody wallets, i.e. where value actually sits.
 *
 * This is distinct from the vault ledger: the ledger records what the vault
 * owes each user, custody wallets record what each account physically holds.
 */
@Repository
public class CustodyWalletRepository {

    private final JdbcTemplate jdbcTemplate;

    public CustodyWalletRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public BigInteger balanceOf(String account, AssetId asset) {
        List<BigDecimal> rows = jdbcTemplate.queryForList(
            "SELECT amount FROM custody_wallets WHERE account = ? AND asset = ?",
            BigDecimal.class,
            account,
            asset.name()
        );
        return rows.isEmpty() ? BigInteger.ZERO : SqlAmounts.fromColumn(rows.get(0));
    }

    /**
     * Moves value between two accounts.
     * The debit only applies when the sender holds enough; nothing changes otherwise.
     *
     * @return false if the sender could not cover the amount
     */
    public boolean move(String from, String to, AssetId asset, BigInteger amount) {
        int debited = jdbcTemplate.update(
            "UPDATE custody_wallets SET amount = amount - ?, updated_at = CURRENT_TIMESTAMP " +
            "WHERE account = ? AND asset = ? AND amount >= ?",
            SqlAmounts.toColumn(amount),
            from,
            asset.name(),
            SqlAmounts.toColumn(amount)
        );
        if (debited == 0) {
            return false;
        }
        credit(to, asset, amount);
        return true;
    }

    public void credit(String account, AssetId asset, BigInteger amount) {
        int updated = jdbcTemplate.update(
            "UPDATE custody_wallets SET amount = amount + ?, updated_at = CURRENT_TIMESTAMP " +
            "WHERE account = ? AND asset = ?",
            SqlAmounts.toColumn(amount),
            account,
            asset.name()
        );
        if (updated == 0) {
            jdbcTemplate.update(
                "INSERT INTO custody_wallets (account, asset, amount, updated_at) VALUES (?, ?, ?, CURRENT_TIMESTAMP)",
                account,
                asset.name(),
                SqlAmounts.toColumn(amount)
            );
        }
    }
}
