package com.flagship.vault_ledger.admin;

import com.flagship.vault_ledger.ledger.SqlAmounts;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.math.BigInteger;
import java.sql.Timestamp;
import java.util.List;

/**
 * Storage of the single policy row.
 *
 * Only {@link AdministrativeControlService} writes through this repository;
 * everything else reads.
 */
@Repository
public class PolicyParametersRepository {

    private static final int POLICY_ROW_ID = 1;

    private final JdbcTemplate jdbcTemplate;

    public PolicyParametersRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * Writes the initial policy row unless one already exists.
     *
     * @return true if the row was created
     */
    public boolean initializeIfAbsent(BigInteger globalDepositCeiling, BigInteger bankCapitalCeiling,
                                      String oracleReference) {
        Integer existing = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM vault_policy WHERE id = ?", Integer.class, POLICY_ROW_ID);
        if (existing != null && existing > 0) {
            return false;
        }
        jdbcTemplate.update(
            "INSERT INTO vault_policy (id, global_deposit_ceiling, bank_capital_ceiling, oracle_reference, updated_at) " +
            "VALUES (?, ?, ?, ?, CURRENT_TIMESTAMP)",
            POLICY_ROW_ID,
            SqlAmounts.toColumn(globalDepositCeiling),
            SqlAmounts.toColumn(bankCapitalCeiling),
            oracleReference
        );
        return true;
    }

    public PolicyParameters current() {
        List<PolicyParameters> rows = jdbcTemplate.query(
            "SELECT global_deposit_ceiling, bank_capital_ceiling, oracle_reference, updated_at " +
            "FROM vault_policy WHERE id = ?",
            policyRowMapper(),
            POLICY_ROW_ID
        );
        if (rows.isEmpty()) {
            throw new IllegalStateException("Vault policy has not been initialized");
        }
        return rows.get(0);
    }

    public String currentOracleReference() {
        return current().getOracleReference();
    }

    public void updateOracleReference(String oracleReference) {
        update("oracle_reference", oracleReference);
    }

    public void updateGlobalDepositCeiling(BigInteger ceiling) {
        update("global_deposit_ceiling", SqlAmounts.toColumn(ceiling));
    }

    public void updateBankCapitalCeiling(BigInteger ceiling) {
        update("bank_capital_ceiling", SqlAmounts.toColumn(ceiling));
    }

    private void update(String column, Object value) {
        int rows = jdbcTemplate.update(
            "UPDATE vault_policy SET " + column + " = ?, updated_at = CURRENT_TIMESTAMP WHERE id = ?",
            value,
            POLICY_ROW_ID
        );
        if (rows != 1) {
            throw new IllegalStateException("Vault policy has not been initialized");
        }
    }

    private RowMapper<PolicyParameters> policyRowMapper() {
        return (rs, rowNum) -> {
            Timestamp updatedAt = rs.getTimestamp("updated_at");
            return new PolicyParameters(
                SqlAmounts.fromColumn(rs.getBigDecimal("global_deposit_ceiling")),
                SqlAmounts.fromColumn(rs.getBigDecimal("bank_capital_ceiling")),
                rs.getString("oracle_reference"),
                updatedAt != null ? updatedAt.toInstant() : null
            );
        };
    }
}
