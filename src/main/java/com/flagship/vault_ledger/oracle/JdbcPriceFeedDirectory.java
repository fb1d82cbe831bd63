package com.flagship.vault_ledger.oracle;

import com.flagship.vault_ledger.ledger.SqlAmounts;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Price feeds backed by the price_feed_rounds table.
 *
 * The feed provider appends rounds to that table; this service only ever
 * reads the newest round of the referenced feed.
 */
@Component
public class JdbcPriceFeedDirectory implements PriceFeedDirectory {

    private final JdbcTemplate jdbcTemplate;

    public JdbcPriceFeedDirectory(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public PriceFeed resolve(String oracleReference) {
        return () -> latestRound(oracleReference);
    }

    private Optional<RoundData> latestRound(String oracleReference) {
        List<RoundData> rounds = jdbcTemplate.query(
            "SELECT round_id, answer, started_at, updated_at, answered_in_round " +
            "FROM price_feed_rounds WHERE feed_reference = ? ORDER BY round_id DESC LIMIT 1",
            roundRowMapper(),
            oracleReference
        );
        return rounds.stream().findFirst();
    }

    private RowMapper<RoundData> roundRowMapper() {
        return (rs, rowNum) -> new RoundData(
            SqlAmounts.fromColumn(rs.getBigDecimal("round_id")),
            SqlAmounts.fromColumn(rs.getBigDecimal("answer")),
            rs.getLong("started_at"),
            rs.getLong("updated_at"),
            SqlAmounts.fromColumn(rs.getBigDecimal("answered_in_round"))
        );
    }
}
