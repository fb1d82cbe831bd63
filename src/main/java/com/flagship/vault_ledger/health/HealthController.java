package com.flagship.vault_ledger.health;

import javax.sql.DataSource;
import java.sql.Connection;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

import com.flagship.vault_ledger.exception.VaultException;
import com.flagship.vault_ledger.oracle.PriceOracleAdapter;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Liveness endpoint that does not require actuator access.
 *
 * The service is DOWN only when the database is unreachable. A stale or
 * compromised oracle is reported but leaves the service UP, because stable
 * deposits and all withdrawals still work without it.
 */
@RestController
public class HealthController {

    private final DataSource dataSource;
    private final PriceOracleAdapter oracle;

    public HealthController(DataSource dataSource, PriceOracleAdapter oracle) {
        this.dataSource = dataSource;
        this.oracle = oracle;
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "UP");
        response.put("timestamp", Instant.now().toString());

        boolean dbHealthy = checkDatabase();
        response.put("database", dbHealthy ? "UP" : "DOWN");

        if (!dbHealthy) {
            response.put("status", "DOWN");
            return ResponseEntity.status(503).body(response);
        }

        response.put("oracle", checkOracle());
        return ResponseEntity.ok(response);
    }

    private boolean checkDatabase() {
        try (Connection connection = dataSource.getConnection()) {
            return connection.isValid(2);
        } catch (Exception e) {
            return false;
        }
    }

    private String checkOracle() {
        try {
            oracle.peekVolatileAssetPrice();
            return "UP";
        } catch (VaultException e) {
            return e.getCode().name();
        } catch (RuntimeException e) {
            return "UNKNOWN";
        }
    }
}
