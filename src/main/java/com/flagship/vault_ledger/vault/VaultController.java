package com.flagship.vault_ledger.vault;

import com.flagship.vault_ledger.asset.Addresses;
import com.flagship.vault_ledger.asset.AssetId;
import com.flagship.vault_ledger.ledger.BalanceEntry;
import com.flagship.vault_ledger.vault.dto.BalanceResponse;
import com.flagship.vault_ledger.vault.dto.HoldingsResponse;
import com.flagship.vault_ledger.vault.dto.VaultOperationRequest;
import com.flagship.vault_ledger.vault.dto.VaultReceiptResponse;
import com.flagship.vault_ledger.vault.dto.VaultStatsResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigInteger;
import java.util.List;
import java.util.stream.Collectors;

/**
 * REST API for depositors.
 *
 * The caller's address comes from the X-Caller-Address header; it is the
 * account credited or debited and the source or destination of the transfer.
 */
@RestController
@RequestMapping("/api/vault")
@RequiredArgsConstructor
@Slf4j
public class VaultController {

    private static final String CALLER_HEADER = "X-Caller-Address";

    private final VaultService vaultService;

    @PostMapping("/deposits")
    public ResponseEntity<VaultReceiptResponse> deposit(
            @RequestHeader(CALLER_HEADER) String caller,
            @Valid @RequestBody VaultOperationRequest request) {

        log.info("Received deposit request: asset={}, amount={}", request.getAsset(), request.getAmount());

        VaultReceipt receipt = vaultService.deposit(caller, request.getAsset(), request.getAmount());
        return ResponseEntity.status(HttpStatus.CREATED)
            .body(VaultReceiptResponse.from(receipt, vaultService.assetAddress(receipt.getAsset())));
    }

    @PostMapping("/withdrawals")
    public ResponseEntity<VaultReceiptResponse> withdraw(
            @RequestHeader(CALLER_HEADER) String caller,
            @Valid @RequestBody VaultOperationRequest request) {

        log.info("Received withdrawal request: asset={}, amount={}", request.getAsset(), request.getAmount());

        VaultReceipt receipt = vaultService.withdraw(caller, request.getAsset(), request.getAmount());
        return ResponseEntity.status(HttpStatus.CREATED)
            .body(VaultReceiptResponse.from(receipt, vaultService.assetAddress(receipt.getAsset())));
    }

    @GetMapping("/balances/{user}/{asset}")
    public ResponseEntity<BalanceResponse> getBalance(@PathVariable("user") String user,
                                                      @PathVariable("asset") String asset) {
        AssetId assetId = vaultService.resolveAsset(asset);
        BigInteger balance = vaultService.balanceOf(user, asset);
        return ResponseEntity.ok(new BalanceResponse(Addresses.normalize(user),
            vaultService.assetAddress(assetId), assetId.name(), balance));
    }

    @GetMapping("/balances/{user}")
    public ResponseEntity<List<BalanceResponse>> getBalances(@PathVariable("user") String user) {
        List<BalanceResponse> balances = vaultService.balancesOf(user).stream()
            .map(this::toResponse)
            .collect(Collectors.toList());
        return ResponseEntity.ok(balances);
    }

    @GetMapping("/stats")
    public ResponseEntity<VaultStatsResponse> getStats() {
        return ResponseEntity.ok(VaultStatsResponse.from(vaultService.stats()));
    }

    @GetMapping("/holdings")
    public ResponseEntity<HoldingsResponse> getHoldings() {
        return ResponseEntity.ok(HoldingsResponse.from(vaultService.holdings()));
    }

    private BalanceResponse toResponse(BalanceEntry entry) {
        return new BalanceResponse(entry.getUser(), vaultService.assetAddress(entry.getAsset()),
            entry.getAsset().name(), entry.getAmount());
    }
}
