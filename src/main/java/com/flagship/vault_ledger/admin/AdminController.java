package com.flagship.vault_ledger.admin;

import com.flagship.vault_ledger.admin.dto.PolicyParametersResponse;
import com.flagship.vault_ledger.admin.dto.UpdateCeilingRequest;
import com.flagship.vault_ledger.admin.dto.UpdateOracleReferenceRequest;
import com.flagship.vault_ledger.policy.LimitPolicyEngine;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Administrative endpoints. The caller identity comes from the
 * X-Caller-Address header and must match the configured administrator.
 */
@RestController
@RequestMapping("/api/admin")
@RequiredArgsConstructor
public class AdminController {

    static final String CALLER_HEADER = "X-Caller-Address";

    private final AdministrativeControlService adminService;
    private final LimitPolicyEngine policyEngine;

    @GetMapping("/parameters")
    public ResponseEntity<PolicyParametersResponse> getParameters() {
        return ResponseEntity.ok(respond(adminService.currentParameters()));
    }

    @PutMapping("/oracle")
    public ResponseEntity<PolicyParametersResponse> setOracleReference(
            @RequestHeader(CALLER_HEADER) String caller,
            @Valid @RequestBody UpdateOracleReferenceRequest request) {
        return ResponseEntity.ok(respond(adminService.setOracleReference(caller, request.getOracleReference())));
    }

    @PutMapping("/ceilings/global-deposit")
    public ResponseEntity<PolicyParametersResponse> setGlobalDepositCeiling(
            @RequestHeader(CALLER_HEADER) String caller,
            @Valid @RequestBody UpdateCeilingRequest request) {
        return ResponseEntity.ok(respond(adminService.setGlobalDepositCeiling(caller, request.getCeiling())));
    }

    @PutMapping("/ceilings/bank-capital")
    public ResponseEntity<PolicyParametersResponse> setBankCapitalCeiling(
            @RequestHeader(CALLER_HEADER) String caller,
            @Valid @RequestBody UpdateCeilingRequest request) {
        return ResponseEntity.ok(respond(adminService.setBankCapitalCeiling(caller, request.getCeiling())));
    }

    private PolicyParametersResponse respond(PolicyParameters parameters) {
        return PolicyParametersResponse.from(parameters, policyEngine.getPerWithdrawalCeiling());
    }
}
