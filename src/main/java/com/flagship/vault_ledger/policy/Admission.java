package com.flagship.vault_ledger.policy;

import com.flagship.vault_ledger.exception.VaultException;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.Optional;

/**
 * Outcome of an admission check.
 *
 * The caller consumes it before touching any state: either the operation is
 * admitted, or the violation is thrown via {@link #orThrow()}.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class Admission {

    private static final Admission ADMITTED = new Admission(null);

    VaultException violation;

    public static Admission admitted() {
        return ADMITTED;
    }

    public static Admission rejected(VaultException violation) {
        return new Admission(violation);
    }

    public boolean isAdmitted() {
        return violation == null;
    }

    public Optional<VaultException> getViolation() {
        return Optional.ofNullable(violation);
    }

    public void orThrow() {
        if (violation != null) {
            throw violation;
        }
    }
}
