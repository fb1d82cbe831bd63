package com.flagship.vault_ledger.asset;

import java.util.Locale;
import java.util.regex.Pattern;

public final class Addresses {

    public static final String ZERO_ADDRESS = "0x0000000000000000000000000000000000000000";

    private static final Pattern ADDRESS = Pattern.compile("^0x[0-9a-fA-F]{40}$");

    private Addresses() {
        // Utility class
    }

    /**
     * Lower-cases an address so that checksummed and plain spellings map to the same key.
     */
    public static String normalize(String address) {
        if (address == null || address.isBlank()) {
            throw new IllegalArgumentException("Address is required");
        }
        return address.trim().toLowerCase(Locale.ROOT);
    }

    public static boolean same(String left, String right) {
        return left != null && right != null && normalize(left).equals(normalize(right));
    }

    /**
     * Normalizes a user address, rejecting malformed ones and the zero address.
     */
    public static String requireAccount(String address) {
        String normalized = normalize(address);
        if (!ADDRESS.matcher(normalized).matches()) {
            throw new IllegalArgumentException("Malformed address: " + address);
        }
        if (ZERO_ADDRESS.equals(normalized)) {
            throw new IllegalArgumentException("The zero address cannot hold a balance");
        }
        return normalized;
    }
}
