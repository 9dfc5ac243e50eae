package com.tokenwatch.indexer.util;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Validation of user-supplied account addresses.
 */
public final class Addresses {

    private static final Pattern ADDRESS = Pattern.compile("^0x[0-9a-fA-F]{40}$");

    private Addresses() {
    }

    /**
     * @return the lowercased address, or null when {@code address} is null or blank
     * @throws IllegalArgumentException if the address is not 0x followed by 40 hex digits
     */
    public static String normalizeOptional(String address, String name) {
        if (address == null || address.isBlank()) {
            return null;
        }
        String trimmed = address.trim();
        if (!ADDRESS.matcher(trimmed).matches()) {
            throw new IllegalArgumentException(name + " is not a valid address: " + address);
        }
        return trimmed.toLowerCase(Locale.ROOT);
    }

    /**
     * Like {@link #normalizeOptional(String, String)} but the address must be present.
     */
    public static String normalize(String address, String name) {
        String normalized = normalizeOptional(address, name);
        if (normalized == null) {
            throw new IllegalArgumentException(name + " is required");
        }
        return normalized;
    }
}
