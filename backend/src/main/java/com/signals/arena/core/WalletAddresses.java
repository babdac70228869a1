package com.signals.arena.core;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Addresses are compared and stored in lower case, {@code 0x}-prefixed form.
 */
public final class WalletAddresses {

    private static final Pattern ADDRESS = Pattern.compile("^0x[0-9a-fA-F]{40}$");

    private WalletAddresses() {
    }

    public static String normalize(String address) {
        if (address == null) {
            throw new IllegalArgumentException("Address is required");
        }
        String trimmed = address.trim();
        if (!ADDRESS.matcher(trimmed).matches()) {
            throw new IllegalArgumentException("Address must be 0x followed by 40 hex characters");
        }
        return trimmed.toLowerCase(Locale.ROOT);
    }

    public static boolean isValid(String address) {
        return address != null && ADDRESS.matcher(address.trim()).matches();
    }

    public static String shorten(String address) {
        if (address == null || address.length() < 10) {
            return address;
        }
        return address.substring(0, 6) + "..." + address.substring(address.length() - 4);
    }
}
