package com.elssolution.insteonbridge.domain;

import java.util.Locale;

/**
 * Insteon addresses show up as "1A.2B.3C", "1a2b3c" or "1A:2B:3C" depending on who
 * produced them. Every key in the bridge goes through {@link #normalize(String)}.
 */
public final class DeviceIds {

    public static final String UNKNOWN = "unknown";

    private DeviceIds() {
    }

    /** Strips '.' and ':' separators and lower-cases. Idempotent. */
    public static String normalize(String address) {
        if (address == null) return UNKNOWN;
        return address.trim()
                .replace(".", "")
                .replace(":", "")
                .toLowerCase(Locale.ROOT);
    }

    public static boolean sameDevice(String a, String b) {
        return normalize(a).equals(normalize(b));
    }
}
