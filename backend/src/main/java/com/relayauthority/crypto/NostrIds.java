package com.relayauthority.crypto;

import java.util.HexFormat;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Identity string helpers: hex validation and NIP-19 {@code npub} conversion.
 */
public final class NostrIds {

    private static final Pattern HEX_64 = Pattern.compile("^[0-9a-fA-F]{64}$");
    private static final Pattern HEX_128 = Pattern.compile("^[0-9a-fA-F]{128}$");

    private NostrIds() {
    }

    public static boolean isHex64(String value) {
        return value != null && HEX_64.matcher(value).matches();
    }

    public static boolean isHex128(String value) {
        return value != null && HEX_128.matcher(value).matches();
    }

    public static String toNpub(String publicKeyHex) {
        if (!isHex64(publicKeyHex)) {
            throw new IllegalArgumentException("Not a 64-hex public key: " + publicKeyHex);
        }
        return Bech32.encodeBytes("npub", HexFormat.of().parseHex(publicKeyHex));
    }

    /** Normalizes a hex key or an {@code npub} to lowercase hex. */
    public static String toHex(String identity) {
        if (identity == null) {
            throw new IllegalArgumentException("Identity is missing");
        }
        String trimmed = identity.trim();
        if (isHex64(trimmed)) {
            return trimmed.toLowerCase(Locale.ROOT);
        }
        if (trimmed.toLowerCase(Locale.ROOT).startsWith("npub1")) {
            byte[] key = Bech32.decodeBytes("npub", trimmed);
            if (key.length != 32) {
                throw new IllegalArgumentException("npub does not carry a 32-byte key");
            }
            return HexFormat.of().formatHex(key);
        }
        throw new IllegalArgumentException("Not a public key: " + identity);
    }
}
