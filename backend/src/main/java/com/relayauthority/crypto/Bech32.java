package com.relayauthority.crypto;

import java.io.ByteArrayOutputStream;
import java.util.Locale;

/**
 * Bech32 (BIP-173) encoding without the 90 character limit, so it also covers
 * BOLT11 payment requests. Data is handled as 5-bit words.
 */
public final class Bech32 {

    private static final String CHARSET = "qpzry9x8gf2tvdw0s3jn54khce6mua7l";
    private static final int[] GENERATOR = {0x3b6a57b2, 0x25264ab4, 0x1ea119fa, 0x3d4233dd, 0x2a1462b3};

    public record Decoded(String hrp, byte[] words) {
    }

    private Bech32() {
    }

    public static String encode(String hrp, byte[] words) {
        String lowerHrp = hrp.toLowerCase(Locale.ROOT);
        byte[] checksum = checksum(lowerHrp, words);
        StringBuilder out = new StringBuilder(lowerHrp.length() + 1 + words.length + 6);
        out.append(lowerHrp).append('1');
        for (byte word : words) {
            out.append(CHARSET.charAt(word));
        }
        for (byte word : checksum) {
            out.append(CHARSET.charAt(word));
        }
        return out.toString();
    }

    public static Decoded decode(String input) {
        if (input == null || input.isEmpty()) {
            throw new IllegalArgumentException("Empty bech32 string");
        }
        String lower = input.toLowerCase(Locale.ROOT);
        if (!lower.equals(input) && !input.toUpperCase(Locale.ROOT).equals(input)) {
            throw new IllegalArgumentException("Mixed-case bech32 string");
        }
        int separator = lower.lastIndexOf('1');
        if (separator < 1 || separator + 7 > lower.length()) {
            throw new IllegalArgumentException("Invalid bech32 separator position");
        }
        String hrp = lower.substring(0, separator);
        for (int i = 0; i < hrp.length(); i++) {
            char c = hrp.charAt(i);
            if (c < 33 || c > 126) {
                throw new IllegalArgumentException("Invalid character in bech32 prefix");
            }
        }
        byte[] all = new byte[lower.length() - separator - 1];
        for (int i = 0; i < all.length; i++) {
            int value = CHARSET.indexOf(lower.charAt(separator + 1 + i));
            if (value < 0) {
                throw new IllegalArgumentException("Invalid bech32 character: " + lower.charAt(separator + 1 + i));
            }
            all[i] = (byte) value;
        }
        if (polymod(concat(expandHrp(hrp), all)) != 1) {
            throw new IllegalArgumentException("Invalid bech32 checksum");
        }
        byte[] words = new byte[all.length - 6];
        System.arraycopy(all, 0, words, 0, words.length);
        return new Decoded(hrp, words);
    }

    public static String encodeBytes(String hrp, byte[] bytes) {
        return encode(hrp, convertBits(bytes, 8, 5, true));
    }

    /** Decodes a bech32 string carrying whole bytes and checks its prefix. */
    public static byte[] decodeBytes(String expectedHrp, String input) {
        Decoded decoded = decode(input);
        if (!decoded.hrp().equals(expectedHrp)) {
            throw new IllegalArgumentException("Expected prefix " + expectedHrp + " but was " + decoded.hrp());
        }
        return convertBits(decoded.words(), 5, 8, false);
    }

    public static byte[] convertBits(byte[] data, int fromBits, int toBits, boolean pad) {
        int acc = 0;
        int bits = 0;
        int maxValue = (1 << toBits) - 1;
        ByteArrayOutputStream out = new ByteArrayOutputStream(data.length * fromBits / toBits + 1);
        for (byte b : data) {
            int value = b & 0xff;
            if ((value >>> fromBits) != 0) {
                throw new IllegalArgumentException("Value out of range for " + fromBits + "-bit group");
            }
            acc = (acc << fromBits) | value;
            bits += fromBits;
            while (bits >= toBits) {
                bits -= toBits;
                out.write((acc >>> bits) & maxValue);
            }
        }
        if (pad) {
            if (bits > 0) {
                out.write((acc << (toBits - bits)) & maxValue);
            }
        } else if (bits >= fromBits || ((acc << (toBits - bits)) & maxValue) != 0) {
            throw new IllegalArgumentException("Invalid padding in bech32 data");
        }
        return out.toByteArray();
    }

    private static byte[] checksum(String hrp, byte[] words) {
        byte[] values = concat(concat(expandHrp(hrp), words), new byte[6]);
        int mod = polymod(values) ^ 1;
        byte[] checksum = new byte[6];
        for (int i = 0; i < 6; i++) {
            checksum[i] = (byte) ((mod >>> (5 * (5 - i))) & 31);
        }
        return checksum;
    }

    private static int polymod(byte[] values) {
        int chk = 1;
        for (byte value : values) {
            int top = chk >>> 25;
            chk = ((chk & 0x1ffffff) << 5) ^ (value & 0xff);
            for (int i = 0; i < 5; i++) {
                if (((top >>> i) & 1) != 0) {
                    chk ^= GENERATOR[i];
                }
            }
        }
        return chk;
    }

    private static byte[] expandHrp(String hrp) {
        byte[] out = new byte[hrp.length() * 2 + 1];
        for (int i = 0; i < hrp.length(); i++) {
            char c = hrp.charAt(i);
            out[i] = (byte) (c >>> 5);
            out[hrp.length() + 1 + i] = (byte) (c & 31);
        }
        return out;
    }

    private static byte[] concat(byte[] a, byte[] b) {
        byte[] out = new byte[a.length + b.length];
        System.arraycopy(a, 0, out, 0, a.length);
        System.arraycopy(b, 0, out, a.length, b.length);
        return out;
    }
}
