package com.relayauthority.crypto;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Arrays;
import java.util.HexFormat;
import java.util.Locale;

/**
 * The parts of a BOLT11 payment request the registry relies on.
 *
 * Decoding reads the human-readable amount, the timestamp and the tagged fields
 * {@code p} (payment hash), {@code d} (description), {@code h} (description hash)
 * and {@code x} (expiry). The node signature is not verified: a payment request
 * is only trusted when it matches an invoice this authority requested itself.
 */
public record Bolt11Invoice(String paymentRequest,
                            Long amountMsats,
                            long timestamp,
                            String paymentHash,
                            String description,
                            String descriptionHash,
                            long expirySeconds) {

    static final long DEFAULT_EXPIRY_SECONDS = 3600;
    private static final int TIMESTAMP_WORDS = 7;
    private static final int SIGNATURE_WORDS = 104;
    private static final int TAG_PAYMENT_HASH = 1;
    private static final int TAG_EXPIRY = 6;
    private static final int TAG_DESCRIPTION = 13;
    private static final int TAG_DESCRIPTION_HASH = 23;

    private static final BigInteger MSATS_PER_BTC = BigInteger.valueOf(100_000_000_000L);

    public static Bolt11Invoice decode(String paymentRequest) {
        if (paymentRequest == null || paymentRequest.isBlank()) {
            throw new IllegalArgumentException("Payment request is empty");
        }
        String normalized = paymentRequest.trim().toLowerCase(Locale.ROOT);
        if (normalized.startsWith("lightning:")) {
            normalized = normalized.substring("lightning:".length());
        }
        Bech32.Decoded decoded = Bech32.decode(normalized);
        if (!decoded.hrp().startsWith("ln")) {
            throw new IllegalArgumentException("Not a lightning payment request");
        }
        Long amount = parseAmount(decoded.hrp().substring(2));

        byte[] words = decoded.words();
        if (words.length < TIMESTAMP_WORDS + SIGNATURE_WORDS) {
            throw new IllegalArgumentException("Payment request too short");
        }
        long timestamp = readNumber(words, 0, TIMESTAMP_WORDS);

        String paymentHash = null;
        String description = null;
        String descriptionHash = null;
        long expiry = DEFAULT_EXPIRY_SECONDS;

        int end = words.length - SIGNATURE_WORDS;
        int pos = TIMESTAMP_WORDS;
        while (pos < end) {
            if (pos + 3 > end) {
                throw new IllegalArgumentException("Truncated tagged field");
            }
            int type = words[pos];
            int length = words[pos + 1] * 32 + words[pos + 2];
            int start = pos + 3;
            if (start + length > end) {
                throw new IllegalArgumentException("Tagged field overruns payment request");
            }
            byte[] field = Arrays.copyOfRange(words, start, start + length);
            switch (type) {
                case TAG_PAYMENT_HASH:
                    if (length == 52 && paymentHash == null) {
                        paymentHash = HexFormat.of().formatHex(Bech32.convertBits(field, 5, 8, false));
                    }
                    break;
                case TAG_DESCRIPTION:
                    description = new String(Bech32.convertBits(field, 5, 8, false), StandardCharsets.UTF_8);
                    break;
                case TAG_DESCRIPTION_HASH:
                    if (length == 52) {
                        descriptionHash = HexFormat.of().formatHex(Bech32.convertBits(field, 5, 8, false));
                    }
                    break;
                case TAG_EXPIRY:
                    expiry = readNumber(field, 0, length);
                    break;
                default:
                    break;
            }
            pos = start + length;
        }
        if (paymentHash == null) {
            throw new IllegalArgumentException("Payment request carries no payment hash");
        }
        return new Bolt11Invoice(normalized, amount, timestamp, paymentHash, description, descriptionHash, expiry);
    }

    /** Whole satoshis, or {@code null} for an amountless request. */
    public Long amountSats() {
        return amountMsats == null ? null : amountMsats / 1000;
    }

    /** True iff SHA-256 of the hex preimage equals the payment hash. */
    public boolean validatePreimage(String preimageHex) {
        if (preimageHex == null || preimageHex.length() != 64) {
            return false;
        }
        byte[] preimage;
        try {
            preimage = HexFormat.of().parseHex(preimageHex);
        } catch (IllegalArgumentException e) {
            return false;
        }
        return MessageDigest.isEqual(Sha256.hash(preimage), HexFormat.of().parseHex(paymentHash));
    }

    private static Long parseAmount(String hrpTail) {
        int digitStart = 0;
        while (digitStart < hrpTail.length() && !Character.isDigit(hrpTail.charAt(digitStart))) {
            digitStart++;
        }
        if (digitStart == hrpTail.length()) {
            return null;
        }
        String amount = hrpTail.substring(digitStart);
        char last = amount.charAt(amount.length() - 1);
        String digits = Character.isDigit(last) ? amount : amount.substring(0, amount.length() - 1);
        if (digits.isEmpty() || !digits.chars().allMatch(Character::isDigit)) {
            throw new IllegalArgumentException("Invalid amount in payment request: " + amount);
        }
        BigInteger value = new BigInteger(digits);
        BigInteger msats;
        switch (last) {
            case 'm':
                msats = value.multiply(MSATS_PER_BTC).divide(BigInteger.valueOf(1_000));
                break;
            case 'u':
                msats = value.multiply(MSATS_PER_BTC).divide(BigInteger.valueOf(1_000_000));
                break;
            case 'n':
                msats = value.multiply(MSATS_PER_BTC).divide(BigInteger.valueOf(1_000_000_000));
                break;
            case 'p':
                if (!value.mod(BigInteger.TEN).equals(BigInteger.ZERO)) {
                    throw new IllegalArgumentException("Sub-millisatoshi amount in payment request");
                }
                msats = value.divide(BigInteger.TEN);
                break;
            default:
                if (!Character.isDigit(last)) {
                    throw new IllegalArgumentException("Unknown amount multiplier: " + last);
                }
                msats = value.multiply(MSATS_PER_BTC);
        }
        return msats.longValueExact();
    }

    private static long readNumber(byte[] words, int offset, int count) {
        long value = 0;
        for (int i = 0; i < count; i++) {
            value = (value << 5) | (words[offset + i] & 31);
        }
        return value;
    }
}
