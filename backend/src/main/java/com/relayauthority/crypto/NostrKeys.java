package com.relayauthority.crypto;

import com.relayauthority.event.EventCodec;
import com.relayauthority.event.NostrEvent;

import java.util.HexFormat;
import java.util.Locale;

/**
 * A secp256k1 keypair in Nostr form: 32-byte secret, x-only hex public key.
 *
 * Signing uses the all-zero auxiliary randomness, so the signature over a given
 * event is deterministic for a given key.
 */
public final class NostrKeys {

    private static final byte[] ZERO_AUX = new byte[32];

    private final byte[] secretKey;
    private final String publicKeyHex;

    private NostrKeys(byte[] secretKey) {
        this.secretKey = secretKey.clone();
        this.publicKeyHex = HexFormat.of().formatHex(Secp256k1.xOnlyPublicKey(secretKey));
    }

    /** Accepts a 64-hex secret or an {@code nsec} bech32 secret. */
    public static NostrKeys fromSecret(String secret) {
        if (secret == null || secret.isBlank()) {
            throw new IllegalArgumentException("Secret key is missing");
        }
        String trimmed = secret.trim();
        if (trimmed.toLowerCase(Locale.ROOT).startsWith("nsec1")) {
            return new NostrKeys(Bech32.decodeBytes("nsec", trimmed));
        }
        if (!NostrIds.isHex64(trimmed)) {
            throw new IllegalArgumentException("Secret key must be 64 hex characters or an nsec");
        }
        return new NostrKeys(HexFormat.of().parseHex(trimmed));
    }

    public String publicKeyHex() {
        return publicKeyHex;
    }

    public byte[] secretKey() {
        return secretKey.clone();
    }

    /**
     * Signs {@code template} as this key: the author is replaced with this public key,
     * the id recomputed and the signature attached. Timestamp, kind, tags and content are kept.
     */
    public NostrEvent sign(NostrEvent template) {
        NostrEvent authored = new NostrEvent(null, publicKeyHex, template.createdAt(), template.kind(),
                template.tags(), template.content(), null);
        String id = EventCodec.computeId(authored);
        byte[] signature = Schnorr.sign(HexFormat.of().parseHex(id), secretKey, ZERO_AUX);
        return new NostrEvent(id, publicKeyHex, authored.createdAt(), authored.kind(),
                authored.tags(), authored.content(), HexFormat.of().formatHex(signature));
    }
}
