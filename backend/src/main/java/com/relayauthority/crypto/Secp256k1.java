package com.relayauthority.crypto;

import org.bouncycastle.asn1.x9.X9ECParameters;
import org.bouncycastle.crypto.ec.CustomNamedCurves;
import org.bouncycastle.math.ec.ECCurve;
import org.bouncycastle.math.ec.ECPoint;
import org.bouncycastle.util.BigIntegers;

import java.math.BigInteger;

/**
 * secp256k1 group arithmetic in the x-only encoding used by Nostr identities.
 * Curve math is delegated to BouncyCastle.
 */
public final class Secp256k1 {

    private static final X9ECParameters PARAMS = CustomNamedCurves.getByName("secp256k1");
    static final ECCurve CURVE = PARAMS.getCurve();
    static final ECPoint G = PARAMS.getG();
    static final BigInteger N = PARAMS.getN();
    static final BigInteger P = CURVE.getField().getCharacteristic();

    private Secp256k1() {
    }

    /** Parses a 32-byte secret key, rejecting zero and values outside the group order. */
    public static BigInteger secretScalar(byte[] secretKey) {
        if (secretKey == null || secretKey.length != 32) {
            throw new IllegalArgumentException("Secret key must be 32 bytes");
        }
        BigInteger d = new BigInteger(1, secretKey);
        if (d.signum() == 0 || d.compareTo(N) >= 0) {
            throw new IllegalArgumentException("Secret key out of range");
        }
        return d;
    }

    public static byte[] xOnlyPublicKey(byte[] secretKey) {
        return xOnly(G.multiply(secretScalar(secretKey)).normalize());
    }

    /**
     * Lifts an x-only key to the curve point with even y, or returns {@code null}
     * when no such point exists.
     */
    static ECPoint liftX(byte[] x) {
        if (x == null || x.length != 32) {
            return null;
        }
        if (new BigInteger(1, x).compareTo(P) >= 0) {
            return null;
        }
        byte[] compressed = new byte[33];
        compressed[0] = 0x02;
        System.arraycopy(x, 0, compressed, 1, 32);
        try {
            return CURVE.decodePoint(compressed).normalize();
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    /** ECDH as NIP-04 defines it: the unhashed x coordinate of secret * peer. */
    public static byte[] sharedX(byte[] secretKey, byte[] peerXOnly) {
        ECPoint peer = liftX(peerXOnly);
        if (peer == null) {
            throw new IllegalArgumentException("Peer public key is not on secp256k1");
        }
        return xOnly(peer.multiply(secretScalar(secretKey)).normalize());
    }

    static byte[] xOnly(ECPoint normalized) {
        return BigIntegers.asUnsignedByteArray(32, normalized.getAffineXCoord().toBigInteger());
    }

    static boolean hasEvenY(ECPoint normalized) {
        return !normalized.getAffineYCoord().toBigInteger().testBit(0);
    }

    static byte[] toBytes(BigInteger value) {
        return BigIntegers.asUnsignedByteArray(32, value);
    }
}
