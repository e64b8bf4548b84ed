package com.relayauthority.crypto;

import org.bouncycastle.math.ec.ECPoint;

import java.math.BigInteger;
import java.util.Arrays;

/**
 * BIP-340 Schnorr signatures over secp256k1.
 */
public final class Schnorr {

    private Schnorr() {
    }

    public static byte[] sign(byte[] message, byte[] secretKey, byte[] auxRand) {
        if (auxRand == null || auxRand.length != 32) {
            throw new IllegalArgumentException("Auxiliary randomness must be 32 bytes");
        }
        BigInteger d0 = Secp256k1.secretScalar(secretKey);
        ECPoint p = Secp256k1.G.multiply(d0).normalize();
        BigInteger d = Secp256k1.hasEvenY(p) ? d0 : Secp256k1.N.subtract(d0);
        byte[] px = Secp256k1.xOnly(p);

        byte[] t = xor(Secp256k1.toBytes(d), Sha256.tagged("BIP0340/aux", auxRand));
        BigInteger k0 = new BigInteger(1, Sha256.tagged("BIP0340/nonce", t, px, message)).mod(Secp256k1.N);
        if (k0.signum() == 0) {
            throw new IllegalStateException("Derived nonce is zero");
        }
        ECPoint r = Secp256k1.G.multiply(k0).normalize();
        BigInteger k = Secp256k1.hasEvenY(r) ? k0 : Secp256k1.N.subtract(k0);
        byte[] rx = Secp256k1.xOnly(r);

        BigInteger e = challenge(rx, px, message);
        byte[] s = Secp256k1.toBytes(k.add(e.multiply(d)).mod(Secp256k1.N));

        byte[] signature = new byte[64];
        System.arraycopy(rx, 0, signature, 0, 32);
        System.arraycopy(s, 0, signature, 32, 32);
        return signature;
    }

    public static boolean verify(byte[] message, byte[] publicKey, byte[] signature) {
        if (message == null || signature == null || signature.length != 64) {
            return false;
        }
        ECPoint p = Secp256k1.liftX(publicKey);
        if (p == null) {
            return false;
        }
        byte[] rBytes = Arrays.copyOfRange(signature, 0, 32);
        BigInteger r = new BigInteger(1, rBytes);
        BigInteger s = new BigInteger(1, Arrays.copyOfRange(signature, 32, 64));
        if (r.compareTo(Secp256k1.P) >= 0 || s.compareTo(Secp256k1.N) >= 0) {
            return false;
        }
        BigInteger e = challenge(rBytes, publicKey, message);
        ECPoint candidate = Secp256k1.G.multiply(s)
                .add(p.multiply(Secp256k1.N.subtract(e)))
                .normalize();
        if (candidate.isInfinity() || !Secp256k1.hasEvenY(candidate)) {
            return false;
        }
        return candidate.getAffineXCoord().toBigInteger().equals(r);
    }

    private static BigInteger challenge(byte[] rx, byte[] px, byte[] message) {
        return new BigInteger(1, Sha256.tagged("BIP0340/challenge", rx, px, message)).mod(Secp256k1.N);
    }

    private static byte[] xor(byte[] a, byte[] b) {
        byte[] out = new byte[a.length];
        for (int i = 0; i < a.length; i++) {
            out[i] = (byte) (a[i] ^ b[i]);
        }
        return out;
    }
}
