package com.relayauthority.crypto;

import javax.crypto.Cipher;
import javax.crypto.spec.IvParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Base64;

/**
 * NIP-04 direct-message encryption: AES-256-CBC keyed with the raw ECDH x coordinate,
 * serialized as {@code base64(ciphertext) + "?iv=" + base64(iv)}.
 */
public final class Nip04Cipher {

    private static final String TRANSFORMATION = "AES/CBC/PKCS5Padding";
    private static final SecureRandom RANDOM = new SecureRandom();

    private Nip04Cipher() {
    }

    public static String encrypt(String plaintext, byte[] secretKey, byte[] peerPublicKey)
            throws GeneralSecurityException {
        byte[] iv = new byte[16];
        RANDOM.nextBytes(iv);
        Cipher cipher = Cipher.getInstance(TRANSFORMATION);
        cipher.init(Cipher.ENCRYPT_MODE, key(secretKey, peerPublicKey), new IvParameterSpec(iv));
        byte[] ciphertext = cipher.doFinal(plaintext.getBytes(StandardCharsets.UTF_8));
        return Base64.getEncoder().encodeToString(ciphertext) + "?iv=" + Base64.getEncoder().encodeToString(iv);
    }

    public static String decrypt(String payload, byte[] secretKey, byte[] peerPublicKey)
            throws GeneralSecurityException {
        int marker = payload == null ? -1 : payload.indexOf("?iv=");
        if (marker < 0) {
            throw new GeneralSecurityException("NIP-04 payload has no iv");
        }
        byte[] ciphertext;
        byte[] iv;
        try {
            ciphertext = Base64.getDecoder().decode(payload.substring(0, marker));
            iv = Base64.getDecoder().decode(payload.substring(marker + 4));
        } catch (IllegalArgumentException e) {
            throw new GeneralSecurityException("NIP-04 payload is not base64", e);
        }
        Cipher cipher = Cipher.getInstance(TRANSFORMATION);
        cipher.init(Cipher.DECRYPT_MODE, key(secretKey, peerPublicKey), new IvParameterSpec(iv));
        return new String(cipher.doFinal(ciphertext), StandardCharsets.UTF_8);
    }

    private static SecretKeySpec key(byte[] secretKey, byte[] peerPublicKey) {
        return new SecretKeySpec(Secp256k1.sharedX(secretKey, peerPublicKey), "AES");
    }
}
