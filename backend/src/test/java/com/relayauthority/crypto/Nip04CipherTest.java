package com.relayauthority.crypto;

import com.relayauthority.TestKeys;
import org.junit.jupiter.api.Test;

import java.security.GeneralSecurityException;
import java.util.HexFormat;

import static org.junit.jupiter.api.Assertions.*;

public class Nip04CipherTest {

    private static final NostrKeys APP = TestKeys.keys(21);
    private static final NostrKeys WALLET = TestKeys.keys(22);

    @Test
    void peerDecryptsWithItsOwnSecret() throws GeneralSecurityException {
        String payload = Nip04Cipher.encrypt("{\"method\":\"list_transactions\"}", APP.secretKey(), publicKey(WALLET));

        assertTrue(payload.contains("?iv="));
        assertEquals("{\"method\":\"list_transactions\"}",
                Nip04Cipher.decrypt(payload, WALLET.secretKey(), publicKey(APP)));
    }

    @Test
    void usesFreshIvPerMessage() throws GeneralSecurityException {
        String first = Nip04Cipher.encrypt("same", APP.secretKey(), publicKey(WALLET));
        String second = Nip04Cipher.encrypt("same", APP.secretKey(), publicKey(WALLET));

        assertNotEquals(first, second);
    }

    @Test
    void rejectsPayloadWithoutIv() {
        assertThrows(GeneralSecurityException.class,
                () -> Nip04Cipher.decrypt("bm90aGluZw==", WALLET.secretKey(), publicKey(APP)));
        assertThrows(GeneralSecurityException.class,
                () -> Nip04Cipher.decrypt("!!!?iv=!!!", WALLET.secretKey(), publicKey(APP)));
    }

    private static byte[] publicKey(NostrKeys keys) {
        return HexFormat.of().parseHex(keys.publicKeyHex());
    }
}
