package com.relayauthority.crypto;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class NostrIdsTest {

    private static final String HEX_KEY = "3bf0c63fcb93463407af97a5e5ee64fa883d107ef9e558472c4eb9aaaefa459d";
    private static final String NPUB = "npub180cvv07tjdrrgpa0j7j7tmnyl2yr6yr7l8j4s3evf6u64th6gkwsyjh6w6";

    @Test
    void encodesNpub() {
        assertEquals(NPUB, NostrIds.toNpub(HEX_KEY));
    }

    @Test
    void normalizesNpubAndUppercaseHex() {
        assertEquals(HEX_KEY, NostrIds.toHex(NPUB));
        assertEquals(HEX_KEY, NostrIds.toHex(HEX_KEY.toUpperCase()));
    }

    @Test
    void rejectsGarbage() {
        assertThrows(IllegalArgumentException.class, () -> NostrIds.toHex("alice"));
        assertThrows(IllegalArgumentException.class, () -> NostrIds.toHex(NPUB.substring(0, NPUB.length() - 1) + "q"));
        assertThrows(IllegalArgumentException.class, () -> NostrIds.toNpub("abc"));
    }

    @Test
    void readsNsecSecrets() {
        NostrKeys fromNsec = NostrKeys.fromSecret("nsec1vl029mgpspedva04g90vltkh6fvh240zqtv9k0t9af8935ke9laqsnlfe5");
        NostrKeys fromHex = NostrKeys.fromSecret("67dea2ed018072d675f5415ecfaed7d2597555e202d85b3d65ea4e58d2d92ffa");

        assertEquals(fromHex.publicKeyHex(), fromNsec.publicKeyHex());
    }

    @Test
    void rejectsMissingOrShortSecret() {
        assertThrows(IllegalArgumentException.class, () -> NostrKeys.fromSecret(" "));
        assertThrows(IllegalArgumentException.class, () -> NostrKeys.fromSecret("abcd"));
    }
}
