package com.relayauthority.authority;

import com.relayauthority.crypto.NostrKeys;
import com.relayauthority.event.NostrEvent;

import java.time.Clock;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Holds the authority credential and countersigns messages that passed authorization.
 * The signed copy keeps kind, tags and content; author becomes the authority and the
 * timestamp becomes now. Timestamps are strictly increasing across signatures so that
 * two snapshots signed within the same second still replace each other in order.
 */
public class SigningAuthority {

    private final NostrKeys keys;
    private final Clock clock;
    private final AtomicLong lastSignedAt = new AtomicLong();

    public SigningAuthority(NostrKeys keys, Clock clock) {
        this.keys = keys;
        this.clock = clock;
    }

    public NostrEvent sign(NostrEvent message) {
        long now = now();
        long createdAt = lastSignedAt.accumulateAndGet(now, (last, candidate) -> Math.max(last + 1, candidate));
        return keys.sign(NostrEvent.template(message.kind(), createdAt, message.tags(), message.content()));
    }

    /** Current wall-clock second, without the per-signature bump. */
    public long now() {
        return clock.instant().getEpochSecond();
    }

    public String identity() {
        return keys.publicKeyHex();
    }

    public boolean isAuthored(NostrEvent event) {
        return keys.publicKeyHex().equals(event.pubkey());
    }

    public NostrKeys keys() {
        return keys;
    }
}
