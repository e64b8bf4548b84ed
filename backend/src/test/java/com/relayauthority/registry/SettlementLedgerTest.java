package com.relayauthority.registry;

import com.relayauthority.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

public class SettlementLedgerTest {

    private final MutableClock clock = MutableClock.atEpochSecond(1_000_000);

    @Test
    void recordsEachReferenceOnce() {
        SettlementLedger ledger = new SettlementLedger(Duration.ofHours(1), 10, clock);

        assertTrue(ledger.record("a"));
        assertFalse(ledger.record("a"));
        assertTrue(ledger.contains("a"));
    }

    @Test
    void forgetsReferencesOutsideWindow() {
        SettlementLedger ledger = new SettlementLedger(Duration.ofHours(1), 10, clock);
        ledger.record("a");
        clock.advance(Duration.ofMinutes(30));
        ledger.record("b");

        clock.advance(Duration.ofMinutes(31));

        assertFalse(ledger.contains("a"));
        assertTrue(ledger.contains("b"));
        assertEquals(1, ledger.size());
    }

    @Test
    void evictsOldestBeyondCapacity() {
        SettlementLedger ledger = new SettlementLedger(Duration.ofHours(1), 2, clock);
        ledger.record("a");
        ledger.record("b");
        ledger.record("c");

        assertFalse(ledger.contains("a"));
        assertTrue(ledger.contains("b"));
        assertTrue(ledger.contains("c"));
    }
}
