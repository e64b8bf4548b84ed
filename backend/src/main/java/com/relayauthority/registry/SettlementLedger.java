package com.relayauthority.registry;

import java.time.Clock;
import java.time.Duration;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Settlement references already applied, remembered for a time window and up to a
 * fixed number of entries, oldest evicted first.
 */
public class SettlementLedger {

    private final Duration window;
    private final int capacity;
    private final Clock clock;
    private final LinkedHashMap<String, Long> recordedAt = new LinkedHashMap<>();

    public SettlementLedger(Duration window, int capacity, Clock clock) {
        this.window = window;
        this.capacity = capacity;
        this.clock = clock;
    }

    public synchronized boolean contains(String reference) {
        evictExpired();
        return recordedAt.containsKey(reference);
    }

    /** Records {@code reference}; false when it is already present. */
    public synchronized boolean record(String reference) {
        evictExpired();
        if (recordedAt.containsKey(reference)) {
            return false;
        }
        recordedAt.put(reference, clock.millis());
        while (recordedAt.size() > capacity) {
            Iterator<String> oldest = recordedAt.keySet().iterator();
            oldest.next();
            oldest.remove();
        }
        return true;
    }

    public synchronized int size() {
        evictExpired();
        return recordedAt.size();
    }

    private void evictExpired() {
        long cutoff = clock.millis() - window.toMillis();
        Iterator<Map.Entry<String, Long>> entries = recordedAt.entrySet().iterator();
        while (entries.hasNext()) {
            if (entries.next().getValue() > cutoff) {
                break;
            }
            entries.remove();
        }
    }
}
