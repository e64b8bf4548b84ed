package com.relayauthority.event;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Remembers the most recent event ids up to a fixed capacity.
 */
public class RecentIds {

    private final Map<String, Boolean> ids;

    public RecentIds(int capacity) {
        this.ids = new LinkedHashMap<>(16, 0.75f, false) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, Boolean> eldest) {
                return size() > capacity;
            }
        };
    }

    /** True the first time {@code id} is seen, false for repeats still remembered. */
    public synchronized boolean firstSighting(String id) {
        return ids.put(id, Boolean.TRUE) == null;
    }

    public synchronized boolean contains(String id) {
        return ids.containsKey(id);
    }
}
