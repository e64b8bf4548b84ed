package com.relayauthority.control;

import java.util.EnumMap;
import java.util.Map;

/**
 * Timestamp of the snapshot currently held for each control-message family.
 * Only touched from the orchestrator's serialized pipeline.
 */
class SnapshotClock {

    private final Map<ControlMessageType, Long> held = new EnumMap<>(ControlMessageType.class);

    /** True when {@code createdAt} is strictly older than the held snapshot of {@code type}. */
    synchronized boolean isStale(ControlMessageType type, long createdAt) {
        Long current = held.get(type);
        return current != null && createdAt < current;
    }

    synchronized void observe(ControlMessageType type, long createdAt) {
        held.merge(type, createdAt, Math::max);
    }
}
