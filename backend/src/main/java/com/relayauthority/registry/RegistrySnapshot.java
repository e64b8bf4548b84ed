package com.relayauthority.registry;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * An immutable alias table: at most one record per alias and one per owner.
 * Expired records may still be present; the lookups below never return them.
 */
public final class RegistrySnapshot {

    private static final RegistrySnapshot EMPTY = new RegistrySnapshot(Map.of(), Map.of());

    private final Map<String, AliasRecord> byAlias;
    private final Map<String, String> aliasByOwner;

    private RegistrySnapshot(Map<String, AliasRecord> byAlias, Map<String, String> aliasByOwner) {
        this.byAlias = byAlias;
        this.aliasByOwner = aliasByOwner;
    }

    public static RegistrySnapshot empty() {
        return EMPTY;
    }

    /**
     * Builds a table from possibly conflicting records: per alias, then per owner,
     * the record with the latest {@code validUntil} wins.
     */
    public static RegistrySnapshot of(Collection<AliasRecord> records) {
        Map<String, AliasRecord> latestPerAlias = new HashMap<>();
        for (AliasRecord record : records) {
            latestPerAlias.merge(record.alias(), record,
                    (a, b) -> b.validUntil() > a.validUntil() ? b : a);
        }
        Map<String, AliasRecord> latestPerOwner = new HashMap<>();
        for (AliasRecord record : latestPerAlias.values()) {
            latestPerOwner.merge(record.owner(), record,
                    (a, b) -> b.validUntil() > a.validUntil() ? b : a);
        }
        Map<String, AliasRecord> byAlias = new HashMap<>();
        Map<String, String> aliasByOwner = new HashMap<>();
        for (AliasRecord record : latestPerOwner.values()) {
            byAlias.put(record.alias(), record);
            aliasByOwner.put(record.owner(), record.alias());
        }
        return new RegistrySnapshot(Map.copyOf(byAlias), Map.copyOf(aliasByOwner));
    }

    /** A copy holding {@code record}, minus any other record of its alias or its owner. */
    public RegistrySnapshot with(AliasRecord record) {
        List<AliasRecord> next = new ArrayList<>();
        for (AliasRecord existing : byAlias.values()) {
            if (!existing.alias().equals(record.alias()) && !existing.owner().equals(record.owner())) {
                next.add(existing);
            }
        }
        next.add(record);
        return of(next);
    }

    public RegistrySnapshot withoutExpired(long nowSeconds) {
        return of(activeRecords(nowSeconds));
    }

    public Optional<AliasRecord> active(String alias, long nowSeconds) {
        AliasRecord record = byAlias.get(alias);
        return record != null && record.isActive(nowSeconds) ? Optional.of(record) : Optional.empty();
    }

    public Optional<AliasRecord> activeForOwner(String owner, long nowSeconds) {
        String alias = aliasByOwner.get(owner);
        return alias == null ? Optional.empty() : active(alias, nowSeconds);
    }

    public List<AliasRecord> activeRecords(long nowSeconds) {
        return byAlias.values().stream()
                .filter(record -> record.isActive(nowSeconds))
                .sorted(Comparator.comparing(AliasRecord::alias))
                .toList();
    }

    public List<AliasRecord> records() {
        return byAlias.values().stream()
                .sorted(Comparator.comparing(AliasRecord::alias))
                .toList();
    }

    public int size() {
        return byAlias.size();
    }
}
