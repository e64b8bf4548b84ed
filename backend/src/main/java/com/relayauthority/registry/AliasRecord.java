package com.relayauthority.registry;

/**
 * One registry entry. {@code validUntil} is a unix timestamp in seconds.
 */
public record AliasRecord(String alias, String owner, long validUntil) {

    public boolean isActive(long nowSeconds) {
        return validUntil > nowSeconds;
    }
}
