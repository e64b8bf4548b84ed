package com.relayauthority.registry;

/**
 * A verified payment asking for {@code alias}. {@code settlementRef} identifies the
 * settled payment (its payment hash) and is what duplicates are detected by.
 */
public record PurchaseRequest(String alias, String requester, long paidSats, String settlementRef, String channel) {
}
