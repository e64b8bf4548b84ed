package com.relayauthority.relay;

/**
 * Opens clients for relays known only at runtime (payment-receipt relays, wallet relays).
 */
@FunctionalInterface
public interface RelayClientFactory {

    RelayClient connect(String url);
}
