package com.relayauthority.payment;

import reactor.core.publisher.Flux;

/**
 * Direct view of the authority's own wallet.
 */
public interface WalletClient {

    /** Incoming transactions created at or after {@code since} (unix seconds), newest first. */
    Flux<WalletTransaction> listIncoming(long since, int limit);

    default void close() {
    }
}
