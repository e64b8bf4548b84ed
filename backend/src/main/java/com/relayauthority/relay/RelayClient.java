package com.relayauthority.relay;

import com.relayauthority.event.NostrEvent;
import com.relayauthority.event.RelayFilter;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * The relay network seen as an opaque publish/subscribe transport.
 */
public interface RelayClient {

    String url();

    /** Completes once the relay acknowledged the event; errors with {@link TransportException} otherwise. */
    Mono<Void> publish(NostrEvent event);

    /** Stored events matching {@code filter}; completes at end-of-stored-events. */
    Flux<NostrEvent> fetch(RelayFilter filter);

    /** Stored and then live events matching {@code filter}; runs until cancelled. */
    Flux<NostrEvent> subscribe(RelayFilter filter);

    /**
     * Opens a subscription for {@code responseFilter}, then publishes {@code request} on the
     * same connection and emits the first matching event. Suits request/response traffic
     * whose responses are ephemeral and never stored by the relay.
     */
    Mono<NostrEvent> exchange(NostrEvent request, RelayFilter responseFilter);
}
