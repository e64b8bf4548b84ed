package com.relayauthority.payment;

import com.relayauthority.authority.SigningAuthority;
import com.relayauthority.event.EventKinds;
import com.relayauthority.event.MalformedEventException;
import com.relayauthority.event.NostrEvent;
import com.relayauthority.event.RecentIds;
import com.relayauthority.event.RelayFilter;
import com.relayauthority.registry.NameRegistry;
import com.relayauthority.relay.RelayClient;
import com.relayauthority.relay.TransportException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * The receipt channel: one long-lived subscription per relay to payment receipts
 * addressed to the authority, merged and deduplicated by receipt id.
 *
 * Receipts signed at or before the last registry republication are ignored, since
 * the published snapshot already reflects them.
 */
public class ZapReceiptListener {

    private static final Logger log = LoggerFactory.getLogger(ZapReceiptListener.class);
    static final int REMEMBERED_RECEIPTS = 2000;

    private final List<RelayClient> relays;
    private final SigningAuthority authority;
    private final NameRegistry registry;
    private final PaymentConfirmationService confirmations;
    private final RecentIds seen = new RecentIds(REMEMBERED_RECEIPTS);
    private volatile Disposable subscription;

    public ZapReceiptListener(List<RelayClient> relays, SigningAuthority authority, NameRegistry registry,
                              PaymentConfirmationService confirmations) {
        this.relays = List.copyOf(relays);
        this.authority = authority;
        this.registry = registry;
        this.confirmations = confirmations;
    }

    public void start(long since) {
        RelayFilter filter = RelayFilter.forKinds(EventKinds.ZAP_RECEIPT)
                .withTag("p", authority.identity())
                .withSince(since);
        subscription = Flux.fromIterable(relays)
                .flatMap(relay -> relay.subscribe(filter)
                        .doOnSubscribe(ignored -> log.info("Watching payment receipts on {}", relay.url()))
                        .concatWith(Mono.error(() -> new TransportException("Relay " + relay.url()
                                + " closed the receipt subscription")))
                        .retryWhen(Retry.backoff(Long.MAX_VALUE, Duration.ofSeconds(1))
                                .maxBackoff(Duration.ofMinutes(1))
                                .transientErrors(true)
                                .doBeforeRetry(signal -> log.warn("Receipt subscription on {} dropped: {}",
                                        relay.url(), signal.failure().getMessage()))))
                .filter(receipt -> seen.firstSighting(receipt.id()))
                .concatMap(this::handle)
                .subscribe();
    }

    Mono<Void> handle(NostrEvent receipt) {
        if (receipt.createdAt() <= registry.lastRepublishedAt()) {
            log.debug("Ignoring receipt {} from before the last registry publication", receipt.id());
            return Mono.empty();
        }
        Optional<ZapReceipt> parsed;
        try {
            parsed = ZapReceiptParser.parse(receipt);
        } catch (MalformedEventException e) {
            log.warn("Ignoring receipt {}: {}", receipt.id(), e.getMessage());
            return Mono.empty();
        }
        if (parsed.isEmpty()) {
            log.debug("Receipt {} is not an alias registration", receipt.id());
            return Mono.empty();
        }
        return confirmations.confirmFromReceipt(parsed.get())
                .then()
                .onErrorResume(error -> {
                    log.error("Failed to apply receipt {}", receipt.id(), error);
                    return Mono.empty();
                });
    }

    public void stop() {
        Disposable current = subscription;
        if (current != null) {
            current.dispose();
            log.info("Stopped payment receipt subscriptions");
        }
    }
}
