package com.relayauthority.control;

import com.relayauthority.authority.SigningAuthority;
import com.relayauthority.event.EventKinds;
import com.relayauthority.event.NostrEvent;
import com.relayauthority.event.RelayFilter;
import com.relayauthority.relay.RelayClient;
import com.relayauthority.relay.TransportException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.Disposables;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;

/**
 * Long-lived relay subscriptions, one per control family, feeding the orchestrator.
 * Events authored by the authority itself and events already processed are skipped.
 * A subscription the relay ends, with or without an error, is reopened with backoff.
 */
public class ControlSubscriptionListener {

    private static final Logger log = LoggerFactory.getLogger(ControlSubscriptionListener.class);

    private final RelayClient relay;
    private final ControlMessageOrchestrator orchestrator;
    private final SigningAuthority authority;
    private final Clock clock;
    private final Disposable.Composite subscriptions = Disposables.composite();

    public ControlSubscriptionListener(RelayClient relay, ControlMessageOrchestrator orchestrator,
                                       SigningAuthority authority, Clock clock) {
        this.relay = relay;
        this.orchestrator = orchestrator;
        this.authority = authority;
        this.clock = clock;
    }

    public void start() {
        long since = clock.instant().getEpochSecond();
        filters(since).forEach((family, filter) -> subscriptions.add(relay.subscribe(filter)
                .concatWith(Mono.error(() -> new TransportException("Relay " + relay.url() + " closed the "
                        + family + " subscription")))
                .retryWhen(Retry.backoff(Long.MAX_VALUE, Duration.ofSeconds(1))
                        .maxBackoff(Duration.ofMinutes(1))
                        .transientErrors(true)
                        .doBeforeRetry(signal -> log.warn("{} subscription dropped: {}", family,
                                signal.failure().getMessage())))
                .filter(this::isInbound)
                .concatMap(orchestrator::process)
                .subscribe(result -> log.debug("{} {} -> {}", family, result.original().id(), result.state()))));
        log.info("Listening for control messages on {}", relay.url());
    }

    static Map<String, RelayFilter> filters(long since) {
        return Map.of(
                "setup", RelayFilter.forKinds(EventKinds.APP_HANDLER).withSince(since),
                "lists", RelayFilter.forKinds(EventKinds.PEOPLE_LIST)
                        .withTag("d", EventKinds.ADMINS_NAMESPACE, EventKinds.EDITORS_NAMESPACE,
                                EventKinds.REGISTRY_NAMESPACE)
                        .withSince(since),
                "denylist", RelayFilter.forKinds(EventKinds.MUTE_LIST).withSince(since));
    }

    boolean isInbound(NostrEvent event) {
        return !authority.isAuthored(event) && !orchestrator.hasProcessed(event.id());
    }

    public void stop() {
        subscriptions.dispose();
        log.info("Stopped control subscriptions");
    }
}
