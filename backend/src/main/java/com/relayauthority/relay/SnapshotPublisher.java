package com.relayauthority.relay;

import com.relayauthority.config.AuthorityProperties;
import com.relayauthority.event.NostrEvent;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.Disposable;
import reactor.core.Disposables;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.util.retry.Retry;

import java.time.Duration;

/**
 * Publishes authority-signed events to the app relay without blocking the caller.
 *
 * Replaceable events share a slot (kind plus namespace). Within a slot only the newest
 * submission is pursued: a newer snapshot cancels the retries of an older one. Each
 * attempt is retried with exponential backoff; an exhausted budget is logged at error.
 */
@Service
public class SnapshotPublisher {

    private static final Logger log = LoggerFactory.getLogger(SnapshotPublisher.class);

    private final RelayClient relay;
    private final AuthorityProperties.Publish settings;
    private final Sinks.Many<NostrEvent> slotted = Sinks.many().unicast().onBackpressureBuffer();
    private final Sinks.Many<NostrEvent> regular = Sinks.many().unicast().onBackpressureBuffer();
    private final Disposable.Composite pipelines = Disposables.composite();

    public SnapshotPublisher(RelayClient relay, AuthorityProperties properties) {
        this.relay = relay;
        this.settings = properties.publish();
        pipelines.add(slotted.asFlux()
                .groupBy(SnapshotPublisher::slotOf)
                .flatMap(slot -> slot.switchMap(this::publishWithRetry), Integer.MAX_VALUE)
                .subscribe());
        pipelines.add(regular.asFlux()
                .flatMap(this::publishWithRetry)
                .subscribe());
    }

    /** Queues {@code event} for publication and returns immediately. */
    public void submit(NostrEvent event) {
        Sinks.Many<NostrEvent> queue = slotOf(event) == null ? regular : slotted;
        queue.emitNext(event, Sinks.EmitFailureHandler.busyLooping(Duration.ofSeconds(1)));
    }

    Mono<Void> publishWithRetry(NostrEvent event) {
        return Mono.defer(() -> relay.publish(event))
                .retryWhen(Retry.backoff(Math.max(0, settings.maxAttempts() - 1), settings.minBackoff())
                        .maxBackoff(settings.maxBackoff())
                        .doBeforeRetry(signal -> log.warn("Retrying publication of kind {} event {} (attempt {}): {}",
                                event.kind(), event.id(), signal.totalRetries() + 2, signal.failure().getMessage())))
                .doOnSuccess(ignored -> log.info("Published kind {} event {} to {}", event.kind(), event.id(), relay.url()))
                .onErrorResume(error -> {
                    log.error("Giving up publishing kind {} event {} to {}", event.kind(), event.id(), relay.url(), error);
                    return Mono.empty();
                });
    }

    /** Slot key for replaceable events, {@code null} for regular ones. */
    static String slotOf(NostrEvent event) {
        if (event.kind() >= 30000 && event.kind() < 40000) {
            return event.kind() + ":" + event.namespace().orElse("");
        }
        if (event.kind() >= 10000 && event.kind() < 20000) {
            return String.valueOf(event.kind());
        }
        return null;
    }

    @PreDestroy
    public void shutdown() {
        slotted.tryEmitComplete();
        regular.tryEmitComplete();
        pipelines.dispose();
    }
}
