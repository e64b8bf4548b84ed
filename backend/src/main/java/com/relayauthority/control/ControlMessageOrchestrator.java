package com.relayauthority.control;

import com.relayauthority.authority.BootstrapTracker;
import com.relayauthority.authority.Denylist;
import com.relayauthority.authority.DenylistPurger;
import com.relayauthority.authority.IdentityList;
import com.relayauthority.authority.MalformedControlMessageException;
import com.relayauthority.authority.SigningAuthority;
import com.relayauthority.event.EventCodec;
import com.relayauthority.event.NostrEvent;
import com.relayauthority.event.RecentIds;
import com.relayauthority.registry.AliasRecord;
import com.relayauthority.registry.NameRegistry;
import com.relayauthority.registry.RegistryMessages;
import com.relayauthority.relay.SnapshotPublisher;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.time.Duration;
import java.util.List;
import java.util.Set;

/**
 * Runs inbound control messages through validation, state updates and countersigning.
 *
 * <pre>
 * RECEIVED -> VALIDATED -> REJECTED
 *                       -> SIGNED_AND_FORWARDED
 * </pre>
 *
 * Validation checks, in order: id and signature, sender authorization (bootstrap rules
 * for setup messages), denylist, payload shape, and snapshot freshness. Nothing is
 * changed until every check has passed. Messages are handled one at a time, in arrival
 * order, from a single queue.
 */
@Service
public class ControlMessageOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(ControlMessageOrchestrator.class);
    static final int REMEMBERED_MESSAGES = 2000;

    private final IdentityList admins;
    private final IdentityList editors;
    private final Denylist denylist;
    private final BootstrapTracker bootstrap;
    private final SigningAuthority authority;
    private final NameRegistry registry;
    private final SnapshotPublisher publisher;
    private final DenylistPurger purger;
    private final SnapshotClock snapshots = new SnapshotClock();
    private final RecentIds processed = new RecentIds(REMEMBERED_MESSAGES);

    private final Sinks.Many<Work> inbox = Sinks.many().unicast().onBackpressureBuffer();
    private final Disposable worker;

    private record Work(NostrEvent message, Sinks.One<ProcessedMessage> reply) {
    }

    /** What validation extracted from a message, ready to apply. */
    private record Validated(ControlMessageType type, NostrEvent message, BootstrapTracker.Decision setup,
                             Set<String> identities, List<AliasRecord> records) {
    }

    public ControlMessageOrchestrator(@Qualifier("admins") IdentityList admins,
                                      @Qualifier("editors") IdentityList editors,
                                      Denylist denylist,
                                      BootstrapTracker bootstrap,
                                      SigningAuthority authority,
                                      NameRegistry registry,
                                      SnapshotPublisher publisher,
                                      DenylistPurger purger) {
        this.admins = admins;
        this.editors = editors;
        this.denylist = denylist;
        this.bootstrap = bootstrap;
        this.authority = authority;
        this.registry = registry;
        this.publisher = publisher;
        this.purger = purger;
        this.worker = inbox.asFlux()
                .concatMap(work -> handle(work.message())
                        .onErrorResume(error -> {
                            log.error("Failed to process control message {}", work.message().id(), error);
                            return Mono.just(ProcessedMessage.rejected(ControlMessageType.of(work.message()),
                                    work.message(), "error: " + error.getMessage()));
                        })
                        .doOnNext(result -> work.reply().tryEmitValue(result)))
                .subscribe();
    }

    /** Queues {@code message}; the returned Mono emits once it has been handled. */
    public Mono<ProcessedMessage> process(NostrEvent message) {
        Sinks.One<ProcessedMessage> reply = Sinks.one();
        inbox.emitNext(new Work(message, reply), Sinks.EmitFailureHandler.busyLooping(Duration.ofSeconds(1)));
        return reply.asMono();
    }

    public boolean hasProcessed(String eventId) {
        return processed.contains(eventId);
    }

    Mono<ProcessedMessage> handle(NostrEvent message) {
        ControlMessageType type = ControlMessageType.of(message);
        if (!EventCodec.verify(message)) {
            return reject(type, message, "invalid: bad id or signature");
        }
        if (processed.contains(message.id())) {
            return reject(type, message, "duplicate: already processed");
        }
        if (authority.isAuthored(message)) {
            return reject(type, message, "invalid: authored by this authority");
        }
        Validated validated;
        try {
            String unauthorized = authorize(type, message);
            if (unauthorized != null) {
                return reject(type, message, unauthorized);
            }
            if (denylist.contains(message.pubkey())) {
                return reject(type, message, "blocked: sender is denylisted");
            }
            validated = parse(type, message);
        } catch (MalformedControlMessageException e) {
            return reject(type, message, "invalid: " + e.getMessage());
        }
        if (type.isSnapshot() && isStale(type, message.createdAt())) {
            return reject(type, message, "stale: older than the held snapshot");
        }
        processed.firstSighting(message.id());
        return apply(validated);
    }

    /** Null when the sender may send this message, otherwise the rejection reason. */
    private String authorize(ControlMessageType type, NostrEvent message) {
        String sender = message.pubkey();
        if (type == ControlMessageType.SETUP) {
            BootstrapTracker.Decision decision = bootstrap.evaluate(message, admins::contains);
            return decision.outcome() == BootstrapTracker.Outcome.REJECTED ? "restricted: " + decision.reason() : null;
        }
        if (bootstrap.state() == BootstrapTracker.State.AWAITING_SETUP) {
            return "restricted: instance awaits setup";
        }
        switch (type) {
            case ADMIN_LIST:
            case EDITOR_LIST:
            case REGISTRY:
                return admins.contains(sender) ? null : "restricted: admin only";
            default:
                return admins.contains(sender) || editors.contains(sender) ? null : "restricted: not an admin or editor";
        }
    }

    private Validated parse(ControlMessageType type, NostrEvent message) {
        switch (type) {
            case SETUP:
                return new Validated(type, message, bootstrap.evaluate(message, admins::contains), null, null);
            case ADMIN_LIST:
                return new Validated(type, message, null, admins.parse(message), null);
            case EDITOR_LIST:
                return new Validated(type, message, null, editors.parse(message), null);
            case DENYLIST:
                return new Validated(type, message, null, denylist.parse(message), null);
            case REGISTRY:
                return new Validated(type, message, null, null, RegistryMessages.parse(message));
            default:
                return new Validated(type, message, null, null, null);
        }
    }

    private boolean isStale(ControlMessageType type, long createdAt) {
        if (type == ControlMessageType.REGISTRY && createdAt < registry.lastRepublishedAt()) {
            return true;
        }
        return snapshots.isStale(type, createdAt);
    }

    private Mono<ProcessedMessage> apply(Validated validated) {
        NostrEvent message = validated.message();
        ControlMessageType type = validated.type();
        if (type.isSnapshot()) {
            snapshots.observe(type, message.createdAt());
        }
        switch (type) {
            case SETUP:
                bootstrap.apply(validated.setup());
                if (validated.setup().outcome() == BootstrapTracker.Outcome.BOOTSTRAP) {
                    admins.replace(Set.of(validated.setup().owner()));
                }
                break;
            case ADMIN_LIST:
                admins.replace(validated.identities());
                break;
            case EDITOR_LIST:
                editors.replace(validated.identities());
                break;
            case DENYLIST:
                List<String> newlyBanned = denylist.replace(validated.identities());
                if (!newlyBanned.isEmpty()) {
                    purger.purge(newlyBanned).subscribe();
                }
                break;
            case REGISTRY:
                return registry.replace(validated.records())
                        .map(signed -> forwarded(type, message, signed));
            default:
                break;
        }
        NostrEvent signed = authority.sign(message);
        publisher.submit(signed);
        return Mono.just(forwarded(type, message, signed));
    }

    /**
     * Applies a snapshot this authority published earlier, found on the relay at startup.
     * No authorization, no purge and no republication.
     */
    public void restore(NostrEvent snapshot) {
        ControlMessageType type = ControlMessageType.of(snapshot);
        switch (type) {
            case SETUP:
                bootstrap.restore(snapshot);
                break;
            case ADMIN_LIST:
                admins.replace(snapshot);
                break;
            case EDITOR_LIST:
                editors.replace(snapshot);
                break;
            case DENYLIST:
                denylist.replace(snapshot);
                break;
            default:
                log.debug("Nothing to restore from kind {} event {}", snapshot.kind(), snapshot.id());
                return;
        }
        snapshots.observe(type, Math.min(snapshot.createdAt(), authority.now()));
        processed.firstSighting(snapshot.id());
    }

    private ProcessedMessage forwarded(ControlMessageType type, NostrEvent message, NostrEvent signed) {
        log.info("Countersigned {} message {} from {} as {}", type, message.id(), message.pubkey(), signed.id());
        return ProcessedMessage.forwarded(type, message, signed);
    }

    private Mono<ProcessedMessage> reject(ControlMessageType type, NostrEvent message, String reason) {
        if (reason.startsWith("invalid") || reason.startsWith("stale")) {
            log.warn("Rejected {} message {} from {}: {}", type, message.id(), message.pubkey(), reason);
        } else {
            log.debug("Rejected {} message {} from {}: {}", type, message.id(), message.pubkey(), reason);
        }
        return Mono.just(ProcessedMessage.rejected(type, message, reason));
    }

    @PreDestroy
    public void shutdown() {
        inbox.tryEmitComplete();
        worker.dispose();
    }
}
