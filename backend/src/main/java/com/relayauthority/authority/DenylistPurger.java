package com.relayauthority.authority;

import com.relayauthority.event.EventKinds;
import com.relayauthority.event.NostrEvent;
import com.relayauthority.event.RelayFilter;
import com.relayauthority.relay.RelayClient;
import com.relayauthority.relay.SnapshotPublisher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;

/**
 * Asks the relay to drop prior content of newly banned identities by publishing a
 * deletion request naming their events. Relays are free to ignore it; failures are
 * only logged.
 */
@Service
public class DenylistPurger {

    private static final Logger log = LoggerFactory.getLogger(DenylistPurger.class);
    static final int MAX_EVENTS_PER_IDENTITY = 1000;

    private final RelayClient relay;
    private final SigningAuthority authority;
    private final SnapshotPublisher publisher;

    public DenylistPurger(RelayClient relay, SigningAuthority authority, SnapshotPublisher publisher) {
        this.relay = relay;
        this.authority = authority;
        this.publisher = publisher;
    }

    public Mono<Void> purge(List<String> identities) {
        return Flux.fromIterable(identities)
                .concatMap(this::purgeOne)
                .then();
    }

    Mono<Void> purgeOne(String identity) {
        return relay.fetch(RelayFilter.forKinds().withAuthors(identity).withLimit(MAX_EVENTS_PER_IDENTITY))
                .map(NostrEvent::id)
                .take(MAX_EVENTS_PER_IDENTITY)
                .collectList()
                .doOnNext(ids -> {
                    if (ids.isEmpty()) {
                        log.debug("Nothing to purge for {}", identity);
                        return;
                    }
                    publisher.submit(authority.sign(deletionRequest(identity, ids)));
                    log.info("Requested deletion of {} events by banned identity {}", ids.size(), identity);
                })
                .then()
                .onErrorResume(error -> {
                    log.warn("Purge of {} failed: {}", identity, error.getMessage());
                    return Mono.empty();
                });
    }

    static NostrEvent deletionRequest(String identity, List<String> eventIds) {
        List<List<String>> tags = new ArrayList<>();
        for (String id : eventIds) {
            tags.add(List.of("e", id));
        }
        tags.add(List.of("p", identity));
        return NostrEvent.template(EventKinds.DELETION, 0, tags, "Content removed: author is denylisted");
    }
}
