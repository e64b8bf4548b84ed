package com.relayauthority.registry;

import com.relayauthority.crypto.NostrIds;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Read side of the registry. Every answer is computed from the current snapshot;
 * expired records are never returned.
 */
@RestController
@RequestMapping("/api/vanity")
public class VanityController {

    private final NameRegistry registry;

    public VanityController(NameRegistry registry) {
        this.registry = registry;
    }

    @GetMapping
    public Flux<AliasRecord> activeRecords() {
        return Flux.fromIterable(registry.activeRecords());
    }

    @GetMapping("/tiers")
    public Flux<PricingTier> tiers() {
        return Flux.fromIterable(registry.quoteTiers());
    }

    @GetMapping("/{alias}")
    public Mono<AliasRecord> resolve(@PathVariable String alias) {
        return Mono.justOrEmpty(registry.lookup(alias))
                .switchIfEmpty(Mono.error(new ResponseStatusException(HttpStatus.NOT_FOUND, "No active alias " + alias)));
    }

    @GetMapping("/{alias}/available")
    public AliasAvailability availability(@PathVariable String alias) {
        String normalized = AliasRules.normalize(alias);
        return new AliasAvailability(normalized, registry.isAvailable(normalized),
                AliasRules.isValid(normalized), AliasRules.isReserved(normalized));
    }

    @GetMapping("/owner/{identity}")
    public Mono<AliasRecord> ownerAlias(@PathVariable String identity) {
        String owner;
        try {
            owner = NostrIds.toHex(identity);
        } catch (IllegalArgumentException e) {
            return Mono.error(new ResponseStatusException(HttpStatus.BAD_REQUEST, e.getMessage()));
        }
        return Mono.justOrEmpty(registry.ownerAlias(owner))
                .switchIfEmpty(Mono.error(new ResponseStatusException(HttpStatus.NOT_FOUND, "No active alias for " + identity)));
    }
}
