package com.relayauthority.registry;

import com.relayauthority.authority.SigningAuthority;
import com.relayauthority.event.NostrEvent;
import com.relayauthority.relay.SnapshotPublisher;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * The payment-gated alias table.
 *
 * Reads go against an immutable snapshot and never block. Every mutation, whether a
 * confirmed purchase or a replacement snapshot, runs on one dedicated writer thread,
 * which reads the table, derives the next one, swaps it in and queues its signed
 * republication in a single step. Two confirmations can therefore never publish
 * tables derived from the same predecessor.
 */
@Service
public class NameRegistry {

    private static final Logger log = LoggerFactory.getLogger(NameRegistry.class);

    private final PricingTable pricing;
    private final SettlementLedger ledger;
    private final SigningAuthority authority;
    private final SnapshotPublisher publisher;
    private final Clock clock;
    private final Scheduler writer = Schedulers.newSingle("name-registry");

    private volatile RegistrySnapshot snapshot = RegistrySnapshot.empty();
    private volatile long lastRepublishedAt;

    public NameRegistry(PricingTable pricing, SettlementLedger ledger, SigningAuthority authority,
                        SnapshotPublisher publisher, Clock clock) {
        this.pricing = pricing;
        this.ledger = ledger;
        this.authority = authority;
        this.publisher = publisher;
        this.clock = clock;
    }

    // ── Reads ────────────────────────────────────────────────────────────────

    public Optional<String> resolve(String alias) {
        return snapshot.active(AliasRules.normalize(alias), now()).map(AliasRecord::owner);
    }

    public Optional<AliasRecord> lookup(String alias) {
        return snapshot.active(AliasRules.normalize(alias), now());
    }

    public boolean isAvailable(String alias) {
        String normalized = AliasRules.normalize(alias);
        return AliasRules.isValid(normalized)
                && !AliasRules.isReserved(normalized)
                && snapshot.active(normalized, now()).isEmpty();
    }

    public Optional<AliasRecord> ownerAlias(String identity) {
        return identity == null ? Optional.empty()
                : snapshot.activeForOwner(identity.toLowerCase(Locale.ROOT), now());
    }

    public List<PricingTier> quoteTiers() {
        return pricing.tiers();
    }

    public List<AliasRecord> activeRecords() {
        return snapshot.activeRecords(now());
    }

    public boolean isSettled(String settlementRef) {
        return ledger.contains(settlementRef);
    }

    /**
     * Wall-clock second of the last registry publication, or the signing time of the
     * restored snapshot. Signing timestamps may run ahead of the clock when several
     * snapshots are signed within one second; this value never does.
     */
    public long lastRepublishedAt() {
        return lastRepublishedAt;
    }

    // ── Writes ───────────────────────────────────────────────────────────────

    public Mono<PurchaseOutcome> confirmPurchase(PurchaseRequest request) {
        return Mono.fromCallable(() -> applyPurchase(request)).subscribeOn(writer);
    }

    /**
     * Replaces the whole table with {@code records} and publishes it re-signed.
     * Used when an administrator edits the registry directly.
     */
    public Mono<NostrEvent> replace(Collection<AliasRecord> records) {
        return Mono.fromCallable(() -> {
            snapshot = RegistrySnapshot.of(records);
            log.info("Registry replaced by administrator: {} records", snapshot.size());
            return republish();
        }).subscribeOn(writer);
    }

    /** Loads the snapshot found on the relay at startup, without republishing it. */
    public Mono<Void> restore(NostrEvent registryMessage) {
        return Mono.<Void>fromRunnable(() -> {
            snapshot = RegistrySnapshot.of(RegistryMessages.parse(registryMessage));
            lastRepublishedAt = Math.max(lastRepublishedAt, Math.min(registryMessage.createdAt(), now()));
            log.info("Restored registry snapshot {}: {} records ({} active)", registryMessage.id(),
                    snapshot.size(), snapshot.activeRecords(now()).size());
        }).subscribeOn(writer);
    }

    PurchaseOutcome applyPurchase(PurchaseRequest request) {
        long now = now();
        String alias = AliasRules.normalize(request.alias());
        String requester = request.requester().toLowerCase(Locale.ROOT);

        if (!AliasRules.isValid(alias)) {
            return reject(request, Rejection.INVALID_ALIAS);
        }
        if (AliasRules.isReserved(alias)) {
            return reject(request, Rejection.RESERVED_ALIAS);
        }
        if (ledger.contains(request.settlementRef())) {
            return reject(request, Rejection.DUPLICATE_SETTLEMENT);
        }
        RegistrySnapshot current = snapshot;
        Optional<AliasRecord> existing = current.active(alias, now);
        if (existing.isPresent() && !existing.get().owner().equals(requester)) {
            return reject(request, Rejection.ALIAS_TAKEN);
        }
        Optional<PricingTier> tier = pricing.tierFor(request.paidSats());
        if (tier.isEmpty()) {
            return reject(request, Rejection.INSUFFICIENT_AMOUNT);
        }
        long duration = tier.get().durationSeconds();
        long validUntil = existing.map(record -> record.validUntil() + duration).orElse(now + duration);

        ledger.record(request.settlementRef());
        AliasRecord record = new AliasRecord(alias, requester, validUntil);
        snapshot = current.withoutExpired(now).with(record);
        republish();
        log.info("Alias '{}' registered to {} until {} ({} sats via {})", alias, requester, validUntil,
                request.paidSats(), request.channel());
        return PurchaseOutcome.accepted(record);
    }

    private NostrEvent republish() {
        NostrEvent signed = authority.sign(RegistryMessages.template(snapshot.activeRecords(now()), 0));
        lastRepublishedAt = now();
        publisher.submit(signed);
        return signed;
    }

    private PurchaseOutcome reject(PurchaseRequest request, Rejection rejection) {
        log.warn("Rejected purchase of '{}' by {} via {}: {}", request.alias(), request.requester(),
                request.channel(), rejection.description());
        return PurchaseOutcome.rejected(rejection);
    }

    private long now() {
        return clock.instant().getEpochSecond();
    }

    @PreDestroy
    public void shutdown() {
        writer.dispose();
    }
}
