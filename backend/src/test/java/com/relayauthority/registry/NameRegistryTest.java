package com.relayauthority.registry;

import com.relayauthority.MutableClock;
import com.relayauthority.TestKeys;
import com.relayauthority.authority.SigningAuthority;
import com.relayauthority.config.AuthorityProperties;
import com.relayauthority.event.EventCodec;
import com.relayauthority.event.NostrEvent;
import com.relayauthority.relay.SnapshotPublisher;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Purchase semantics of the alias registry, driven with a movable clock.
 */
@ExtendWith(MockitoExtension.class)
public class NameRegistryTest {

    private static final long START = 1_700_000_000L;
    private static final long SIX_MONTHS = Duration.ofDays(180).toSeconds();
    private static final long ONE_YEAR = Duration.ofDays(365).toSeconds();

    private static final String R1 = TestKeys.ALICE.publicKeyHex();
    private static final String R2 = TestKeys.BOB.publicKeyHex();

    @Mock
    private SnapshotPublisher publisher;

    private MutableClock clock;
    private NameRegistry registry;

    @BeforeEach
    void setup() {
        clock = MutableClock.atEpochSecond(START);
        PricingTable pricing = new PricingTable(AuthorityProperties.Registry.defaultTiers(), true);
        SettlementLedger ledger = new SettlementLedger(Duration.ofHours(6), 10_000, clock);
        registry = new NameRegistry(pricing, ledger, new SigningAuthority(TestKeys.AUTHORITY, clock), publisher, clock);
    }

    @AfterEach
    void teardown() {
        registry.shutdown();
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    private PurchaseOutcome buy(String alias, String requester, long sats, String ref) {
        return registry.applyPurchase(new PurchaseRequest(alias, requester, sats, ref, "test"));
    }

    // ── Purchases ────────────────────────────────────────────────────────────

    @Test
    void firstPurchaseRegistersAlias() {
        PurchaseOutcome outcome = buy("shop", R1, 10_000, "ref-1");

        assertTrue(outcome.isAccepted());
        assertEquals(R1, registry.resolve("shop").orElseThrow());
        assertEquals(START + SIX_MONTHS, registry.lookup("shop").orElseThrow().validUntil());
        assertFalse(registry.isAvailable("shop"));
        assertTrue(registry.isSettled("ref-1"));
    }

    @Test
    void renewalExtendsFromPreviousExpiry() {
        buy("shop", R1, 10_000, "ref-1");
        clock.advance(Duration.ofDays(30));

        PurchaseOutcome renewal = buy("shop", R1, 10_000, "ref-2");

        assertTrue(renewal.isAccepted());
        assertEquals(START + 2 * SIX_MONTHS, renewal.record().validUntil());
    }

    @Test
    void activeAliasCannotBeTakenByAnotherIdentity() {
        buy("shop", R1, 10_000, "ref-1");

        PurchaseOutcome outcome = buy("shop", R2, 18_000, "ref-2");

        assertEquals(Rejection.ALIAS_TAKEN, outcome.rejection());
        assertEquals(R1, registry.resolve("shop").orElseThrow());
        assertFalse(registry.isSettled("ref-2"));
        verify(publisher, times(1)).submit(any());
    }

    @Test
    void expiredAliasCanBeBoughtByAnyone() {
        buy("shop", R1, 10_000, "ref-1");
        clock.advance(Duration.ofSeconds(SIX_MONTHS + 1));

        assertTrue(registry.resolve("shop").isEmpty());
        PurchaseOutcome outcome = buy("shop", R2, 18_000, "ref-2");

        assertTrue(outcome.isAccepted());
        assertEquals(R2, registry.resolve("shop").orElseThrow());
        assertEquals(clock.epochSecond() + ONE_YEAR, outcome.record().validUntil());
    }

    @Test
    void settlementSeenOnTwoChannelsAppliesOnce() {
        PurchaseOutcome first = registry.applyPurchase(new PurchaseRequest("shop", R1, 10_000, "hash-1", "zap-receipt"));
        PurchaseOutcome second = registry.applyPurchase(new PurchaseRequest("shop", R1, 10_000, "hash-1", "wallet"));

        assertTrue(first.isAccepted());
        assertEquals(Rejection.DUPLICATE_SETTLEMENT, second.rejection());
        assertEquals(START + SIX_MONTHS, registry.lookup("shop").orElseThrow().validUntil());
    }

    @Test
    void rejectsInvalidReservedAndUnderpaid() {
        assertEquals(Rejection.INVALID_ALIAS, buy("x", R1, 10_000, "a").rejection());
        assertEquals(Rejection.INVALID_ALIAS, buy("-shop", R1, 10_000, "b").rejection());
        assertEquals(Rejection.RESERVED_ALIAS, buy("admin", R1, 10_000, "c").rejection());
        assertEquals(Rejection.INSUFFICIENT_AMOUNT, buy("shop", R1, 9_999, "d").rejection());
        assertTrue(registry.activeRecords().isEmpty());
        verifyNoInteractions(publisher);
    }

    @Test
    void duplicateSettlementIsCheckedBeforeOwnership() {
        buy("shop", R1, 10_000, "ref-1");

        assertEquals(Rejection.DUPLICATE_SETTLEMENT, buy("shop", R2, 10_000, "ref-1").rejection());
    }

    @Test
    void aliasIsNormalizedToLowercase() {
        buy("  MyShop ", R1.toUpperCase(), 10_000, "ref-1");

        assertEquals(R1, registry.resolve("myshop").orElseThrow());
        assertEquals("myshop", registry.ownerAlias(R1).orElseThrow().alias());
    }

    @Test
    void newAliasReplacesOwnersPreviousOne() {
        buy("shop", R1, 10_000, "ref-1");

        buy("store", R1, 10_000, "ref-2");

        assertTrue(registry.resolve("shop").isEmpty());
        assertTrue(registry.isAvailable("shop"));
        assertEquals("store", registry.ownerAlias(R1).orElseThrow().alias());
    }

    // ── Publication ──────────────────────────────────────────────────────────

    @Test
    void acceptedPurchaseRepublishesSignedSnapshot() {
        buy("shop", R1, 10_000, "ref-1");
        buy("store", R2, 18_000, "ref-2");

        ArgumentCaptor<NostrEvent> captor = ArgumentCaptor.forClass(NostrEvent.class);
        verify(publisher, times(2)).submit(captor.capture());
        NostrEvent latest = captor.getAllValues().get(1);
        assertTrue(EventCodec.verify(latest));
        assertTrue(RegistryMessages.isRegistryMessage(latest));
        assertEquals(TestKeys.AUTHORITY.publicKeyHex(), latest.pubkey());
        assertEquals(List.of(
                new AliasRecord("shop", R1, START + SIX_MONTHS),
                new AliasRecord("store", R2, START + ONE_YEAR)), RegistryMessages.parse(latest));
        assertEquals(START, registry.lastRepublishedAt());
    }

    @Test
    void sameSecondPublicationsKeepWallClockCutoff() {
        buy("shop", R1, 10_000, "ref-1");
        buy("store", R2, 10_000, "ref-2");
        buy("gallery", TestKeys.CAROL.publicKeyHex(), 10_000, "ref-3");

        ArgumentCaptor<NostrEvent> captor = ArgumentCaptor.forClass(NostrEvent.class);
        verify(publisher, times(3)).submit(captor.capture());
        assertEquals(List.of(START, START + 1, START + 2),
                captor.getAllValues().stream().map(NostrEvent::createdAt).toList());
        assertEquals(START, registry.lastRepublishedAt());
    }

    @Test
    void republicationDropsExpiredRecords() {
        buy("shop", R1, 10_000, "ref-1");
        clock.advance(Duration.ofSeconds(SIX_MONTHS + 1));

        buy("store", R2, 10_000, "ref-2");

        ArgumentCaptor<NostrEvent> captor = ArgumentCaptor.forClass(NostrEvent.class);
        verify(publisher, times(2)).submit(captor.capture());
        List<AliasRecord> published = RegistryMessages.parse(captor.getAllValues().get(1));
        assertEquals(List.of("store"), published.stream().map(AliasRecord::alias).toList());
    }

    @Test
    void confirmPurchaseRunsOnWriter() {
        StepVerifier.create(registry.confirmPurchase(new PurchaseRequest("shop", R1, 10_000, "ref-1", "preimage")))
                .assertNext(outcome -> assertEquals(R1, outcome.record().owner()))
                .verifyComplete();
    }

    @Test
    void replaceSwapsTableAndReturnsSignedSnapshot() {
        buy("shop", R1, 10_000, "ref-1");

        StepVerifier.create(registry.replace(List.of(new AliasRecord("gallery", R2, START + 100))))
                .assertNext(signed -> {
                    assertTrue(EventCodec.verify(signed));
                    assertEquals(1, RegistryMessages.parse(signed).size());
                })
                .verifyComplete();

        assertTrue(registry.resolve("shop").isEmpty());
        assertEquals(R2, registry.resolve("gallery").orElseThrow());
    }

    @Test
    void restoreLoadsSnapshotWithoutPublishing() {
        NostrEvent snapshot = TestKeys.AUTHORITY.sign(RegistryMessages.template(
                List.of(new AliasRecord("shop", R1, START + 500)), START - 10));

        StepVerifier.create(registry.restore(snapshot)).verifyComplete();

        assertEquals(R1, registry.resolve("shop").orElseThrow());
        assertEquals(START - 10, registry.lastRepublishedAt());
        verifyNoInteractions(publisher);
    }

    @Test
    void restoredSnapshotSignedAheadOfClockIsHeldAtNow() {
        NostrEvent snapshot = TestKeys.AUTHORITY.sign(RegistryMessages.template(
                List.of(new AliasRecord("shop", R1, START + 500)), START + 3));

        StepVerifier.create(registry.restore(snapshot)).verifyComplete();

        assertEquals(START, registry.lastRepublishedAt());
    }
}
