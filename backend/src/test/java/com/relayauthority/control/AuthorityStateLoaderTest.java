package com.relayauthority.control;

import com.relayauthority.MutableClock;
import com.relayauthority.TestKeys;
import com.relayauthority.authority.BootstrapTracker;
import com.relayauthority.authority.Denylist;
import com.relayauthority.authority.DenylistPurger;
import com.relayauthority.authority.IdentityList;
import com.relayauthority.authority.SigningAuthority;
import com.relayauthority.config.AuthorityProperties;
import com.relayauthority.event.EventKinds;
import com.relayauthority.event.NostrEvent;
import com.relayauthority.event.RelayFilter;
import com.relayauthority.payment.WalletMonitor;
import com.relayauthority.payment.ZapReceiptListener;
import com.relayauthority.registry.AliasRecord;
import com.relayauthority.registry.NameRegistry;
import com.relayauthority.registry.PricingTable;
import com.relayauthority.registry.RegistryMessages;
import com.relayauthority.registry.SettlementLedger;
import com.relayauthority.relay.RelayClient;
import com.relayauthority.relay.SnapshotPublisher;
import com.relayauthority.relay.TransportException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.beans.factory.ObjectProvider;
import reactor.core.publisher.Flux;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Startup replay of authority-signed snapshots from the relay.
 */
@ExtendWith(MockitoExtension.class)
public class AuthorityStateLoaderTest {

    private static final long NOW = 1_700_000_000L;
    private static final String ALICE = TestKeys.ALICE.publicKeyHex();
    private static final String BOB = TestKeys.BOB.publicKeyHex();

    @Mock
    private RelayClient relay;

    @Mock
    private SnapshotPublisher publisher;

    @Mock
    private DenylistPurger purger;

    @Mock
    private ControlSubscriptionListener controlListener;

    @Mock
    private ZapReceiptListener receiptListener;

    @Mock
    private ObjectProvider<WalletMonitor> walletMonitor;

    private final MutableClock clock = MutableClock.atEpochSecond(NOW);
    private final List<NostrEvent> stored = new ArrayList<>();
    private IdentityList admins;
    private IdentityList editors;
    private BootstrapTracker bootstrap;
    private NameRegistry registry;
    private ControlMessageOrchestrator orchestrator;
    private AuthorityStateLoader loader;

    @BeforeEach
    void setup() {
        SigningAuthority authority = new SigningAuthority(TestKeys.AUTHORITY, clock);
        admins = new IdentityList("admins", List.of(), true);
        editors = new IdentityList("editors", List.of(), false);
        bootstrap = new BootstrapTracker(false);
        registry = new NameRegistry(new PricingTable(AuthorityProperties.Registry.defaultTiers(), true),
                new SettlementLedger(Duration.ofHours(6), 100, clock), authority, publisher, clock);
        orchestrator = new ControlMessageOrchestrator(admins, editors, new Denylist(), bootstrap, authority,
                registry, publisher, purger);
        loader = new AuthorityStateLoader(relay, authority, orchestrator, registry, bootstrap, admins,
                controlListener, receiptListener, walletMonitor, clock);
    }

    @AfterEach
    void teardown() {
        orchestrator.shutdown();
        registry.shutdown();
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    private void relayServesStoredEvents() {
        when(relay.fetch(any(RelayFilter.class))).thenAnswer(invocation -> {
            RelayFilter filter = invocation.getArgument(0);
            List<String> namespaces = filter.tags().getOrDefault("d", List.of());
            return Flux.fromIterable(stored)
                    .filter(event -> filter.kinds().contains(event.kind()))
                    .filter(event -> filter.authors().contains(event.pubkey()))
                    .filter(event -> namespaces.isEmpty() || namespaces.contains(event.namespace().orElse("")));
        });
    }

    private NostrEvent store(int kind, long createdAt, List<List<String>> tags, String content) {
        NostrEvent event = TestKeys.AUTHORITY.sign(NostrEvent.template(kind, createdAt, tags, content));
        stored.add(event);
        return event;
    }

    // ── Tests ────────────────────────────────────────────────────────────────

    @Test
    void replaysSnapshotsAndSeedsOwnerAsAdmin() {
        store(EventKinds.APP_HANDLER, NOW - 500, List.of(), "{\"name\":\"Market\",\"ownerPk\":\"" + ALICE + "\"}");
        store(EventKinds.PEOPLE_LIST, NOW - 400, List.of(List.of("d", "editors"), List.of("p", BOB)), "");
        store(EventKinds.PEOPLE_LIST, NOW - 300, RegistryMessages.template(
                List.of(new AliasRecord("shop", BOB, NOW + 1000)), 0).tags(), "");
        relayServesStoredEvents();

        loader.load();

        assertEquals(BootstrapTracker.State.CONFIGURED, bootstrap.state());
        assertEquals(Set.of(ALICE), admins.members());
        assertEquals(Set.of(BOB), editors.members());
        assertEquals(BOB, registry.resolve("shop").orElseThrow());
        assertEquals(NOW - 300, registry.lastRepublishedAt());
        verifyNoInteractions(publisher);
    }

    @Test
    void storedAdminListWinsOverOwnerSeed() {
        store(EventKinds.APP_HANDLER, NOW - 500, List.of(), "{\"name\":\"Market\",\"ownerPk\":\"" + ALICE + "\"}");
        store(EventKinds.PEOPLE_LIST, NOW - 450, List.of(List.of("d", "admins"), List.of("p", BOB)), "");
        relayServesStoredEvents();

        loader.load();

        assertEquals(Set.of(BOB), admins.members());
    }

    @Test
    void newestVerifiableSnapshotWins() {
        store(EventKinds.PEOPLE_LIST, NOW - 400, List.of(List.of("d", "editors"), List.of("p", ALICE)), "");
        NostrEvent newest = store(EventKinds.PEOPLE_LIST, NOW - 200,
                List.of(List.of("d", "editors"), List.of("p", BOB)), "");
        stored.add(new NostrEvent(newest.id(), newest.pubkey(), NOW - 100, newest.kind(), newest.tags(),
                newest.content(), newest.sig()));
        relayServesStoredEvents();

        loader.load();

        assertEquals(Set.of(BOB), editors.members());
    }

    @Test
    void emptyRelayLeavesInstanceAwaitingSetup() {
        relayServesStoredEvents();

        loader.load();

        assertEquals(BootstrapTracker.State.AWAITING_SETUP, bootstrap.state());
        assertEquals(0, admins.size());
    }

    @Test
    void relayFailureIsFatal() {
        when(relay.fetch(any(RelayFilter.class))).thenReturn(Flux.error(new IllegalStateException("refused")));

        assertThrows(TransportException.class, () -> loader.load());
    }

    @Test
    void runStartsListenersAfterLoading() {
        relayServesStoredEvents();

        loader.run(null);

        verify(controlListener).start();
        verify(receiptListener).start(NOW - 15);
        verify(walletMonitor).ifAvailable(any());
    }
}
