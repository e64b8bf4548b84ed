package com.relayauthority.control;

import com.relayauthority.authority.BootstrapTracker;
import com.relayauthority.authority.IdentityList;
import com.relayauthority.authority.SigningAuthority;
import com.relayauthority.event.EventCodec;
import com.relayauthority.event.EventKinds;
import com.relayauthority.event.NostrEvent;
import com.relayauthority.event.RelayFilter;
import com.relayauthority.payment.WalletMonitor;
import com.relayauthority.payment.ZapReceiptListener;
import com.relayauthority.registry.NameRegistry;
import com.relayauthority.relay.RelayClient;
import com.relayauthority.relay.TransportException;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.Set;

/**
 * Rebuilds authority state from the relay at boot, then starts the listeners.
 *
 * The latest authority-signed setup, admin list, editor list, denylist and registry
 * snapshot are fetched and replayed. A relay failure here is fatal: the service must
 * not come up with an empty authority.
 */
public class AuthorityStateLoader implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(AuthorityStateLoader.class);
    static final Duration RECEIPT_LOOKBACK = Duration.ofSeconds(15);

    private final RelayClient relay;
    private final SigningAuthority authority;
    private final ControlMessageOrchestrator orchestrator;
    private final NameRegistry registry;
    private final BootstrapTracker bootstrap;
    private final IdentityList admins;
    private final ControlSubscriptionListener controlListener;
    private final ZapReceiptListener receiptListener;
    private final ObjectProvider<WalletMonitor> walletMonitor;
    private final Clock clock;

    public AuthorityStateLoader(RelayClient relay, SigningAuthority authority, ControlMessageOrchestrator orchestrator,
                                NameRegistry registry, BootstrapTracker bootstrap,
                                @Qualifier("admins") IdentityList admins,
                                ControlSubscriptionListener controlListener, ZapReceiptListener receiptListener,
                                ObjectProvider<WalletMonitor> walletMonitor, Clock clock) {
        this.relay = relay;
        this.authority = authority;
        this.orchestrator = orchestrator;
        this.registry = registry;
        this.bootstrap = bootstrap;
        this.admins = admins;
        this.controlListener = controlListener;
        this.receiptListener = receiptListener;
        this.walletMonitor = walletMonitor;
        this.clock = clock;
    }

    @Override
    public void run(ApplicationArguments args) {
        log.info("Loading authority state for {} from {}", authority.identity(), relay.url());
        load();
        controlListener.start();
        receiptListener.start(clock.instant().minus(RECEIPT_LOOKBACK).getEpochSecond());
        walletMonitor.ifAvailable(WalletMonitor::start);
    }

    void load() {
        String self = authority.identity();
        latest(RelayFilter.forKinds(EventKinds.APP_HANDLER).withAuthors(self))
                .ifPresent(orchestrator::restore);
        Optional<NostrEvent> adminList = latest(RelayFilter.forKinds(EventKinds.PEOPLE_LIST).withAuthors(self)
                .withTag("d", EventKinds.ADMINS_NAMESPACE));
        adminList.ifPresent(orchestrator::restore);
        latest(RelayFilter.forKinds(EventKinds.PEOPLE_LIST).withAuthors(self)
                .withTag("d", EventKinds.EDITORS_NAMESPACE))
                .ifPresent(orchestrator::restore);
        latest(RelayFilter.forKinds(EventKinds.MUTE_LIST).withAuthors(self))
                .ifPresent(orchestrator::restore);
        latest(RelayFilter.forKinds(EventKinds.PEOPLE_LIST).withAuthors(self)
                .withTag("d", EventKinds.REGISTRY_NAMESPACE))
                .ifPresent(snapshot -> registry.restore(snapshot).block());

        if (adminList.isEmpty()) {
            bootstrap.owner().ifPresent(owner -> admins.replace(Set.of(owner)));
        }
        log.info("Authority state loaded: {} ({} admins, owner {})", bootstrap.state(), admins.size(),
                bootstrap.owner().orElse("unknown"));
    }

    private Optional<NostrEvent> latest(RelayFilter filter) {
        try {
            return relay.fetch(filter.withLimit(1))
                    .filter(EventCodec::verify)
                    .reduce((a, b) -> b.createdAt() > a.createdAt() ? b : a)
                    .blockOptional();
        } catch (TransportException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new TransportException("Initial load from " + relay.url() + " failed", e);
        }
    }

    @PreDestroy
    public void stop() {
        controlListener.stop();
        receiptListener.stop();
        walletMonitor.ifAvailable(WalletMonitor::stop);
    }
}
