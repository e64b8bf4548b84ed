package com.relayauthority.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.relayauthority.authority.BootstrapTracker;
import com.relayauthority.authority.Denylist;
import com.relayauthority.authority.IdentityList;
import com.relayauthority.authority.SigningAuthority;
import com.relayauthority.control.AuthorityStateLoader;
import com.relayauthority.control.ControlMessageOrchestrator;
import com.relayauthority.control.ControlSubscriptionListener;
import com.relayauthority.control.SignerWebSocketHandler;
import com.relayauthority.crypto.NostrIds;
import com.relayauthority.crypto.NostrKeys;
import com.relayauthority.payment.LightningAddressClient;
import com.relayauthority.payment.NwcConnection;
import com.relayauthority.payment.NwcWalletClient;
import com.relayauthority.payment.PaymentConfirmationService;
import com.relayauthority.payment.PendingInvoiceStore;
import com.relayauthority.payment.WalletClient;
import com.relayauthority.payment.WalletMonitor;
import com.relayauthority.payment.ZapReceiptListener;
import com.relayauthority.registry.NameRegistry;
import com.relayauthority.registry.PricingTable;
import com.relayauthority.registry.SettlementLedger;
import com.relayauthority.relay.RelayClient;
import com.relayauthority.relay.RelayClientFactory;
import com.relayauthority.relay.WebSocketRelayClient;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.HandlerMapping;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.handler.SimpleUrlHandlerMapping;
import org.springframework.web.reactive.socket.client.ReactorNettyWebSocketClient;
import reactor.netty.http.client.HttpClient;
import reactor.netty.http.client.WebsocketClientSpec;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Wiring of the authority service. Anything that depends on configuration values
 * is built here; a bad key, URI or address fails the context and stops the process.
 */
@Configuration
public class AuthorityConfiguration {

    private static final int MAX_FRAME_BYTES = 4 * 1024 * 1024;

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public SigningAuthority signingAuthority(AuthorityProperties properties, Clock clock) {
        return new SigningAuthority(NostrKeys.fromSecret(properties.privateKey()), clock);
    }

    // ── Transport ────────────────────────────────────────────────────────────

    @Bean
    public RelayClientFactory relayClientFactory(AuthorityProperties properties) {
        ReactorNettyWebSocketClient webSocketClient = new ReactorNettyWebSocketClient(HttpClient.create(),
                () -> WebsocketClientSpec.builder().maxFramePayloadLength(MAX_FRAME_BYTES));
        AuthorityProperties.Relay relay = properties.relay();
        return url -> new WebSocketRelayClient(url, webSocketClient, relay.fetchTimeout(), relay.publishTimeout());
    }

    @Bean
    public RelayClient relayClient(RelayClientFactory factory, AuthorityProperties properties) {
        return factory.connect(properties.relay().url());
    }

    // ── Authorization state ──────────────────────────────────────────────────

    @Bean
    @Qualifier("admins")
    public IdentityList admins(AuthorityProperties properties) {
        List<String> initial = properties.initialAdmins().stream().map(NostrIds::toHex).toList();
        return new IdentityList("admins", initial, true);
    }

    @Bean
    @Qualifier("editors")
    public IdentityList editors() {
        return new IdentityList("editors", List.of(), false);
    }

    @Bean
    public Denylist denylist() {
        return new Denylist();
    }

    @Bean
    public BootstrapTracker bootstrapTracker(AuthorityProperties properties) {
        return new BootstrapTracker(!properties.initialAdmins().isEmpty());
    }

    // ── Registry ─────────────────────────────────────────────────────────────

    @Bean
    public PricingTable pricingTable(AuthorityProperties properties) {
        return new PricingTable(properties.registry().tiers(), properties.registry().production());
    }

    @Bean
    public SettlementLedger settlementLedger(AuthorityProperties properties, Clock clock) {
        AuthorityProperties.Registry registry = properties.registry();
        return new SettlementLedger(registry.settlementWindow(), registry.settlementCapacity(), clock);
    }

    // ── Inbound channels ─────────────────────────────────────────────────────

    @Bean
    public SignerWebSocketHandler signerWebSocketHandler(ControlMessageOrchestrator orchestrator) {
        return new SignerWebSocketHandler(orchestrator);
    }

    @Bean
    public HandlerMapping signerHandlerMapping(SignerWebSocketHandler handler) {
        return new SimpleUrlHandlerMapping(Map.of("/ws", handler), -1);
    }

    @Bean
    public ControlSubscriptionListener controlSubscriptionListener(RelayClient relayClient,
                                                                   ControlMessageOrchestrator orchestrator,
                                                                   SigningAuthority authority, Clock clock) {
        return new ControlSubscriptionListener(relayClient, orchestrator, authority, clock);
    }

    @Bean
    public ZapReceiptListener zapReceiptListener(RelayClient relayClient, RelayClientFactory factory,
                                                 AuthorityProperties properties, SigningAuthority authority,
                                                 NameRegistry registry, PaymentConfirmationService confirmations) {
        List<RelayClient> relays = new ArrayList<>();
        relays.add(relayClient);
        properties.relay().receiptRelays().stream()
                .filter(url -> !url.equals(relayClient.url()))
                .distinct()
                .map(factory::connect)
                .forEach(relays::add);
        return new ZapReceiptListener(relays, authority, registry, confirmations);
    }

    @Bean
    @ConditionalOnProperty(prefix = "authority.lightning", name = "address")
    public LightningAddressClient lightningAddressClient(WebClient.Builder webClientBuilder,
                                                         AuthorityProperties properties) {
        return new LightningAddressClient(webClientBuilder.build(), properties.lightning().address());
    }

    @Bean
    @ConditionalOnProperty(prefix = "authority.wallet", name = "nwc-uri")
    public WalletClient walletClient(AuthorityProperties properties, RelayClientFactory factory,
                                     ObjectMapper objectMapper, Clock clock) {
        NwcConnection connection = NwcConnection.parse(properties.wallet().nwcUri());
        return new NwcWalletClient(connection, factory.connect(connection.relayUrl()), objectMapper,
                properties.wallet().requestTimeout(), clock);
    }

    @Bean
    @ConditionalOnProperty(prefix = "authority.wallet", name = "nwc-uri")
    public WalletMonitor walletMonitor(WalletClient walletClient, PendingInvoiceStore pendingInvoices,
                                       PaymentConfirmationService confirmations, AuthorityProperties properties,
                                       Clock clock) {
        return new WalletMonitor(walletClient, pendingInvoices, confirmations,
                properties.wallet().pollInterval(), clock);
    }

    @Bean
    @ConditionalOnProperty(prefix = "authority.startup", name = "enabled", havingValue = "true", matchIfMissing = true)
    public AuthorityStateLoader authorityStateLoader(RelayClient relayClient, SigningAuthority authority,
                                                     ControlMessageOrchestrator orchestrator, NameRegistry registry,
                                                     BootstrapTracker bootstrap,
                                                     @Qualifier("admins") IdentityList admins,
                                                     ControlSubscriptionListener controlListener,
                                                     ZapReceiptListener receiptListener,
                                                     ObjectProvider<WalletMonitor> walletMonitor, Clock clock) {
        return new AuthorityStateLoader(relayClient, authority, orchestrator, registry, bootstrap, admins,
                controlListener, receiptListener, walletMonitor, clock);
    }
}
