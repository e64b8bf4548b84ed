package com.relayauthority.payment;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.relayauthority.crypto.Nip04Cipher;
import com.relayauthority.crypto.NostrKeys;
import com.relayauthority.event.EventKinds;
import com.relayauthority.event.NostrEvent;
import com.relayauthority.event.RelayFilter;
import com.relayauthority.relay.RelayClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.security.GeneralSecurityException;
import java.time.Clock;
import java.time.Duration;
import java.util.HexFormat;
import java.util.List;

/**
 * Wallet access over Nostr Wallet Connect: NIP-04 encrypted JSON-RPC requests
 * (kind 23194) answered by the wallet service (kind 23195) on the wallet relay.
 */
public class NwcWalletClient implements WalletClient {

    private static final Logger log = LoggerFactory.getLogger(NwcWalletClient.class);

    private final NwcConnection connection;
    private final NostrKeys clientKeys;
    private final RelayClient walletRelay;
    private final ObjectMapper mapper;
    private final Duration timeout;
    private final Clock clock;

    public NwcWalletClient(NwcConnection connection, RelayClient walletRelay, ObjectMapper mapper,
                           Duration timeout, Clock clock) {
        this.connection = connection;
        this.clientKeys = NostrKeys.fromSecret(connection.secret());
        this.walletRelay = walletRelay;
        this.mapper = mapper;
        this.timeout = timeout;
        this.clock = clock;
    }

    @Override
    public Flux<WalletTransaction> listIncoming(long since, int limit) {
        ObjectNode request = mapper.createObjectNode();
        request.put("method", "list_transactions");
        ObjectNode params = request.putObject("params");
        params.put("from", since);
        params.put("limit", limit);
        params.put("type", "incoming");
        return call(request)
                .flatMapMany(result -> Flux.fromIterable(result.path("transactions")))
                .map(this::toTransaction);
    }

    Mono<JsonNode> call(ObjectNode request) {
        return Mono.fromCallable(() -> encryptedRequest(request))
                .flatMap(event -> walletRelay.exchange(event, RelayFilter.forKinds(EventKinds.NWC_RESPONSE)
                                .withAuthors(connection.walletPubkey())
                                .withTag("e", event.id()))
                        .timeout(timeout)
                        .switchIfEmpty(Mono.error(new WalletException("Wallet relay closed without a response"))))
                .map(this::decryptResponse)
                .flatMap(response -> {
                    JsonNode error = response.get("error");
                    if (error != null && !error.isNull()) {
                        return Mono.error(new WalletException("Wallet error " + error.path("code").asText()
                                + ": " + error.path("message").asText()));
                    }
                    return Mono.just(response.path("result"));
                })
                .doOnError(error -> log.warn("NWC {} failed: {}", request.path("method").asText(), error.getMessage()));
    }

    NostrEvent encryptedRequest(ObjectNode request) throws GeneralSecurityException, JsonProcessingException {
        String content = Nip04Cipher.encrypt(mapper.writeValueAsString(request), clientKeys.secretKey(),
                HexFormat.of().parseHex(connection.walletPubkey()));
        return clientKeys.sign(NostrEvent.template(EventKinds.NWC_REQUEST, clock.instant().getEpochSecond(),
                List.of(List.of("p", connection.walletPubkey())), content));
    }

    JsonNode decryptResponse(NostrEvent response) {
        try {
            String json = Nip04Cipher.decrypt(response.content(), clientKeys.secretKey(),
                    HexFormat.of().parseHex(connection.walletPubkey()));
            return mapper.readTree(json);
        } catch (GeneralSecurityException | JsonProcessingException e) {
            throw new WalletException("Cannot read wallet response " + response.id(), e);
        }
    }

    private WalletTransaction toTransaction(JsonNode node) {
        JsonNode settledAt = node.get("settled_at");
        return new WalletTransaction(
                node.path("type").asText(""),
                textOrNull(node, "invoice"),
                textOrNull(node, "payment_hash"),
                textOrNull(node, "preimage"),
                node.path("amount").asLong(0),
                node.path("created_at").asLong(0),
                settledAt == null || settledAt.isNull() ? null : settledAt.asLong());
    }

    private static String textOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() || value.asText().isEmpty() ? null : value.asText();
    }

    public NwcConnection connection() {
        return connection;
    }
}
