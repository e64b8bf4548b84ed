package com.relayauthority.payment;

import com.fasterxml.jackson.databind.JsonNode;
import com.relayauthority.crypto.NostrIds;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.util.UriComponentsBuilder;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Locale;

/**
 * Obtains invoices from a lightning address via LNURL-pay (LUD-06/LUD-16), passing the
 * signed payment request along as a NIP-57 {@code nostr} parameter.
 */
public class LightningAddressClient {

    private static final Logger log = LoggerFactory.getLogger(LightningAddressClient.class);

    private final WebClient webClient;
    private final String user;
    private final String domain;

    public LightningAddressClient(WebClient webClient, String address) {
        int at = address == null ? -1 : address.indexOf('@');
        if (at <= 0 || at == address.length() - 1) {
            throw new IllegalArgumentException("Lightning address must look like user@domain: " + address);
        }
        this.webClient = webClient;
        this.user = address.substring(0, at);
        this.domain = address.substring(at + 1);
    }

    public Mono<LnurlInvoice> requestInvoice(long amountMsats, String zapRequestJson) {
        return fetchPayParams()
                .flatMap(params -> {
                    long min = params.path("minSendable").asLong(0);
                    long max = params.path("maxSendable").asLong(Long.MAX_VALUE);
                    if (amountMsats < min || amountMsats > max) {
                        return Mono.error(new PaymentException(PaymentException.Reason.UPSTREAM_FAILURE,
                                "Amount " + amountMsats + " msats outside " + min + ".." + max));
                    }
                    URI callback = UriComponentsBuilder.fromUriString(params.path("callback").asText())
                            .query("amount=" + amountMsats + "&nostr="
                                    + URLEncoder.encode(zapRequestJson, StandardCharsets.UTF_8))
                            .build(true)
                            .toUri();
                    String receiptSigner = receiptSigner(params);
                    return webClient.get().uri(callback).retrieve().bodyToMono(JsonNode.class)
                            .flatMap(response -> toInvoice(response, receiptSigner));
                })
                .onErrorMap(error -> !(error instanceof PaymentException),
                        error -> new PaymentException(PaymentException.Reason.UPSTREAM_FAILURE,
                                "Lightning address " + address() + " unreachable", error));
    }

    private Mono<LnurlInvoice> toInvoice(JsonNode response, String receiptSigner) {
        if ("ERROR".equalsIgnoreCase(response.path("status").asText())) {
            return Mono.error(new PaymentException(PaymentException.Reason.UPSTREAM_FAILURE,
                    "Invoice callback failed: " + response.path("reason").asText()));
        }
        String pr = response.path("pr").asText("");
        if (pr.isEmpty()) {
            return Mono.error(new PaymentException(PaymentException.Reason.UPSTREAM_FAILURE,
                    "Invoice callback returned no payment request"));
        }
        return Mono.just(new LnurlInvoice(pr, receiptSigner));
    }

    private String receiptSigner(JsonNode params) {
        String pubkey = params.path("nostrPubkey").asText("").toLowerCase(Locale.ROOT);
        if (params.path("allowsNostr").asBoolean(false) && NostrIds.isHex64(pubkey)) {
            return pubkey;
        }
        log.warn("Lightning address {} names no receipt signer; receipts only count with a preimage", address());
        return null;
    }

    private Mono<JsonNode> fetchPayParams() {
        return webClient.get()
                .uri("https://{domain}/.well-known/lnurlp/{user}", domain, user)
                .retrieve()
                .bodyToMono(JsonNode.class)
                .flatMap(params -> {
                    if (!params.path("callback").isTextual()) {
                        return Mono.error(new PaymentException(PaymentException.Reason.UPSTREAM_FAILURE,
                                "Lightning address " + address() + " returned no callback"));
                    }
                    if (!params.path("allowsNostr").asBoolean(false)) {
                        log.warn("Lightning address {} does not advertise nostr receipts", address());
                    }
                    return Mono.just(params);
                });
    }

    public String address() {
        return user + "@" + domain;
    }
}
