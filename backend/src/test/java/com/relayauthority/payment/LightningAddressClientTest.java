package com.relayauthority.payment;

import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * LNURL-pay flow against a stubbed HTTP exchange.
 */
public class LightningAddressClientTest {

    private static final String SIGNER = ZapFixtures.LNURL_SERVER.publicKeyHex();
    private static final String PAY_PARAMS = "{\"callback\":\"https://pay.test/cb/abc\",\"minSendable\":1000,"
            + "\"maxSendable\":100000000000,\"allowsNostr\":true,\"nostrPubkey\":\"" + SIGNER + "\","
            + "\"tag\":\"payRequest\"}";

    private final List<URI> requested = new ArrayList<>();

    private WebClient webClient(String callbackBody) {
        return webClient(PAY_PARAMS, callbackBody);
    }

    private WebClient webClient(String payParams, String callbackBody) {
        return WebClient.builder()
                .exchangeFunction((ClientRequest request) -> {
                    requested.add(request.url());
                    String body = request.url().getPath().startsWith("/.well-known/") ? payParams : callbackBody;
                    return Mono.just(ClientResponse.create(HttpStatus.OK)
                            .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                            .body(body)
                            .build());
                })
                .build();
    }

    @Test
    void requestsInvoiceThroughCallbackWithPaymentRequest() {
        LightningAddressClient client = new LightningAddressClient(webClient("{\"pr\":\"lnbc100n1xyz\"}"),
                "vanity@pay.test");
        String zapJson = "{\"kind\":9734,\"content\":\"a&b=c\"}";

        StepVerifier.create(client.requestInvoice(10_000, zapJson))
                .expectNext(new LnurlInvoice("lnbc100n1xyz", SIGNER))
                .verifyComplete();

        assertEquals("https://pay.test/.well-known/lnurlp/vanity", requested.get(0).toString());
        URI callback = requested.get(1);
        assertEquals("/cb/abc", callback.getPath());
        assertTrue(callback.getRawQuery().startsWith("amount=10000&nostr="));
        String nostr = callback.getRawQuery().substring("amount=10000&nostr=".length());
        assertEquals(zapJson, URLDecoder.decode(nostr, StandardCharsets.UTF_8));
    }

    @Test
    void serverWithoutNostrSupportNamesNoReceiptSigner() {
        String params = "{\"callback\":\"https://pay.test/cb/abc\",\"minSendable\":1000,"
                + "\"maxSendable\":100000000000,\"tag\":\"payRequest\"}";
        LightningAddressClient client = new LightningAddressClient(webClient(params, "{\"pr\":\"lnbc100n1xyz\"}"),
                "vanity@pay.test");

        StepVerifier.create(client.requestInvoice(10_000, "{}"))
                .expectNext(new LnurlInvoice("lnbc100n1xyz", null))
                .verifyComplete();
    }

    @Test
    void callbackErrorIsUpstreamFailure() {
        LightningAddressClient client = new LightningAddressClient(
                webClient("{\"status\":\"ERROR\",\"reason\":\"nostr not supported\"}"), "vanity@pay.test");

        StepVerifier.create(client.requestInvoice(10_000, "{}"))
                .expectErrorSatisfies(error -> {
                    assertEquals(PaymentException.Reason.UPSTREAM_FAILURE, ((PaymentException) error).reason());
                    assertTrue(error.getMessage().contains("nostr not supported"));
                })
                .verify();
    }

    @Test
    void amountOutsideLimitsIsRefusedBeforeCallback() {
        LightningAddressClient client = new LightningAddressClient(webClient("{\"pr\":\"x\"}"), "vanity@pay.test");

        StepVerifier.create(client.requestInvoice(10, "{}"))
                .expectError(PaymentException.class)
                .verify();
        assertEquals(1, requested.size());
    }

    @Test
    void rejectsMalformedAddress() {
        assertThrows(IllegalArgumentException.class, () -> new LightningAddressClient(webClient("{}"), "nodomain"));
        assertThrows(IllegalArgumentException.class, () -> new LightningAddressClient(webClient("{}"), "user@"));
    }
}
