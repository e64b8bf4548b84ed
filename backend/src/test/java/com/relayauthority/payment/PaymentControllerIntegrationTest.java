package com.relayauthority.payment;

import com.relayauthority.TestInvoices;
import com.relayauthority.relay.RelayClient;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.AutoConfigureWebTestClient;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.HttpStatus;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.time.Instant;
import java.util.Map;

/**
 * HTTP-layer tests for invoice issuance and client confirmation. The test profile
 * configures no lightning address and no wallet.
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@AutoConfigureWebTestClient
@ActiveProfiles("test")
class PaymentControllerIntegrationTest {

    @Autowired
    private WebTestClient webTestClient;

    @MockitoBean
    private RelayClient relayClient;

    @Test
    void invoice_withoutLightningAddress_shouldReturn503() {
        webTestClient.post()
                .uri("/api/vanity/invoice")
                .bodyValue(Map.of("amountSats", 10_000, "vanityName", "alice", "zapRequest", Map.of()))
                .exchange()
                .expectStatus().isEqualTo(HttpStatus.SERVICE_UNAVAILABLE)
                .expectBody()
                .jsonPath("$.error").isEqualTo("ISSUANCE_UNAVAILABLE");
    }

    @Test
    void confirm_missingFields_shouldReturn400() {
        webTestClient.post()
                .uri("/api/vanity/confirm")
                .bodyValue(Map.of("paymentRequest", "lnbc1"))
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("BAD_REQUEST");
    }

    @Test
    void confirm_undecodableInvoice_shouldReturn400() {
        webTestClient.post()
                .uri("/api/vanity/confirm")
                .bodyValue(Map.of("paymentRequest", "not-an-invoice", "secretPreimage", TestInvoices.preimage(1)))
                .exchange()
                .expectStatus().isBadRequest();
    }

    @Test
    void confirm_invoiceNotIssuedHere_shouldReturn404() {
        String preimage = TestInvoices.preimage(7);
        String invoice = TestInvoices.invoice(10_000, preimage, Instant.now().getEpochSecond());

        webTestClient.post()
                .uri("/api/vanity/confirm")
                .bodyValue(Map.of("paymentRequest", invoice, "secretPreimage", preimage))
                .exchange()
                .expectStatus().isNotFound()
                .expectBody()
                .jsonPath("$.error").isEqualTo("UNKNOWN_INVOICE");
    }
}
