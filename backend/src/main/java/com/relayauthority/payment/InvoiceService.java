package com.relayauthority.payment;

import com.relayauthority.authority.SigningAuthority;
import com.relayauthority.crypto.Bolt11Invoice;
import com.relayauthority.event.EventCodec;
import com.relayauthority.event.MalformedEventException;
import com.relayauthority.event.NostrEvent;
import com.relayauthority.registry.AliasRecord;
import com.relayauthority.registry.AliasRules;
import com.relayauthority.registry.NameRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.Optional;

/**
 * Issues invoices for alias purchases and remembers them as pending.
 *
 * The client's signed payment request is checked before any invoice is requested:
 * it must be a registration for the requested alias, for the requested amount,
 * addressed to this authority. The alias must be free or already held by the requester
 * (a renewal), and the amount must meet a pricing tier.
 */
@Service
public class InvoiceService {

    private static final Logger log = LoggerFactory.getLogger(InvoiceService.class);

    private final ObjectProvider<LightningAddressClient> lightning;
    private final NameRegistry registry;
    private final PendingInvoiceStore pendingInvoices;
    private final SigningAuthority authority;
    private final Clock clock;

    public InvoiceService(ObjectProvider<LightningAddressClient> lightning, NameRegistry registry,
                          PendingInvoiceStore pendingInvoices, SigningAuthority authority, Clock clock) {
        this.lightning = lightning;
        this.registry = registry;
        this.pendingInvoices = pendingInvoices;
        this.authority = authority;
        this.clock = clock;
    }

    public Mono<InvoiceResponse> issue(InvoiceRequest request) {
        return Mono.defer(() -> {
            LightningAddressClient client = lightning.getIfAvailable();
            if (client == null) {
                return Mono.error(new PaymentException(PaymentException.Reason.ISSUANCE_UNAVAILABLE,
                        "No lightning address is configured"));
            }
            NostrEvent zapRequest;
            String alias;
            try {
                zapRequest = parseZapRequest(request);
                alias = ZapRequests.validateForIssuance(zapRequest, request.vanityName(), request.amountSats(),
                        authority.identity());
            } catch (MalformedEventException e) {
                return Mono.error(new PaymentException(PaymentException.Reason.BAD_REQUEST, e.getMessage(), e));
            }
            checkPurchasable(alias, zapRequest.pubkey(), request.amountSats());

            long amountMsats = request.amountSats() * 1000;
            return client.requestInvoice(amountMsats, EventCodec.toJson(zapRequest))
                    .map(issued -> remember(issued, alias, zapRequest.pubkey(), request.amountSats()));
        });
    }

    private void checkPurchasable(String alias, String requester, long amountSats) {
        if (!AliasRules.isValid(alias)) {
            throw new PaymentException(PaymentException.Reason.BAD_REQUEST, "Alias '" + alias + "' is not allowed");
        }
        if (AliasRules.isReserved(alias)) {
            throw new PaymentException(PaymentException.Reason.ALIAS_UNAVAILABLE, "Alias '" + alias + "' is reserved");
        }
        Optional<AliasRecord> held = registry.lookup(alias);
        if (held.isPresent() && !held.get().owner().equalsIgnoreCase(requester)) {
            throw new PaymentException(PaymentException.Reason.ALIAS_UNAVAILABLE, "Alias '" + alias + "' is taken");
        }
        if (registry.quoteTiers().stream().noneMatch(tier -> amountSats >= tier.amountSats())) {
            throw new PaymentException(PaymentException.Reason.INSUFFICIENT_AMOUNT,
                    amountSats + " sats is below every pricing tier");
        }
    }

    private InvoiceResponse remember(LnurlInvoice issued, String alias, String requester, long amountSats) {
        String paymentRequest = issued.paymentRequest();
        Bolt11Invoice invoice;
        try {
            invoice = Bolt11Invoice.decode(paymentRequest);
        } catch (IllegalArgumentException e) {
            throw new PaymentException(PaymentException.Reason.UPSTREAM_FAILURE,
                    "Lightning address returned an undecodable invoice", e);
        }
        if (invoice.amountMsats() == null || invoice.amountMsats() != amountSats * 1000) {
            throw new PaymentException(PaymentException.Reason.UPSTREAM_FAILURE,
                    "Lightning address returned an invoice for " + invoice.amountMsats() + " msats");
        }
        pendingInvoices.remember(new PendingInvoice(invoice.paymentRequest(), invoice.paymentHash(), alias,
                requester, amountSats, clock.instant().getEpochSecond(), issued.nostrPubkey()));
        log.debug("Issued invoice {} for '{}'", invoice.paymentHash(), alias);
        return new InvoiceResponse(paymentRequest);
    }

    private static NostrEvent parseZapRequest(InvoiceRequest request) {
        if (request.zapRequest() == null || request.zapRequest().isNull()) {
            throw new MalformedEventException("Missing zapRequest");
        }
        if (request.zapRequest().isTextual()) {
            return EventCodec.parse(request.zapRequest().textValue());
        }
        return EventCodec.fromNode(request.zapRequest());
    }
}
