package com.relayauthority.payment;

import com.relayauthority.crypto.Bolt11Invoice;
import com.relayauthority.registry.AliasRecord;
import com.relayauthority.registry.NameRegistry;
import com.relayauthority.registry.PurchaseOutcome;
import com.relayauthority.registry.PurchaseRequest;
import com.relayauthority.registry.Rejection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.Optional;

/**
 * Turns payment proofs from every channel into purchases on the {@link NameRegistry}.
 *
 * All channels use the payment hash as the settlement reference, so a payment seen
 * through the receipt subscription and again through the wallet is applied once.
 * Every proof must settle an invoice this service issued.
 */
@Service
public class PaymentConfirmationService {

    private static final Logger log = LoggerFactory.getLogger(PaymentConfirmationService.class);

    private final NameRegistry registry;
    private final PendingInvoiceStore pendingInvoices;

    public PaymentConfirmationService(NameRegistry registry, PendingInvoiceStore pendingInvoices) {
        this.registry = registry;
        this.pendingInvoices = pendingInvoices;
    }

    /**
     * Receipt channel. Completes empty when the receipt is dropped before reaching the registry.
     *
     * A receipt only counts for an invoice this service issued and still holds as pending,
     * and only when it carries that invoice's preimage or is signed by the LNURL server
     * that issued it. Alias, requester and amount are taken from the pending invoice.
     */
    public Mono<PurchaseOutcome> confirmFromReceipt(ZapReceipt receipt) {
        String paymentHash = receipt.invoice().paymentHash();
        if (registry.isSettled(paymentHash)) {
            log.debug("Receipt {} settles {} which was already applied", receipt.receiptId(), paymentHash);
            return Mono.empty();
        }
        Optional<PendingInvoice> pending = pendingInvoices.find(paymentHash);
        if (pending.isEmpty()) {
            log.warn("Receipt {} from {} settles no invoice issued here; ignoring", receipt.receiptId(),
                    receipt.signer());
            return Mono.empty();
        }
        PendingInvoice issued = pending.get();
        if (!matches(issued, receipt)) {
            log.warn("Receipt {} names '{}' for {} but invoice {} was issued for '{}' to {}", receipt.receiptId(),
                    receipt.alias(), receipt.requester(), paymentHash, issued.alias(), issued.requester());
            return Mono.empty();
        }
        if (receipt.preimage() != null) {
            if (!receipt.invoice().validatePreimage(receipt.preimage())) {
                log.warn("Receipt {} carries a preimage that does not match its invoice", receipt.receiptId());
                return Mono.empty();
            }
        } else if (issued.receiptSigner() == null || !issued.receiptSigner().equalsIgnoreCase(receipt.signer())) {
            log.warn("Receipt {} has no preimage and is not signed by the server that issued {}",
                    receipt.receiptId(), paymentHash);
            return Mono.empty();
        }
        return purchase(new PurchaseRequest(issued.alias(), issued.requester(), issued.amountSats(),
                paymentHash, "receipt"));
    }

    /** Wallet channel: a settled incoming transaction that matches a pending invoice. */
    public Mono<PurchaseOutcome> confirmFromWallet(PendingInvoice invoice, WalletTransaction transaction) {
        if (!transaction.isSettled()) {
            return Mono.empty();
        }
        if (transaction.preimage() != null && !Bolt11Invoice.decode(invoice.paymentRequest()).validatePreimage(transaction.preimage())) {
            log.warn("Wallet reports preimage for {} that does not match the invoice", invoice.paymentHash());
            return Mono.empty();
        }
        if (registry.isSettled(invoice.paymentHash())) {
            pendingInvoices.remove(invoice.paymentHash());
            log.debug("Wallet payment {} was already applied", invoice.paymentHash());
            return Mono.empty();
        }
        return purchase(new PurchaseRequest(invoice.alias(), invoice.requester(), transaction.amountMsats() / 1000,
                invoice.paymentHash(), "wallet"));
    }

    /**
     * Confirmation by a client holding the preimage of an invoice issued here.
     *
     * @return the resulting record; errors with {@link PaymentException}
     */
    public Mono<AliasRecord> confirmWithPreimage(String paymentRequest, String preimage) {
        return Mono.defer(() -> {
            Bolt11Invoice invoice;
            try {
                invoice = Bolt11Invoice.decode(paymentRequest);
            } catch (IllegalArgumentException e) {
                return Mono.error(new PaymentException(PaymentException.Reason.BAD_REQUEST,
                        "Payment request cannot be decoded: " + e.getMessage(), e));
            }
            Optional<PendingInvoice> pending = pendingInvoices.find(invoice.paymentHash());
            if (pending.isEmpty()) {
                return Mono.error(registry.isSettled(invoice.paymentHash())
                        ? new PaymentException(PaymentException.Reason.ALREADY_CONFIRMED, "Invoice was already confirmed")
                        : new PaymentException(PaymentException.Reason.UNKNOWN_INVOICE, "Invoice is unknown or expired"));
            }
            if (!invoice.validatePreimage(preimage)) {
                return Mono.error(new PaymentException(PaymentException.Reason.INVALID_PREIMAGE,
                        "Preimage does not match the invoice"));
            }
            PendingInvoice issued = pending.get();
            return purchase(new PurchaseRequest(issued.alias(), issued.requester(), issued.amountSats(),
                    issued.paymentHash(), "preimage"))
                    .flatMap(outcome -> outcome.isAccepted()
                            ? Mono.just(outcome.record())
                            : Mono.error(PaymentException.from(outcome.rejection())));
        });
    }

    private Mono<PurchaseOutcome> purchase(PurchaseRequest request) {
        return registry.confirmPurchase(request)
                .doOnNext(outcome -> {
                    if (outcome.isAccepted() || outcome.rejection() == Rejection.DUPLICATE_SETTLEMENT) {
                        pendingInvoices.remove(request.settlementRef());
                    }
                });
    }

    private static boolean matches(PendingInvoice invoice, ZapReceipt receipt) {
        return invoice.alias().equals(receipt.alias()) && invoice.requester().equalsIgnoreCase(receipt.requester());
    }
}
