package com.relayauthority.payment;

import com.relayauthority.config.AuthorityProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Pending invoices keyed by payment hash. Invoices older than the horizon are
 * treated as abandoned and swept periodically.
 */
@Component
public class PendingInvoiceStore {

    private static final Logger log = LoggerFactory.getLogger(PendingInvoiceStore.class);

    private final ConcurrentHashMap<String, PendingInvoice> byPaymentHash = new ConcurrentHashMap<>();
    private final Duration horizon;
    private final Clock clock;

    public PendingInvoiceStore(AuthorityProperties properties, Clock clock) {
        this.horizon = properties.invoices().pendingHorizon();
        this.clock = clock;
    }

    public void remember(PendingInvoice invoice) {
        byPaymentHash.put(invoice.paymentHash(), invoice);
        log.info("Pending invoice {} for alias '{}' ({} sats) issued to {}", invoice.paymentHash(),
                invoice.alias(), invoice.amountSats(), invoice.requester());
    }

    public Optional<PendingInvoice> find(String paymentHash) {
        PendingInvoice invoice = paymentHash == null ? null : byPaymentHash.get(paymentHash);
        return invoice == null || isAbandoned(invoice, now()) ? Optional.empty() : Optional.of(invoice);
    }

    public void remove(String paymentHash) {
        byPaymentHash.remove(paymentHash);
    }

    public boolean isEmpty() {
        return byPaymentHash.isEmpty();
    }

    public List<PendingInvoice> pending() {
        long now = now();
        return byPaymentHash.values().stream()
                .filter(invoice -> !isAbandoned(invoice, now))
                .toList();
    }

    public OptionalLong oldestCreatedAt() {
        return pending().stream().mapToLong(PendingInvoice::createdAt).min();
    }

    @Scheduled(fixedDelayString = "${authority.invoices.sweep-interval:PT5M}")
    public int sweep() {
        long now = now();
        int before = byPaymentHash.size();
        byPaymentHash.values().removeIf(invoice -> isAbandoned(invoice, now));
        int swept = before - byPaymentHash.size();
        if (swept > 0) {
            log.info("Swept {} abandoned pending invoices", swept);
        }
        return swept;
    }

    private boolean isAbandoned(PendingInvoice invoice, long now) {
        return invoice.createdAt() + horizon.toSeconds() < now;
    }

    private long now() {
        return clock.instant().getEpochSecond();
    }
}
