package com.relayauthority.payment;

import com.relayauthority.crypto.Bolt11Invoice;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;

/**
 * The wallet-polling channel. Every interval it lists incoming wallet transactions and
 * confirms those settling a pending invoice. Polling is skipped while nothing is pending.
 */
public class WalletMonitor {

    private static final Logger log = LoggerFactory.getLogger(WalletMonitor.class);
    static final int PAGE_SIZE = 50;
    static final Duration INITIAL_LOOKBACK = Duration.ofMinutes(5);

    private final WalletClient wallet;
    private final PendingInvoiceStore pendingInvoices;
    private final PaymentConfirmationService confirmations;
    private final Duration interval;
    private final Clock clock;
    private volatile long lastCheck;
    private volatile Disposable polling;

    public WalletMonitor(WalletClient wallet, PendingInvoiceStore pendingInvoices,
                         PaymentConfirmationService confirmations, Duration interval, Clock clock) {
        this.wallet = wallet;
        this.pendingInvoices = pendingInvoices;
        this.confirmations = confirmations;
        this.interval = interval;
        this.clock = clock;
        this.lastCheck = clock.instant().minus(INITIAL_LOOKBACK).getEpochSecond();
    }

    public void start() {
        polling = Flux.interval(interval, interval)
                .onBackpressureDrop()
                .concatMap(tick -> pollOnce()
                        .onErrorResume(error -> {
                            log.warn("Wallet poll failed: {}", error.getMessage());
                            return Mono.empty();
                        }))
                .subscribe();
        log.info("Polling wallet every {}", interval);
    }

    Mono<Void> pollOnce() {
        if (pendingInvoices.isEmpty()) {
            log.debug("No pending invoices; skipping wallet poll");
            return Mono.empty();
        }
        long startedAt = clock.instant().getEpochSecond();
        long since = Math.min(lastCheck, pendingInvoices.oldestCreatedAt().orElse(lastCheck));
        return wallet.listIncoming(since, PAGE_SIZE)
                .filter(WalletTransaction::isSettled)
                .concatMap(transaction -> pendingInvoices.find(paymentHashOf(transaction))
                        .map(invoice -> confirmations.confirmFromWallet(invoice, transaction).then())
                        .orElse(Mono.empty()))
                .then(Mono.fromRunnable(() -> lastCheck = startedAt));
    }

    private static String paymentHashOf(WalletTransaction transaction) {
        if (transaction.paymentHash() != null) {
            return transaction.paymentHash();
        }
        if (transaction.invoice() == null) {
            return null;
        }
        try {
            return Bolt11Invoice.decode(transaction.invoice()).paymentHash();
        } catch (IllegalArgumentException e) {
            log.debug("Wallet transaction carries an undecodable invoice: {}", e.getMessage());
            return null;
        }
    }

    long lastCheck() {
        return lastCheck;
    }

    public void stop() {
        Disposable current = polling;
        if (current != null) {
            current.dispose();
        }
        wallet.close();
        log.info("Stopped wallet polling");
    }
}
