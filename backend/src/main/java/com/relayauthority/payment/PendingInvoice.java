package com.relayauthority.payment;

/**
 * An invoice this service issued for an alias purchase and has not yet seen paid.
 * Lives only in memory. {@code receiptSigner} is the key the issuing LNURL server
 * signs receipts with, or {@code null} when it named none.
 */
public record PendingInvoice(String paymentRequest,
                             String paymentHash,
                             String alias,
                             String requester,
                             long amountSats,
                             long createdAt,
                             String receiptSigner) {
}
