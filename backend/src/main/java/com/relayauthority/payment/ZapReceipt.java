package com.relayauthority.payment;

import com.relayauthority.crypto.Bolt11Invoice;

/**
 * A payment receipt for an alias purchase, with its payment request decoded.
 * {@code signer} is the key that signed the receipt; {@code preimage} is {@code null}
 * when the receipt carries none.
 */
public record ZapReceipt(String receiptId,
                         String signer,
                         long createdAt,
                         Bolt11Invoice invoice,
                         String preimage,
                         String alias,
                         String requester,
                         Long requestedMsats) {

    /** Settled amount: the invoice amount, or the requested amount for an amountless invoice. */
    public long paidSats() {
        if (invoice.amountSats() != null) {
            return invoice.amountSats();
        }
        return requestedMsats == null ? 0 : requestedMsats / 1000;
    }
}
