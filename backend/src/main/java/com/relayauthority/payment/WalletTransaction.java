package com.relayauthority.payment;

/**
 * An incoming payment as the authority's wallet reports it. Amounts are msats.
 */
public record WalletTransaction(String type,
                                String invoice,
                                String paymentHash,
                                String preimage,
                                long amountMsats,
                                long createdAt,
                                Long settledAt) {

    public boolean isSettled() {
        return settledAt != null && settledAt > 0;
    }
}
