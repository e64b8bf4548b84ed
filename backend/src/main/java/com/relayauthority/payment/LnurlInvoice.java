package com.relayauthority.payment;

/**
 * An invoice returned by an LNURL-pay callback. {@code nostrPubkey} is the key the
 * server signs payment receipts with (NIP-57), or {@code null} when it advertises none.
 */
public record LnurlInvoice(String paymentRequest, String nostrPubkey) {
}
