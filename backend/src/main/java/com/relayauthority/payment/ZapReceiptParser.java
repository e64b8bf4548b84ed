package com.relayauthority.payment;

import com.relayauthority.crypto.Bolt11Invoice;
import com.relayauthority.crypto.Sha256;
import com.relayauthority.event.EventCodec;
import com.relayauthority.event.EventKinds;
import com.relayauthority.event.MalformedEventException;
import com.relayauthority.event.NostrEvent;

import java.util.HexFormat;
import java.util.Optional;

/**
 * Reads alias purchases out of payment receipts (kind 9735). The embedded payment
 * request travels in the {@code description} tag.
 */
public final class ZapReceiptParser {

    private ZapReceiptParser() {
    }

    /**
     * @return empty when the receipt is not for an alias registration
     * @throws MalformedEventException when it is, but cannot be trusted or decoded
     */
    public static Optional<ZapReceipt> parse(NostrEvent receipt) {
        if (receipt.kind() != EventKinds.ZAP_RECEIPT) {
            return Optional.empty();
        }
        String description = receipt.firstTagValue("description")
                .orElseThrow(() -> new MalformedEventException("Receipt " + receipt.id() + " has no description"));
        NostrEvent zapRequest = EventCodec.parse(description);
        if (!ZapRequests.isRegistration(zapRequest)) {
            return Optional.empty();
        }
        String alias = ZapRequests.requireAlias(zapRequest);

        String paymentRequest = receipt.firstTagValue("bolt11")
                .orElseThrow(() -> new MalformedEventException("Receipt " + receipt.id() + " has no bolt11"));
        Bolt11Invoice invoice;
        try {
            invoice = Bolt11Invoice.decode(paymentRequest);
        } catch (IllegalArgumentException e) {
            throw new MalformedEventException("Receipt " + receipt.id() + " carries an undecodable bolt11", e);
        }
        if (invoice.descriptionHash() != null
                && !invoice.descriptionHash().equals(HexFormat.of().formatHex(Sha256.hash(description)))) {
            throw new MalformedEventException("Receipt " + receipt.id() + " description does not match its invoice");
        }
        Long requestedMsats = ZapRequests.amountMsats(zapRequest).orElse(null);
        if (invoice.amountMsats() != null && requestedMsats != null && !invoice.amountMsats().equals(requestedMsats)) {
            throw new MalformedEventException("Receipt " + receipt.id() + " invoice amount differs from the request");
        }
        String preimage = receipt.firstTagValue("preimage").orElse(null);
        return Optional.of(new ZapReceipt(receipt.id(), receipt.pubkey(), receipt.createdAt(), invoice, preimage,
                alias, zapRequest.pubkey(), requestedMsats));
    }
}
