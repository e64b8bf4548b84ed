package com.relayauthority.payment;

import com.relayauthority.event.EventCodec;
import com.relayauthority.event.EventKinds;
import com.relayauthority.event.MalformedEventException;
import com.relayauthority.event.NostrEvent;
import com.relayauthority.registry.AliasRules;

import java.util.Optional;

/**
 * Checks on the signed payment request (NIP-57 zap request) that names the alias a
 * payment buys.
 */
final class ZapRequests {

    private ZapRequests() {
    }

    static boolean isRegistration(NostrEvent zapRequest) {
        return zapRequest.kind() == EventKinds.ZAP_REQUEST
                && zapRequest.hasTag("L", EventKinds.VANITY_REGISTER_LABEL);
    }

    /**
     * @throws MalformedEventException when the request is not a valid signed registration request
     */
    static String requireAlias(NostrEvent zapRequest) {
        if (!isRegistration(zapRequest)) {
            throw new MalformedEventException("Payment request is not an alias registration");
        }
        if (!EventCodec.verify(zapRequest)) {
            throw new MalformedEventException("Payment request signature is invalid");
        }
        return zapRequest.firstTagValue("vanity")
                .map(AliasRules::normalize)
                .filter(value -> !value.isEmpty())
                .orElseThrow(() -> new MalformedEventException("Payment request names no alias"));
    }

    static Optional<Long> amountMsats(NostrEvent zapRequest) {
        Optional<String> amount = zapRequest.firstTagValue("amount");
        if (amount.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(Long.parseLong(amount.get()));
        } catch (NumberFormatException e) {
            throw new MalformedEventException("Payment request amount is not a number: " + amount.get());
        }
    }

    /**
     * Full check of a request a client hands in for invoice issuance.
     *
     * @throws MalformedEventException naming the first check that failed
     */
    static String validateForIssuance(NostrEvent zapRequest, String alias, long amountSats, String authority) {
        String requested = requireAlias(zapRequest);
        if (!requested.equals(AliasRules.normalize(alias))) {
            throw new MalformedEventException("Payment request names alias '" + requested + "', not '" + alias + "'");
        }
        long expectedMsats = amountSats * 1000;
        if (!amountMsats(zapRequest).map(msats -> msats == expectedMsats).orElse(false)) {
            throw new MalformedEventException("Payment request amount does not match " + expectedMsats + " msats");
        }
        if (!zapRequest.hasTag("p", authority)) {
            throw new MalformedEventException("Payment request is not addressed to this authority");
        }
        return requested;
    }
}
