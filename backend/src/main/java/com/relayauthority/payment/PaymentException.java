package com.relayauthority.payment;

import com.relayauthority.registry.Rejection;

/**
 * A caller-visible failure of invoice issuance or preimage confirmation.
 */
public class PaymentException extends RuntimeException {

    public enum Reason {
        BAD_REQUEST,
        ALIAS_UNAVAILABLE,
        INSUFFICIENT_AMOUNT,
        UNKNOWN_INVOICE,
        ALREADY_CONFIRMED,
        INVALID_PREIMAGE,
        ISSUANCE_UNAVAILABLE,
        UPSTREAM_FAILURE
    }

    private final Reason reason;

    public PaymentException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public PaymentException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    static PaymentException from(Rejection rejection) {
        switch (rejection) {
            case DUPLICATE_SETTLEMENT:
                return new PaymentException(Reason.ALREADY_CONFIRMED, rejection.description());
            case INSUFFICIENT_AMOUNT:
                return new PaymentException(Reason.INSUFFICIENT_AMOUNT, rejection.description());
            case INVALID_ALIAS:
                return new PaymentException(Reason.BAD_REQUEST, rejection.description());
            default:
                return new PaymentException(Reason.ALIAS_UNAVAILABLE, rejection.description());
        }
    }

    public Reason reason() {
        return reason;
    }
}
