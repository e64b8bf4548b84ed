package com.relayauthority.registry;

public record PurchaseOutcome(AliasRecord record, Rejection rejection) {

    public static PurchaseOutcome accepted(AliasRecord record) {
        return new PurchaseOutcome(record, null);
    }

    public static PurchaseOutcome rejected(Rejection rejection) {
        return new PurchaseOutcome(null, rejection);
    }

    public boolean isAccepted() {
        return rejection == null;
    }
}
