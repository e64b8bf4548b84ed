package com.relayauthority.registry;

public enum Rejection {
    INVALID_ALIAS("alias does not match the allowed syntax"),
    RESERVED_ALIAS("alias is reserved"),
    ALIAS_TAKEN("alias is owned by another identity"),
    INSUFFICIENT_AMOUNT("amount is below every pricing tier"),
    DUPLICATE_SETTLEMENT("payment was already applied");

    private final String description;

    Rejection(String description) {
        this.description = description;
    }

    public String description() {
        return description;
    }
}
