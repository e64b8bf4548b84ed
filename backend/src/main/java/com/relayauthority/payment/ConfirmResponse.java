package com.relayauthority.payment;

public record ConfirmResponse(String alias, long validUntil) {
}
