package com.relayauthority.registry;

public record PricingTier(long amountSats, long durationSeconds, String label) {
}
