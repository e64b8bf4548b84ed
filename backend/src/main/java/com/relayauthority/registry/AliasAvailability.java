package com.relayauthority.registry;

public record AliasAvailability(String alias, boolean available, boolean valid, boolean reserved) {
}
