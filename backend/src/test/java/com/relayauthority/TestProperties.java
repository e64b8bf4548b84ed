package com.relayauthority;

import com.relayauthority.config.AuthorityProperties;

import java.time.Duration;
import java.util.List;

/**
 * {@link AuthorityProperties} as the test profile binds them, for tests that run without Spring.
 */
public final class TestProperties {

    public static final String UPSTREAM = "http://market.test";

    private TestProperties() {
    }

    public static AuthorityProperties defaults() {
        return withAdmins(List.of());
    }

    public static AuthorityProperties withAdmins(List<String> initialAdmins) {
        return new AuthorityProperties(
                String.format("%064x", 3),
                UPSTREAM,
                "market.test",
                initialAdmins,
                new AuthorityProperties.Relay("ws://localhost:7777", List.of(), Duration.ofSeconds(1), Duration.ofSeconds(1)),
                new AuthorityProperties.Publish(3, Duration.ofMillis(1), Duration.ofMillis(5)),
                new AuthorityProperties.Registry(true, List.of(), Duration.ofHours(6), 10_000),
                new AuthorityProperties.Invoices(Duration.ofHours(1), Duration.ofMinutes(5)),
                new AuthorityProperties.Lightning(null),
                new AuthorityProperties.Wallet(null, Duration.ofSeconds(30), Duration.ofSeconds(30)),
                new AuthorityProperties.Startup(false));
    }
}
