package com.relayauthority.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.List;

/**
 * Settings of the authority service, bound from {@code authority.*}.
 * A missing key, relay or upstream fails startup.
 */
@Validated
@ConfigurationProperties(prefix = "authority")
public record AuthorityProperties(
        @NotBlank String privateKey,
        @NotBlank String upstreamUrl,
        @DefaultValue("localhost") String domain,
        List<String> initialAdmins,
        @Valid @NotNull Relay relay,
        @Valid @DefaultValue Publish publish,
        @Valid @DefaultValue Registry registry,
        @Valid @DefaultValue Invoices invoices,
        @DefaultValue Lightning lightning,
        @Valid @DefaultValue Wallet wallet,
        @DefaultValue Startup startup) {

    public AuthorityProperties {
        initialAdmins = initialAdmins == null ? List.of() : List.copyOf(initialAdmins);
    }

    public record Relay(@NotBlank String url,
                        List<String> receiptRelays,
                        @DefaultValue("PT10S") Duration fetchTimeout,
                        @DefaultValue("PT10S") Duration publishTimeout) {

        public Relay {
            receiptRelays = receiptRelays == null ? List.of() : List.copyOf(receiptRelays);
        }
    }

    public record Publish(@DefaultValue("10") @Min(1) int maxAttempts,
                          @DefaultValue("PT1S") Duration minBackoff,
                          @DefaultValue("PT1M") Duration maxBackoff) {
    }

    public record Registry(@DefaultValue("true") boolean production,
                           List<@Valid Tier> tiers,
                           @DefaultValue("PT6H") Duration settlementWindow,
                           @DefaultValue("10000") @Positive int settlementCapacity) {

        public Registry {
            tiers = tiers == null || tiers.isEmpty() ? defaultTiers() : List.copyOf(tiers);
        }

        public static List<Tier> defaultTiers() {
            return List.of(
                    new Tier("dev", 10, Duration.ofSeconds(90), true),
                    new Tier("6 months", 10_000, Duration.ofDays(180), false),
                    new Tier("1 year", 18_000, Duration.ofDays(365), false));
        }
    }

    public record Tier(@NotBlank String label,
                       @Positive long amountSats,
                       @NotNull Duration duration,
                       boolean developmentOnly) {
    }

    public record Invoices(@DefaultValue("PT1H") Duration pendingHorizon,
                           @DefaultValue("PT5M") Duration sweepInterval) {
    }

    /** Lightning address (lud16) invoices are requested from; issuance is off without it. */
    public record Lightning(String address) {
    }

    /** {@code nostr+walletconnect://} URI of the authority's wallet; polling is off without it. */
    public record Wallet(String nwcUri,
                         @DefaultValue("PT30S") Duration pollInterval,
                         @DefaultValue("PT30S") Duration requestTimeout) {
    }

    public record Startup(@DefaultValue("true") boolean enabled) {
    }
}
