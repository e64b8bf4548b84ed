package com.relayauthority.registry;

import com.relayauthority.config.AuthorityProperties;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * The fixed price list, ordered by amount. Development-only tiers are offered only
 * by non-production deployments.
 */
public class PricingTable {

    private final List<PricingTier> tiers;

    public PricingTable(List<AuthorityProperties.Tier> configured, boolean production) {
        this.tiers = configured.stream()
                .filter(tier -> !production || !tier.developmentOnly())
                .map(tier -> new PricingTier(tier.amountSats(), tier.duration().toSeconds(), tier.label()))
                .sorted(Comparator.comparingLong(PricingTier::amountSats))
                .toList();
    }

    public List<PricingTier> tiers() {
        return tiers;
    }

    /** The most expensive tier whose price {@code paidSats} meets. */
    public Optional<PricingTier> tierFor(long paidSats) {
        PricingTier match = null;
        for (PricingTier tier : tiers) {
            if (paidSats >= tier.amountSats()) {
                match = tier;
            }
        }
        return Optional.ofNullable(match);
    }
}
