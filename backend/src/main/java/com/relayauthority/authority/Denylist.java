package com.relayauthority.authority;

import com.relayauthority.event.NostrEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Banned identities, replaced wholesale by each denylist message.
 */
public class Denylist {

    private static final Logger log = LoggerFactory.getLogger(Denylist.class);

    private volatile Set<String> banned = Set.of();

    /**
     * Swaps in the identities named by {@code message}.
     *
     * @return identities banned by this message that were not banned before
     * @throws MalformedControlMessageException when the message cannot be parsed; the held set is untouched
     */
    public List<String> replace(NostrEvent message) {
        List<String> newlyBanned = replace(parse(message));
        log.debug("Applied denylist {}", message.id());
        return newlyBanned;
    }

    /** Swaps in {@code next} and returns the identities it adds. */
    public List<String> replace(Set<String> next) {
        Set<String> previous = banned;
        banned = Set.copyOf(next);
        List<String> newlyBanned = diff(previous, banned);
        log.info("Replaced denylist with {} identities ({} newly banned)", banned.size(), newlyBanned.size());
        return newlyBanned;
    }

    /**
     * @throws MalformedControlMessageException when an identity tag is invalid
     */
    public Set<String> parse(NostrEvent message) {
        try {
            return IdentityTags.parse(message);
        } catch (MalformedControlMessageException e) {
            log.warn("Keeping previous denylist: {}", e.getMessage());
            throw e;
        }
    }

    public static List<String> diff(Set<String> previous, Set<String> next) {
        return next.stream()
                .filter(identity -> !previous.contains(identity))
                .sorted()
                .toList();
    }

    public boolean contains(String identity) {
        return identity != null && banned.contains(identity.toLowerCase(Locale.ROOT));
    }

    public int size() {
        return banned.size();
    }
}
