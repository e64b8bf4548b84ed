package com.relayauthority.authority;

import com.relayauthority.crypto.NostrIds;
import com.relayauthority.event.NostrEvent;

import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;

final class IdentityTags {

    private IdentityTags() {
    }

    /**
     * Reads every {@code p} tag of {@code message} into a fresh set.
     * One bad value rejects the whole message.
     */
    static Set<String> parse(NostrEvent message) {
        Set<String> identities = new LinkedHashSet<>();
        for (var tag : message.tagsNamed("p")) {
            if (tag.size() < 2 || !NostrIds.isHex64(tag.get(1))) {
                throw new MalformedControlMessageException("Invalid identity tag " + tag + " in " + message.id());
            }
            identities.add(tag.get(1).toLowerCase(Locale.ROOT));
        }
        return Set.copyOf(identities);
    }
}
