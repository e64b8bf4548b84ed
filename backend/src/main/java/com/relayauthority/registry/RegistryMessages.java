package com.relayauthority.registry;

import com.relayauthority.authority.MalformedControlMessageException;
import com.relayauthority.crypto.NostrIds;
import com.relayauthority.event.EventKinds;
import com.relayauthority.event.NostrEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;

/**
 * Registry message codec: kind 30000, {@code ["d","vanity-urls"]}, one
 * {@code ["vanity", alias, owner, validUntil]} tag per record.
 */
public final class RegistryMessages {

    private static final Logger log = LoggerFactory.getLogger(RegistryMessages.class);

    private RegistryMessages() {
    }

    public static boolean isRegistryMessage(NostrEvent event) {
        return event.kind() == EventKinds.PEOPLE_LIST
                && event.namespace().filter(EventKinds.REGISTRY_NAMESPACE::equals).isPresent();
    }

    /**
     * Reads the records of a registry message. Individual records that do not parse are skipped.
     *
     * @throws MalformedControlMessageException when the event is not a registry message at all
     */
    public static List<AliasRecord> parse(NostrEvent event) {
        if (!isRegistryMessage(event)) {
            throw new MalformedControlMessageException("Not a registry message: " + event.id());
        }
        List<AliasRecord> records = new ArrayList<>();
        for (List<String> tag : event.tagsNamed("vanity")) {
            if (tag.size() < 4) {
                log.debug("Skipping short registry record {}", tag);
                continue;
            }
            String alias = AliasRules.normalize(tag.get(1));
            String owner = tag.get(2);
            if (!AliasRules.isValid(alias) || !NostrIds.isHex64(owner)) {
                log.debug("Skipping invalid registry record {}", tag);
                continue;
            }
            long validUntil;
            try {
                validUntil = Long.parseLong(tag.get(3));
            } catch (NumberFormatException e) {
                log.debug("Skipping registry record with bad expiry {}", tag);
                continue;
            }
            records.add(new AliasRecord(alias, owner.toLowerCase(Locale.ROOT), validUntil));
        }
        return records;
    }

    /** Unsigned registry message listing {@code records}. */
    public static NostrEvent template(Collection<AliasRecord> records, long createdAt) {
        List<List<String>> tags = new ArrayList<>();
        tags.add(List.of("d", EventKinds.REGISTRY_NAMESPACE));
        for (AliasRecord record : records) {
            tags.add(List.of("vanity", record.alias(), record.owner(), Long.toString(record.validUntil())));
        }
        return NostrEvent.template(EventKinds.PEOPLE_LIST, createdAt, tags, "");
    }
}
