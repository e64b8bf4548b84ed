package com.relayauthority.authority;

import com.relayauthority.event.NostrEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * An authorization list (admins or editors) rebuilt wholesale from the latest
 * list message. Readers see an immutable set that is swapped atomically.
 */
public class IdentityList {

    private static final Logger log = LoggerFactory.getLogger(IdentityList.class);

    private final String name;
    private final boolean requireMembers;
    private volatile Set<String> members;

    public IdentityList(String name, Collection<String> initial, boolean requireMembers) {
        this.name = name;
        this.requireMembers = requireMembers;
        this.members = normalize(initial);
    }

    /**
     * Parses {@code message} and replaces the membership.
     *
     * @throws MalformedControlMessageException when the message cannot be parsed; the held set is untouched
     */
    public Set<String> replace(NostrEvent message) {
        Set<String> parsed = parse(message);
        members = parsed;
        log.info("Replaced {} list with {} identities from {}", name, parsed.size(), message.id());
        return parsed;
    }

    /**
     * Reads the membership a list message declares, without applying it.
     *
     * @throws MalformedControlMessageException when an identity tag is invalid or a required list is empty
     */
    public Set<String> parse(NostrEvent message) {
        try {
            Set<String> parsed = IdentityTags.parse(message);
            if (requireMembers && parsed.isEmpty()) {
                throw new MalformedControlMessageException("The " + name + " list must name at least one identity");
            }
            return parsed;
        } catch (MalformedControlMessageException e) {
            log.warn("Keeping previous {} list: {}", name, e.getMessage());
            throw e;
        }
    }

    public void replace(Collection<String> identities) {
        members = normalize(identities);
        log.info("Replaced {} list with {} identities", name, members.size());
    }

    public boolean contains(String identity) {
        return identity != null && members.contains(identity.toLowerCase(Locale.ROOT));
    }

    public Set<String> members() {
        return members;
    }

    public int size() {
        return members.size();
    }

    public String name() {
        return name;
    }

    private static Set<String> normalize(Collection<String> identities) {
        return identities.stream()
                .map(identity -> identity.toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
    }
}
