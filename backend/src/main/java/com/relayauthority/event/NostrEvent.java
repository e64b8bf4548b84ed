package com.relayauthority.event;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * A signed, timestamped, typed record on the relay network (NIP-01).
 * Tags are immutable lists of strings whose first element is the tag name.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record NostrEvent(String id,
                         String pubkey,
                         @JsonProperty("created_at") long createdAt,
                         int kind,
                         List<List<String>> tags,
                         String content,
                         String sig) {

    public NostrEvent {
        tags = tags == null ? List.of() : tags.stream().map(List::copyOf).toList();
        content = content == null ? "" : content;
    }

    /** An unsigned event to be authored and signed by {@code NostrKeys#sign}. */
    public static NostrEvent template(int kind, long createdAt, List<List<String>> tags, String content) {
        return new NostrEvent(null, null, createdAt, kind, tags, content, null);
    }

    public List<List<String>> tagsNamed(String name) {
        List<List<String>> matches = new ArrayList<>();
        for (List<String> tag : tags) {
            if (!tag.isEmpty() && tag.get(0).equals(name)) {
                matches.add(tag);
            }
        }
        return matches;
    }

    public List<String> tagValues(String name) {
        List<String> values = new ArrayList<>();
        for (List<String> tag : tagsNamed(name)) {
            if (tag.size() > 1) {
                values.add(tag.get(1));
            }
        }
        return values;
    }

    public Optional<String> firstTagValue(String name) {
        return tagValues(name).stream().findFirst();
    }

    public boolean hasTag(String name, String value) {
        return tagValues(name).contains(value);
    }

    /** The {@code d} tag of an addressable event. */
    public Optional<String> namespace() {
        return firstTagValue("d");
    }
}
