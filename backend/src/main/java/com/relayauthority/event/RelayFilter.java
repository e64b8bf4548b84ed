package com.relayauthority.event;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A NIP-01 subscription filter. Built immutably: {@code RelayFilter.forKinds(30000).withAuthors(pk).withTag("d", "admins")}.
 */
public record RelayFilter(List<Integer> kinds,
                          List<String> authors,
                          Map<String, List<String>> tags,
                          Long since,
                          Integer limit) {

    public RelayFilter {
        kinds = kinds == null ? List.of() : List.copyOf(kinds);
        authors = authors == null ? List.of() : List.copyOf(authors);
        tags = tags == null ? Map.of() : Map.copyOf(tags);
    }

    public static RelayFilter forKinds(Integer... kinds) {
        return new RelayFilter(List.of(kinds), null, null, null, null);
    }

    public RelayFilter withAuthors(String... authors) {
        return new RelayFilter(kinds, List.of(authors), tags, since, limit);
    }

    public RelayFilter withTag(String name, String... values) {
        Map<String, List<String>> next = new LinkedHashMap<>(tags);
        next.put(name, List.of(values));
        return new RelayFilter(kinds, authors, next, since, limit);
    }

    public RelayFilter withSince(long since) {
        return new RelayFilter(kinds, authors, tags, since, limit);
    }

    public RelayFilter withLimit(int limit) {
        return new RelayFilter(kinds, authors, tags, since, limit);
    }

    public ObjectNode toNode() {
        ObjectNode node = JsonNodeFactory.instance.objectNode();
        if (!kinds.isEmpty()) {
            ArrayNode array = node.putArray("kinds");
            kinds.forEach(array::add);
        }
        if (!authors.isEmpty()) {
            ArrayNode array = node.putArray("authors");
            authors.forEach(array::add);
        }
        tags.forEach((name, values) -> {
            ArrayNode array = node.putArray("#" + name);
            values.forEach(array::add);
        });
        if (since != null) {
            node.put("since", since);
        }
        if (limit != null) {
            node.put("limit", limit);
        }
        return node;
    }
}
