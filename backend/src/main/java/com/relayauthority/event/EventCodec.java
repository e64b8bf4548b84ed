package com.relayauthority.event;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.relayauthority.crypto.NostrIds;
import com.relayauthority.crypto.Schnorr;
import com.relayauthority.crypto.Sha256;

import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;
import java.util.Locale;

/**
 * JSON form of events: strict parsing, the canonical id serialization and
 * signature verification.
 */
public final class EventCodec {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private EventCodec() {
    }

    /** Lowercase hex SHA-256 of {@code [0,pubkey,created_at,kind,tags,content]}. */
    public static String computeId(NostrEvent event) {
        ArrayNode canonical = MAPPER.createArrayNode();
        canonical.add(0);
        canonical.add(event.pubkey());
        canonical.add(event.createdAt());
        canonical.add(event.kind());
        canonical.add(tagsNode(event.tags()));
        canonical.add(event.content());
        return HexFormat.of().formatHex(Sha256.hash(write(canonical)));
    }

    public static boolean hasValidId(NostrEvent event) {
        return event.id() != null && event.id().toLowerCase(Locale.ROOT).equals(computeId(event));
    }

    public static boolean hasValidSignature(NostrEvent event) {
        if (!NostrIds.isHex64(event.id()) || !NostrIds.isHex64(event.pubkey()) || !NostrIds.isHex128(event.sig())) {
            return false;
        }
        HexFormat hex = HexFormat.of();
        return Schnorr.verify(hex.parseHex(event.id()), hex.parseHex(event.pubkey()), hex.parseHex(event.sig()));
    }

    /** Id matches content and the signature verifies against the declared author. */
    public static boolean verify(NostrEvent event) {
        return hasValidId(event) && hasValidSignature(event);
    }

    public static ObjectNode toNode(NostrEvent event) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("id", event.id());
        node.put("pubkey", event.pubkey());
        node.put("created_at", event.createdAt());
        node.put("kind", event.kind());
        node.set("tags", tagsNode(event.tags()));
        node.put("content", event.content());
        node.put("sig", event.sig());
        return node;
    }

    public static String toJson(NostrEvent event) {
        return write(toNode(event));
    }

    public static NostrEvent parse(String json) {
        try {
            return fromNode(MAPPER.readTree(json));
        } catch (JsonProcessingException e) {
            throw new MalformedEventException("Event is not valid JSON", e);
        }
    }

    /** Parses an event object, checking the shape of every field. */
    public static NostrEvent fromNode(JsonNode node) {
        if (node == null || !node.isObject()) {
            throw new MalformedEventException("Event must be a JSON object");
        }
        String id = text(node, "id");
        String pubkey = text(node, "pubkey");
        String sig = text(node, "sig");
        String content = text(node, "content");
        if (!NostrIds.isHex64(id) || !NostrIds.isHex64(pubkey) || !NostrIds.isHex128(sig)) {
            throw new MalformedEventException("Event id, pubkey or sig is not hex of the right length");
        }
        JsonNode createdAt = node.get("created_at");
        JsonNode kind = node.get("kind");
        if (createdAt == null || !createdAt.canConvertToLong() || !createdAt.isIntegralNumber()) {
            throw new MalformedEventException("Event created_at must be an integer");
        }
        if (kind == null || !kind.isInt() || kind.intValue() < 0 || kind.intValue() > 65535) {
            throw new MalformedEventException("Event kind must be an integer between 0 and 65535");
        }
        JsonNode tagsNode = node.get("tags");
        if (tagsNode == null || !tagsNode.isArray()) {
            throw new MalformedEventException("Event tags must be an array");
        }
        List<List<String>> tags = new ArrayList<>();
        for (JsonNode tagNode : tagsNode) {
            if (!tagNode.isArray()) {
                throw new MalformedEventException("Event tag must be an array");
            }
            List<String> tag = new ArrayList<>();
            for (JsonNode value : tagNode) {
                if (!value.isTextual()) {
                    throw new MalformedEventException("Event tag values must be strings");
                }
                tag.add(value.textValue());
            }
            tags.add(tag);
        }
        return new NostrEvent(id.toLowerCase(Locale.ROOT), pubkey.toLowerCase(Locale.ROOT), createdAt.longValue(),
                kind.intValue(), tags, content, sig.toLowerCase(Locale.ROOT));
    }

    static ArrayNode tagsNode(List<List<String>> tags) {
        ArrayNode array = MAPPER.createArrayNode();
        for (List<String> tag : tags) {
            ArrayNode tagNode = array.addArray();
            tag.forEach(tagNode::add);
        }
        return array;
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || !value.isTextual()) {
            throw new MalformedEventException("Event field '" + field + "' must be a string");
        }
        return value.textValue();
    }

    private static String write(JsonNode node) {
        try {
            return MAPPER.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize event JSON", e);
        }
    }
}
