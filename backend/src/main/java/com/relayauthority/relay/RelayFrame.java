package com.relayauthority.relay;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.relayauthority.event.EventCodec;
import com.relayauthority.event.MalformedEventException;
import com.relayauthority.event.NostrEvent;
import com.relayauthority.event.RelayFilter;

/**
 * One NIP-01 protocol message, in either direction.
 *
 * <ul>
 *   <li>{@code ["EVENT", ev]} from a client, {@code ["EVENT", subId, ev]} from a relay</li>
 *   <li>{@code ["REQ", subId, filter...]}, {@code ["CLOSE", subId]}</li>
 *   <li>{@code ["EOSE", subId]}, {@code ["OK", id, accepted, message]}, {@code ["NOTICE", message]},
 *       {@code ["CLOSED", subId, message]}</li>
 * </ul>
 */
public record RelayFrame(Type type,
                         String subscriptionId,
                         NostrEvent event,
                         String eventId,
                         boolean accepted,
                         String message) {

    public enum Type { EVENT, REQ, CLOSE, EOSE, OK, NOTICE, CLOSED }

    private static final ObjectMapper MAPPER = new ObjectMapper();

    /**
     * @throws MalformedEventException when the text is not a known frame or its event is malformed
     */
    public static RelayFrame parse(String text) {
        JsonNode root;
        try {
            root = MAPPER.readTree(text);
        } catch (JsonProcessingException e) {
            throw new MalformedEventException("Frame is not valid JSON", e);
        }
        if (root == null || !root.isArray() || root.isEmpty() || !root.get(0).isTextual()) {
            throw new MalformedEventException("Frame must be a JSON array starting with a label");
        }
        String label = root.get(0).textValue();
        switch (label) {
            case "EVENT":
                if (root.size() == 2) {
                    return new RelayFrame(Type.EVENT, null, EventCodec.fromNode(root.get(1)), null, false, null);
                }
                if (root.size() == 3) {
                    return new RelayFrame(Type.EVENT, text(root, 1), EventCodec.fromNode(root.get(2)), null, false, null);
                }
                throw new MalformedEventException("EVENT frame has " + root.size() + " elements");
            case "REQ":
                return new RelayFrame(Type.REQ, text(root, 1), null, null, false, null);
            case "CLOSE":
                return new RelayFrame(Type.CLOSE, text(root, 1), null, null, false, null);
            case "EOSE":
                return new RelayFrame(Type.EOSE, text(root, 1), null, null, false, null);
            case "OK":
                if (root.size() < 3 || !root.get(2).isBoolean()) {
                    throw new MalformedEventException("OK frame must carry an id and a boolean");
                }
                return new RelayFrame(Type.OK, null, null, text(root, 1), root.get(2).booleanValue(),
                        root.size() > 3 ? root.get(3).asText("") : "");
            case "NOTICE":
                return new RelayFrame(Type.NOTICE, null, null, null, false, root.size() > 1 ? root.get(1).asText("") : "");
            case "CLOSED":
                return new RelayFrame(Type.CLOSED, text(root, 1), null, null, false,
                        root.size() > 2 ? root.get(2).asText("") : "");
            default:
                throw new MalformedEventException("Unknown frame label: " + label);
        }
    }

    public static String eventMessage(NostrEvent event) {
        ArrayNode frame = MAPPER.createArrayNode();
        frame.add("EVENT");
        frame.add(EventCodec.toNode(event));
        return write(frame);
    }

    public static String reqMessage(String subscriptionId, RelayFilter filter) {
        ArrayNode frame = MAPPER.createArrayNode();
        frame.add("REQ");
        frame.add(subscriptionId);
        frame.add(filter.toNode());
        return write(frame);
    }

    public static String okMessage(String eventId, boolean accepted, String message) {
        ArrayNode frame = MAPPER.createArrayNode();
        frame.add("OK");
        frame.add(eventId);
        frame.add(accepted);
        frame.add(message == null ? "" : message);
        return write(frame);
    }

    public static String noticeMessage(String message) {
        ArrayNode frame = MAPPER.createArrayNode();
        frame.add("NOTICE");
        frame.add(message);
        return write(frame);
    }

    private static String text(JsonNode root, int index) {
        if (root.size() <= index || !root.get(index).isTextual()) {
            throw new MalformedEventException("Frame element " + index + " must be a string");
        }
        return root.get(index).textValue();
    }

    private static String write(ArrayNode frame) {
        try {
            return MAPPER.writeValueAsString(frame);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize relay frame", e);
        }
    }
}
