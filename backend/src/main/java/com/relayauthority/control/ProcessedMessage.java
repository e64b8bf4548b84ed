package com.relayauthority.control;

import com.relayauthority.event.NostrEvent;

/**
 * Result of running one inbound message through the orchestrator.
 * {@code signed} is set when forwarded, {@code reason} when rejected.
 */
public record ProcessedMessage(State state, ControlMessageType type, NostrEvent original, NostrEvent signed,
                               String reason) {

    public enum State { REJECTED, SIGNED_AND_FORWARDED }

    static ProcessedMessage rejected(ControlMessageType type, NostrEvent original, String reason) {
        return new ProcessedMessage(State.REJECTED, type, original, null, reason);
    }

    static ProcessedMessage forwarded(ControlMessageType type, NostrEvent original, NostrEvent signed) {
        return new ProcessedMessage(State.SIGNED_AND_FORWARDED, type, original, signed, null);
    }

    public boolean isAccepted() {
        return state == State.SIGNED_AND_FORWARDED;
    }
}
