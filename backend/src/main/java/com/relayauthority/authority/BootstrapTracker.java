package com.relayauthority.authority;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.relayauthority.crypto.NostrIds;
import com.relayauthority.event.NostrEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.function.Predicate;

/**
 * Single-shot {@code AWAITING_SETUP -> CONFIGURED} state machine.
 *
 * The first accepted setup message configures the instance and names its owner.
 * Once configured, a setup message is a settings update and is only accepted from
 * the owner. An instance configured from initial admins alone has no known owner
 * and accepts settings updates from its admins until a setup names one.
 */
public class BootstrapTracker {

    private static final Logger log = LoggerFactory.getLogger(BootstrapTracker.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    public enum State { AWAITING_SETUP, CONFIGURED }

    public enum Outcome { BOOTSTRAP, SETTINGS_UPDATE, REJECTED }

    public record Decision(Outcome outcome, String owner, String reason) {

        static Decision rejected(String reason) {
            return new Decision(Outcome.REJECTED, null, reason);
        }
    }

    private volatile State state;
    private volatile String owner;

    public BootstrapTracker(boolean preconfigured) {
        this.state = preconfigured ? State.CONFIGURED : State.AWAITING_SETUP;
    }

    /**
     * Decides what a setup message from its sender would do, without changing state.
     *
     * @throws MalformedControlMessageException when the content is not a settings object
     */
    public Decision evaluate(NostrEvent setup, Predicate<String> isAdmin) {
        String declaredOwner = declaredOwner(setup).orElse(setup.pubkey());
        if (state == State.AWAITING_SETUP) {
            return new Decision(Outcome.BOOTSTRAP, declaredOwner, null);
        }
        String currentOwner = owner;
        if (currentOwner != null) {
            return currentOwner.equals(setup.pubkey())
                    ? new Decision(Outcome.SETTINGS_UPDATE, currentOwner, null)
                    : Decision.rejected("setup already completed by another owner");
        }
        return isAdmin.test(setup.pubkey())
                ? new Decision(Outcome.SETTINGS_UPDATE, declaredOwner(setup).orElse(null), null)
                : Decision.rejected("setup already completed");
    }

    public void apply(Decision decision) {
        switch (decision.outcome()) {
            case BOOTSTRAP:
                owner = decision.owner();
                state = State.CONFIGURED;
                log.info("Instance configured; owner {} is the first admin", owner);
                break;
            case SETTINGS_UPDATE:
                if (owner == null && decision.owner() != null) {
                    owner = decision.owner();
                }
                log.info("Settings updated by owner {}", owner);
                break;
            default:
                break;
        }
    }

    /** Restores configuration from the setup snapshot found at startup. */
    public void restore(NostrEvent setup) {
        owner = declaredOwner(setup).orElse(owner);
        state = State.CONFIGURED;
        log.info("Restored configured state; owner {}", owner);
    }

    public State state() {
        return state;
    }

    public Optional<String> owner() {
        return Optional.ofNullable(owner);
    }

    /**
     * The {@code ownerPk} of a settings object, as hex.
     *
     * @throws MalformedControlMessageException when the content is not a JSON object with a name
     */
    static Optional<String> declaredOwner(NostrEvent setup) {
        JsonNode settings;
        try {
            settings = MAPPER.readTree(setup.content());
        } catch (JsonProcessingException e) {
            throw new MalformedControlMessageException("Setup content is not JSON");
        }
        if (settings == null || !settings.isObject() || !settings.path("name").isTextual()) {
            throw new MalformedControlMessageException("Setup content must be an object with a name");
        }
        JsonNode ownerPk = settings.get("ownerPk");
        if (ownerPk == null || !ownerPk.isTextual() || ownerPk.textValue().isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(NostrIds.toHex(ownerPk.textValue()));
        } catch (IllegalArgumentException e) {
            throw new MalformedControlMessageException("Setup ownerPk is not a public key: " + ownerPk.textValue());
        }
    }
}
