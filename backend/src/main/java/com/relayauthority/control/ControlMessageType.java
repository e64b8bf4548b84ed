package com.relayauthority.control;

import com.relayauthority.event.EventKinds;
import com.relayauthority.event.NostrEvent;

/**
 * The control-message families, told apart by kind and namespace.
 */
public enum ControlMessageType {
    SETUP,
    ADMIN_LIST,
    EDITOR_LIST,
    DENYLIST,
    REGISTRY,
    GENERAL;

    public static ControlMessageType of(NostrEvent message) {
        if (message.kind() == EventKinds.APP_HANDLER) {
            return SETUP;
        }
        if (message.kind() == EventKinds.MUTE_LIST) {
            return DENYLIST;
        }
        if (message.kind() == EventKinds.PEOPLE_LIST) {
            String namespace = message.namespace().orElse("");
            switch (namespace) {
                case EventKinds.ADMINS_NAMESPACE:
                    return ADMIN_LIST;
                case EventKinds.EDITORS_NAMESPACE:
                    return EDITOR_LIST;
                case EventKinds.REGISTRY_NAMESPACE:
                    return REGISTRY;
                default:
                    return GENERAL;
            }
        }
        return GENERAL;
    }

    /** Families whose messages are full snapshots, latest timestamp wins. */
    public boolean isSnapshot() {
        return this != GENERAL;
    }
}
