package com.relayauthority.event;

/**
 * Event kinds and namespaces this service reads or writes.
 */
public final class EventKinds {

    public static final int DELETION = 5;
    public static final int ZAP_REQUEST = 9734;
    public static final int ZAP_RECEIPT = 9735;
    public static final int MUTE_LIST = 10000;
    public static final int NWC_REQUEST = 23194;
    public static final int NWC_RESPONSE = 23195;
    public static final int PEOPLE_LIST = 30000;
    public static final int APP_HANDLER = 31990;

    public static final String ADMINS_NAMESPACE = "admins";
    public static final String EDITORS_NAMESPACE = "editors";
    public static final String REGISTRY_NAMESPACE = "vanity-urls";

    /** Label tag value a payment request carries when it buys an alias. */
    public static final String VANITY_REGISTER_LABEL = "vanity-register";

    private EventKinds() {
    }
}
