package com.relayauthority.authority;

/**
 * A control message whose tags or content cannot be turned into state.
 */
public class MalformedControlMessageException extends RuntimeException {

    public MalformedControlMessageException(String message) {
        super(message);
    }
}
