package com.relayauthority.relay;

/**
 * A publish or fetch against a relay failed: connection refused, timeout,
 * subscription closed by the relay, or event rejected.
 */
public class TransportException extends RuntimeException {

    public TransportException(String message) {
        super(message);
    }

    public TransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
