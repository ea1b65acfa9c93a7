package com.ctm.protocol;

/**
 * Inbound live-channel payload could not be decoded into a command envelope.
 */
public final class MalformedCommandException extends Exception {

    public MalformedCommandException(String message) {
        super(message);
    }

    public MalformedCommandException(String message, Throwable cause) {
        super(message, cause);
    }
}
