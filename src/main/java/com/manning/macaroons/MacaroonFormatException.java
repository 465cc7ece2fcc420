package com.manning.macaroons;

/**
 * Raised when a macaroon cannot be encoded or decoded: a field exceeds the
 * packet size limit, a packet is truncated, or a packet carries the wrong
 * field tag.
 */
public class MacaroonFormatException extends MacaroonException {
    public MacaroonFormatException(String message) {
        super(message);
    }

    public MacaroonFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
