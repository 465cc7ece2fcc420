package com.manning.macaroons;

public class MacaroonException extends RuntimeException {
    public MacaroonException(String message) {
        super(message);
    }

    public MacaroonException(String message, Throwable cause) {
        super(message, cause);
    }
}
