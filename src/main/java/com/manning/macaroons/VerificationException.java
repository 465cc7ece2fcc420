package com.manning.macaroons;

public class VerificationException extends MacaroonException {
    public VerificationException(String message) {
        super(message);
    }

    public VerificationException(String message, Throwable cause) {
        super(message, cause);
    }
}
