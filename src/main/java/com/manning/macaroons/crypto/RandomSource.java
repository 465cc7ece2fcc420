package com.manning.macaroons.crypto;

import java.io.IOException;

/**
 * Supplies the nonces used when sealing third-party caveat keys.
 */
@FunctionalInterface
public interface RandomSource {
    void nextBytes(byte[] bytes) throws IOException;

    /**
     * Returns the shared source backed by a single {@link java.security.SecureRandom}.
     */
    static RandomSource secure() {
        return SecureRandomSource.INSTANCE;
    }
}
