package com.manning.macaroons.crypto;

import java.security.SecureRandom;

/**
 * Process-wide {@link RandomSource} over one {@link SecureRandom}, which is
 * safe for concurrent use.
 */
final class SecureRandomSource implements RandomSource {
    static final SecureRandomSource INSTANCE = new SecureRandomSource();

    private final SecureRandom random = new SecureRandom();

    private SecureRandomSource() {
    }

    @Override
    public void nextBytes(byte[] bytes) {
        random.nextBytes(bytes);
    }
}
