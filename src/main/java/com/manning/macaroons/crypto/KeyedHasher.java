package com.manning.macaroons.crypto;

import java.nio.ByteBuffer;

import javax.crypto.Mac;

/**
 * Incremental form of {@link KeyedHash#hash}. Not thread safe; use one
 * instance per chaining step.
 */
public final class KeyedHasher {
    private final Mac mac;

    KeyedHasher(Mac mac) {
        this.mac = mac;
    }

    public KeyedHasher update(byte[] chunk) {
        mac.update(chunk);
        return this;
    }

    public KeyedHasher update(ByteBuffer chunk) {
        mac.update(chunk);
        return this;
    }

    public byte[] sum() {
        return mac.doFinal();
    }
}
