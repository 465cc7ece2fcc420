package com.manning.macaroons.crypto;

import java.security.GeneralSecurityException;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;

/**
 * HMAC-SHA-256, the keyed hash every macaroon signature is chained with.
 */
public final class KeyedHash {
    public static final String ALGORITHM = "HmacSHA256";
    public static final int LENGTH = 32;

    private KeyedHash() {
    }

    public static byte[] hash(byte[] key, byte[] message) {
        var mac = newMac(key);
        return mac.doFinal(message);
    }

    /**
     * Hashes {@code first} followed by {@code second} under one key without
     * concatenating them.
     */
    public static byte[] hash2(byte[] key, byte[] first, byte[] second) {
        return hasher(key).update(first).update(second).sum();
    }

    public static KeyedHasher hasher(byte[] key) {
        return new KeyedHasher(newMac(key));
    }

    static Mac newMac(byte[] key) {
        // SecretKeySpec rejects empty keys. HMAC zero-pads keys to the block
        // size, so a single zero byte is the same key.
        var keyBytes = key.length == 0 ? new byte[1] : key;
        try {
            var mac = Mac.getInstance(ALGORITHM);
            mac.init(new SecretKeySpec(keyBytes, ALGORITHM));
            return mac;
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException(e);
        }
    }
}
