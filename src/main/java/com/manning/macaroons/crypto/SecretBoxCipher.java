package com.manning.macaroons.crypto;

import java.security.Key;
import java.util.Arrays;

import software.pando.crypto.nacl.SecretBox;

import com.manning.macaroons.VerificationException;

/**
 * NaCl secretbox (XSalsa20-Poly1305) sealing of discharge root keys. A
 * sealed box is laid out as {@code nonce || ciphertext || tag} with a 24
 * byte nonce and a 16 byte tag.
 */
public final class SecretBoxCipher {
    public static final int NONCE_LENGTH = 24;
    public static final int TAG_LENGTH = 16;
    public static final int KEY_LENGTH = 32;

    private SecretBoxCipher() {
    }

    public static int sealedLength(int plaintextLength) {
        return NONCE_LENGTH + plaintextLength + TAG_LENGTH;
    }

    public static byte[] seal(byte[] key, byte[] nonce, byte[] plaintext) {
        if (nonce.length != NONCE_LENGTH) {
            throw new IllegalArgumentException("nonce must be " + NONCE_LENGTH + " bytes");
        }
        var box = SecretBox.encrypt(secretKey(key), nonce, plaintext);
        var ciphertext = box.getCiphertextWithTag();
        var sealed = Arrays.copyOf(box.getNonce(), NONCE_LENGTH + ciphertext.length);
        System.arraycopy(ciphertext, 0, sealed, NONCE_LENGTH, ciphertext.length);
        return sealed;
    }

    public static byte[] open(byte[] key, byte[] sealed) {
        if (sealed.length < NONCE_LENGTH + TAG_LENGTH) {
            throw new VerificationException("cannot decrypt caveat verification id");
        }
        var nonce = Arrays.copyOf(sealed, NONCE_LENGTH);
        var ciphertext = Arrays.copyOfRange(sealed, NONCE_LENGTH, sealed.length);
        var secretKey = secretKey(key);
        try {
            return SecretBox.fromCombined(nonce, ciphertext).decrypt(secretKey);
        } catch (IllegalArgumentException e) {
            // salty-coffee reports a failed tag check this way
            throw new VerificationException("cannot decrypt caveat verification id", e);
        }
    }

    private static Key secretKey(byte[] key) {
        if (key.length != KEY_LENGTH) {
            throw new IllegalArgumentException("key must be " + KEY_LENGTH + " bytes");
        }
        return SecretBox.key(key);
    }
}
