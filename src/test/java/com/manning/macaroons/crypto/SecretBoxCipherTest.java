package com.manning.macaroons.crypto;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

import org.junit.jupiter.api.Test;

import software.pando.crypto.nacl.SecretBox;

import com.manning.macaroons.VerificationException;

class SecretBoxCipherTest {
    private final byte[] key = KeyedHash.hash("sig".getBytes(StandardCharsets.UTF_8), new byte[32]);
    private final byte[] nonce = new byte[SecretBoxCipher.NONCE_LENGTH];

    @Test
    void sealThenOpen() {
        Arrays.fill(nonce, (byte) 7);
        var plaintext = "shared root key".getBytes(StandardCharsets.UTF_8);

        var box = SecretBoxCipher.seal(key, nonce, plaintext);

        assertEquals(SecretBoxCipher.sealedLength(plaintext.length), box.length);
        assertArrayEquals(nonce, Arrays.copyOf(box, SecretBoxCipher.NONCE_LENGTH));
        assertArrayEquals(plaintext, SecretBoxCipher.open(key, box));
    }

    @Test
    void sealedBoxIsAStandardSecretBox() {
        Arrays.fill(nonce, (byte) 3);
        var plaintext = "discharge key".getBytes(StandardCharsets.UTF_8);

        var box = SecretBoxCipher.seal(key, nonce, plaintext);
        var ciphertext = Arrays.copyOfRange(box, SecretBoxCipher.NONCE_LENGTH, box.length);

        assertArrayEquals(plaintext, SecretBox.fromCombined(nonce, ciphertext).decrypt(SecretBox.key(key)));
    }

    @Test
    void opensBoxSealedBySecretBox() {
        Arrays.fill(nonce, (byte) 9);
        var box = SecretBox.encrypt(SecretBox.key(key), nonce, new byte[] { 1, 2, 3 });
        var ciphertext = box.getCiphertextWithTag();
        var sealed = Arrays.copyOf(nonce, nonce.length + ciphertext.length);
        System.arraycopy(ciphertext, 0, sealed, nonce.length, ciphertext.length);

        assertArrayEquals(new byte[] { 1, 2, 3 }, SecretBoxCipher.open(key, sealed));
    }

    @Test
    void emptyPlaintextStillAuthenticated() {
        var box = SecretBoxCipher.seal(key, nonce, new byte[0]);

        assertEquals(SecretBoxCipher.NONCE_LENGTH + SecretBoxCipher.TAG_LENGTH, box.length);
        assertEquals(0, SecretBoxCipher.open(key, box).length);
    }

    @Test
    void tamperedBoxIsRejected() {
        var box = SecretBoxCipher.seal(key, nonce, "k".getBytes(StandardCharsets.UTF_8));
        box[box.length - 1] ^= 1;

        var e = assertThrows(VerificationException.class, () -> SecretBoxCipher.open(key, box));
        assertEquals("cannot decrypt caveat verification id", e.getMessage());
    }

    @Test
    void wrongKeyIsRejected() {
        var box = SecretBoxCipher.seal(key, nonce, "k".getBytes(StandardCharsets.UTF_8));
        var otherKey = KeyedHash.hash(new byte[] { 1 }, new byte[32]);

        assertThrows(VerificationException.class, () -> SecretBoxCipher.open(otherKey, box));
    }

    @Test
    void truncatedBoxIsRejected() {
        assertThrows(VerificationException.class, () -> SecretBoxCipher.open(key, new byte[39]));
    }

    @Test
    void keyMustBeFullLength() {
        assertThrows(IllegalArgumentException.class, () -> SecretBoxCipher.seal(new byte[16], nonce, new byte[1]));
    }

    @Test
    void nonceMustBeFullLength() {
        assertThrows(IllegalArgumentException.class, () -> SecretBoxCipher.seal(key, new byte[12], new byte[1]));
    }
}
