package com.manning.macaroons.crypto;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.util.Arrays;

import org.junit.jupiter.api.Test;

class RandomSourceTest {

    @Test
    void secureSourceIsShared() {
        assertSame(RandomSource.secure(), RandomSource.secure());
    }

    @Test
    void secureSourceFillsNonces() throws IOException {
        var first = new byte[SecretBoxCipher.NONCE_LENGTH];
        var second = new byte[SecretBoxCipher.NONCE_LENGTH];

        RandomSource.secure().nextBytes(first);
        RandomSource.secure().nextBytes(second);

        assertFalse(Arrays.equals(first, second));
    }
}
