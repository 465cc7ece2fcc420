package com.manning.macaroons.crypto;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

public final class Binder {
    private Binder() {
    }

    /**
     * Binds a discharge signature to the signature of the macaroon it is
     * presented with. A signature equal to the root signature is returned
     * as is, so binding the primary to itself is a no-op.
     */
    public static byte[] bindForRequest(byte[] rootSignature, byte[] dischargeSignature) {
        if (MessageDigest.isEqual(rootSignature, dischargeSignature)) {
            return rootSignature.clone();
        }
        try {
            var sha = MessageDigest.getInstance("SHA-256");
            sha.update(rootSignature);
            sha.update(dischargeSignature);
            return sha.digest();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(e);
        }
    }
}
