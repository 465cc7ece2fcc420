package com.manning.macaroons;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;

/**
 * Snapshot of one caveat of a macaroon. First-party caveats carry only a
 * condition; third-party caveats also carry the sealed discharge key and a
 * location hint for the discharging party.
 */
public final class Caveat {
    private final byte[] caveatId;
    private final byte[] verificationId;
    private final String location;

    Caveat(byte[] caveatId, byte[] verificationId, String location) {
        this.caveatId = caveatId;
        this.verificationId = verificationId;
        this.location = location;
    }

    public byte[] caveatId() {
        return caveatId.clone();
    }

    public byte[] verificationId() {
        return verificationId.clone();
    }

    public String location() {
        return location;
    }

    public String condition() {
        return new String(caveatId, StandardCharsets.UTF_8);
    }

    public boolean isThirdParty() {
        return verificationId.length > 0;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof Caveat)) {
            return false;
        }
        var other = (Caveat) obj;
        return Arrays.equals(caveatId, other.caveatId)
                && Arrays.equals(verificationId, other.verificationId)
                && location.equals(other.location);
    }

    @Override
    public int hashCode() {
        return Objects.hash(Arrays.hashCode(caveatId), Arrays.hashCode(verificationId), location);
    }

    @Override
    public String toString() {
        if (isThirdParty()) {
            return "Caveat[" + condition() + " @ " + location + "]";
        }
        return "Caveat[" + condition() + "]";
    }
}
