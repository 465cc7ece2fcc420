package com.manning.macaroons;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.manning.macaroons.crypto.Binder;
import com.manning.macaroons.crypto.KeyedHash;
import com.manning.macaroons.crypto.SecretBoxCipher;

/**
 * One verification of a primary macaroon against a set of discharges.
 * Tracks which discharges have been consumed; each may satisfy exactly one
 * third-party caveat.
 */
final class Verifier {
    private static final Logger logger = LoggerFactory.getLogger(Verifier.class);

    private final ConditionChecker checker;
    private final List<Macaroon> discharges;
    private final boolean[] used;

    Verifier(ConditionChecker checker, List<Macaroon> discharges) {
        this.checker = checker;
        this.discharges = discharges == null ? List.of() : List.copyOf(discharges);
        this.used = new boolean[this.discharges.size()];
    }

    void verify(Macaroon primary, byte[] rootKey) {
        try {
            verifyNode(primary, primary.signatureRef(), rootKey);
        } catch (VerificationException e) {
            logger.debug("Verification of macaroon '{}' failed: {}", primary.idString(), e.getMessage());
            throw e;
        }
        for (int i = 0; i < used.length; i++) {
            if (!used[i]) {
                var id = discharges.get(i).idString();
                logger.debug("Discharge '{}' supplied for macaroon '{}' was not used", id, primary.idString());
                throw new VerificationException("discharge macaroon \"" + id + "\" was not used");
            }
        }
    }

    private void verifyNode(Macaroon macaroon, byte[] rootSignature, byte[] key) {
        var data = macaroon.data();
        var caveatSig = KeyedHash.hasher(key).update(data.payloadView(macaroon.idPacket())).sum();

        for (var cav : macaroon.caveatPackets()) {
            if (cav.verificationId.payloadLength() == 0) {
                checker.check(data.payloadString(cav.caveatId));
            } else {
                var discharge = claimDischarge(data.payload(cav.caveatId));
                var sealingKey = KeyedHash.hash(caveatSig, Macaroon.KEY_GENERATOR);
                var dischargeKey = SecretBoxCipher.open(sealingKey, data.payload(cav.verificationId));
                verifyNode(discharge, rootSignature, dischargeKey);
            }
            caveatSig = KeyedHash.hasher(caveatSig)
                    .update(data.payloadView(cav.verificationId))
                    .update(data.payloadView(cav.caveatId))
                    .sum();
        }

        var boundSig = Binder.bindForRequest(rootSignature, caveatSig);
        if (!MessageDigest.isEqual(boundSig, macaroon.signatureRef())) {
            throw new VerificationException("signature mismatch after caveat verification");
        }
    }

    private Macaroon claimDischarge(byte[] caveatId) {
        for (int i = 0; i < discharges.size(); i++) {
            var discharge = discharges.get(i);
            if (discharge.data().payloadEquals(discharge.idPacket(), caveatId)) {
                if (used[i]) {
                    throw new VerificationException("discharge macaroon \""
                            + discharge.idString() + "\" was used more than once");
                }
                used[i] = true;
                return discharge;
            }
        }
        throw new VerificationException("cannot find discharge macaroon for caveat \""
                + new String(caveatId, StandardCharsets.UTF_8) + "\"");
    }
}
