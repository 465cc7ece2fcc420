package com.manning.macaroons;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.manning.macaroons.crypto.Binder;
import com.manning.macaroons.crypto.KeyedHash;
import com.manning.macaroons.crypto.RandomSource;
import com.manning.macaroons.crypto.SecretBoxCipher;
import com.manning.macaroons.packet.Field;
import com.manning.macaroons.packet.Packet;
import com.manning.macaroons.packet.PacketBuffer;

/**
 * A bearer token made of a location hint, an identifier, an ordered list of
 * caveats and a signature chaining all of them to a root key.
 *
 * <p>The binary form is
 * {@code location identifier (cid [vid] [cl])* signature}, one packet per
 * field. All fields but the signature live in a single append-only
 * {@link PacketBuffer}; the signature is written last when marshaling.
 *
 * <p>Macaroons are mutable and not thread safe. Use {@link #copy()} before
 * handing a macaroon to code that may add caveats to it. Equality is
 * identity; compare {@link #toByteArray()} to compare contents.
 */
public final class Macaroon {
    private static final Logger logger = LoggerFactory.getLogger(Macaroon.class);

    static final byte[] KEY_GENERATOR = Arrays.copyOf(
            "macaroons-key-generator".getBytes(StandardCharsets.US_ASCII), KeyedHash.LENGTH);

    private final PacketBuffer data;
    private final Packet location;
    private final Packet id;
    private final List<CaveatPackets> caveats;
    private byte[] signature;

    private Macaroon(PacketBuffer data, Packet location, Packet id, List<CaveatPackets> caveats,
            byte[] signature) {
        this.data = data;
        this.location = location;
        this.id = id;
        this.caveats = caveats;
        this.signature = signature;
    }

    public static Macaroon create(byte[] rootKey, byte[] id, byte[] location) {
        if (Packet.sizeOf(location.length) > Packet.MAX_LENGTH) {
            throw new MacaroonFormatException("macaroon location too big");
        }
        if (Packet.sizeOf(id.length) > Packet.MAX_LENGTH) {
            throw new MacaroonFormatException("macaroon identifier too big");
        }
        var data = new PacketBuffer(Packet.sizeOf(location.length) + Packet.sizeOf(id.length));
        var locationPacket = data.append(Field.LOCATION, location).orElseThrow();
        var idPacket = data.append(Field.IDENTIFIER, id).orElseThrow();
        var signature = KeyedHash.hash(rootKey, id);
        return new Macaroon(data, locationPacket, idPacket, new ArrayList<>(), signature);
    }

    public static Macaroon create(byte[] rootKey, String id, String location) {
        return create(rootKey, id.getBytes(StandardCharsets.UTF_8), location.getBytes(StandardCharsets.UTF_8));
    }

    public String location() {
        return data.payloadString(location);
    }

    public byte[] id() {
        return data.payload(id);
    }

    public String idString() {
        return data.payloadString(id);
    }

    public byte[] signature() {
        return signature.clone();
    }

    public int caveatCount() {
        return caveats.size();
    }

    public List<Caveat> caveats() {
        var result = new ArrayList<Caveat>(caveats.size());
        for (var cav : caveats) {
            result.add(new Caveat(
                    data.payload(cav.caveatId),
                    data.payload(cav.verificationId),
                    data.payloadString(cav.location)));
        }
        return Collections.unmodifiableList(result);
    }

    /**
     * Returns the raw caveat packets, exactly as they appear in the binary
     * form between the identifier and the signature.
     */
    public byte[] caveatBytes() {
        return data.bytes(id.end(), data.length());
    }

    public void addFirstPartyCaveat(byte[] condition) {
        if (Packet.sizeOf(condition.length) > Packet.MAX_LENGTH) {
            throw new MacaroonFormatException("caveat identifier too big");
        }
        var caveatId = data.append(Field.CAVEAT_ID, condition).orElseThrow();
        caveats.add(new CaveatPackets(caveatId, Packet.ABSENT, Packet.ABSENT));
        signature = KeyedHash.hash(signature, condition);
    }

    public void addFirstPartyCaveat(String condition) {
        addFirstPartyCaveat(condition.getBytes(StandardCharsets.UTF_8));
    }

    public void addThirdPartyCaveat(byte[] dischargeRootKey, byte[] caveatId, String location) {
        addThirdPartyCaveat(dischargeRootKey, caveatId, location, RandomSource.secure());
    }

    public void addThirdPartyCaveat(byte[] dischargeRootKey, String caveatId, String location) {
        addThirdPartyCaveat(dischargeRootKey, caveatId.getBytes(StandardCharsets.UTF_8), location);
    }

    /**
     * Adds a caveat that only a discharge macaroon minted with
     * {@code dischargeRootKey} and identified by {@code caveatId} can
     * satisfy. The discharge root key is sealed under a key derived from the
     * current signature, so only a verifier replaying the signature chain
     * can recover it.
     *
     * @param random source of the sealing nonce
     */
    public void addThirdPartyCaveat(byte[] dischargeRootKey, byte[] caveatId, String location,
            RandomSource random) {
        var nonce = new byte[SecretBoxCipher.NONCE_LENGTH];
        try {
            random.nextBytes(nonce);
        } catch (IOException e) {
            throw new MacaroonException("cannot generate random bytes: " + e.getMessage(), e);
        }
        var locationBytes = location.getBytes(StandardCharsets.UTF_8);
        if (Packet.sizeOf(caveatId.length) > Packet.MAX_LENGTH) {
            throw new MacaroonFormatException("caveat identifier too big");
        }
        if (Packet.sizeOf(SecretBoxCipher.sealedLength(dischargeRootKey.length)) > Packet.MAX_LENGTH) {
            throw new MacaroonFormatException("caveat verification id too big");
        }
        if (Packet.sizeOf(locationBytes.length) > Packet.MAX_LENGTH) {
            throw new MacaroonFormatException("caveat location too big");
        }

        var encryptionKey = KeyedHash.hash(signature, KEY_GENERATOR);
        var verificationId = SecretBoxCipher.seal(encryptionKey, nonce, dischargeRootKey);

        var cid = data.append(Field.CAVEAT_ID, caveatId).orElseThrow();
        var vid = data.append(Field.VERIFICATION_ID, verificationId).orElseThrow();
        var cl = locationBytes.length == 0
                ? Packet.ABSENT
                : data.append(Field.CAVEAT_LOCATION, locationBytes).orElseThrow();
        caveats.add(new CaveatPackets(cid, vid, cl));
        signature = KeyedHash.hash2(signature, verificationId, caveatId);
        logger.debug("Added third-party caveat for location '{}' to macaroon '{}'", location, idString());
    }

    /**
     * Binds this discharge macaroon to the primary macaroon with the given
     * signature. Must be called once on every discharge before it is passed
     * to {@link #verify(byte[], ConditionChecker, List)}.
     */
    public void bind(byte[] rootSignature) {
        signature = Binder.bindForRequest(rootSignature, signature);
    }

    public Macaroon copy() {
        return new Macaroon(data.copy(), location, id, new ArrayList<>(caveats), signature.clone());
    }

    /**
     * Verifies a macaroon that carries no caveats. Any first-party caveat is
     * rejected and any third-party caveat fails for lack of a discharge.
     */
    public void verify(byte[] rootKey) {
        verify(rootKey, ConditionChecker.never(), List.of());
    }

    /**
     * Verifies this macaroon as a primary macaroon.
     *
     * @param rootKey the key the macaroon was created with
     * @param checker decides first-party conditions; whatever it throws is
     *                rethrown as is
     * @param discharges discharge macaroons, each already bound to this
     *                   macaroon's signature; every one must be used exactly
     *                   once
     * @throws VerificationException if the signature chain, a discharge or
     *                               the set of discharges is invalid
     */
    public void verify(byte[] rootKey, ConditionChecker checker, List<Macaroon> discharges) {
        new Verifier(checker, discharges).verify(this, rootKey);
    }

    public int marshalLength() {
        return data.length() + Packet.sizeOf(signature.length);
    }

    public byte[] toByteArray() {
        var out = new ByteArrayOutputStream(marshalLength());
        writeTo(out);
        return out.toByteArray();
    }

    void writeTo(ByteArrayOutputStream out) {
        data.writeTo(out);
        if (!PacketBuffer.writePacket(out, Field.SIGNATURE, signature)) {
            throw new MacaroonFormatException("signature too big");
        }
    }

    public String serialize() {
        return Base64Url.encode(toByteArray());
    }

    public static Macaroon fromByteArray(byte[] bytes) {
        var source = PacketBuffer.copyOf(bytes, 0, bytes.length);
        var macaroon = read(source, 0);
        if (macaroon.marshalLength() != bytes.length) {
            throw new MacaroonFormatException("unexpected data after macaroon signature");
        }
        return macaroon;
    }

    public static Macaroon deserialize(String serialized) {
        byte[] bytes;
        try {
            bytes = Base64Url.decode(serialized.strip());
        } catch (IllegalArgumentException e) {
            throw new MacaroonFormatException("cannot decode macaroon: " + e.getMessage(), e);
        }
        return fromByteArray(bytes);
    }

    /**
     * Reads the macaroon starting at {@code start}. The result owns a copy
     * of its bytes and shares nothing with {@code source}.
     */
    static Macaroon read(PacketBuffer source, int start) {
        var location = source.expect(start, Field.LOCATION);
        var id = source.expect(location.end(), Field.IDENTIFIER);
        var caveats = new ArrayList<CaveatPackets>();
        var offset = id.end();
        while (true) {
            var packet = source.parse(offset);
            var field = source.field(packet);
            switch (field) {
            case SIGNATURE:
                var signature = source.payload(packet);
                if (signature.length != KeyedHash.LENGTH) {
                    throw new MacaroonFormatException("signature has unexpected length " + signature.length);
                }
                var own = source.bytes(start, offset);
                var rebased = new ArrayList<CaveatPackets>(caveats.size());
                for (var cav : caveats) {
                    rebased.add(cav.rebase(start));
                }
                return new Macaroon(PacketBuffer.copyOf(own, 0, own.length), location.rebase(start),
                        id.rebase(start), rebased, signature);
            case CAVEAT_ID:
                caveats.add(new CaveatPackets(packet, Packet.ABSENT, Packet.ABSENT));
                break;
            case VERIFICATION_ID:
            case CAVEAT_LOCATION:
                if (caveats.isEmpty()) {
                    throw new MacaroonFormatException(field + " field with no preceding caveat id");
                }
                var last = caveats.size() - 1;
                caveats.set(last, caveats.get(last).with(field, packet));
                break;
            default:
                throw new MacaroonFormatException("unexpected field " + field);
            }
            offset = packet.end();
        }
    }

    PacketBuffer data() {
        return data;
    }

    Packet idPacket() {
        return id;
    }

    List<CaveatPackets> caveatPackets() {
        return caveats;
    }

    byte[] signatureRef() {
        return signature;
    }

    @Override
    public String toString() {
        return "Macaroon[location=" + location() + ", id=" + idString() + ", caveats=" + caveats.size() + "]";
    }

    /**
     * Packets making up one caveat. Verification id and location are
     * {@link Packet#ABSENT} when not present.
     */
    static final class CaveatPackets {
        final Packet caveatId;
        final Packet verificationId;
        final Packet location;

        CaveatPackets(Packet caveatId, Packet verificationId, Packet location) {
            this.caveatId = caveatId;
            this.verificationId = verificationId;
            this.location = location;
        }

        CaveatPackets with(Field field, Packet packet) {
            if (field == Field.VERIFICATION_ID) {
                if (!verificationId.isAbsent()) {
                    throw new MacaroonFormatException("duplicate " + field + " field");
                }
                return new CaveatPackets(caveatId, packet, location);
            }
            if (!location.isAbsent()) {
                throw new MacaroonFormatException("duplicate " + field + " field");
            }
            return new CaveatPackets(caveatId, verificationId, packet);
        }

        CaveatPackets rebase(int offset) {
            return new CaveatPackets(caveatId.rebase(offset), verificationId.rebase(offset), location.rebase(offset));
        }
    }
}
