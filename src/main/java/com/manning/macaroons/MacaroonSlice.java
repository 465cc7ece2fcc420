package com.manning.macaroons;

import java.io.ByteArrayOutputStream;
import java.util.AbstractList;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.manning.macaroons.packet.PacketBuffer;

/**
 * An ordered collection of macaroons. By convention the first element is the
 * primary macaroon and the rest are discharges for its third-party caveats.
 * The binary form is the concatenation of each element's binary form.
 */
public final class MacaroonSlice extends AbstractList<Macaroon> {
    private static final Logger logger = LoggerFactory.getLogger(MacaroonSlice.class);

    private final List<Macaroon> macaroons;

    public MacaroonSlice() {
        this.macaroons = new ArrayList<>();
    }

    public MacaroonSlice(Collection<Macaroon> macaroons) {
        this.macaroons = new ArrayList<>(macaroons);
    }

    public static MacaroonSlice of(Macaroon... macaroons) {
        return new MacaroonSlice(List.of(macaroons));
    }

    @Override
    public Macaroon get(int index) {
        return macaroons.get(index);
    }

    @Override
    public int size() {
        return macaroons.size();
    }

    @Override
    public Macaroon set(int index, Macaroon macaroon) {
        return macaroons.set(index, macaroon);
    }

    @Override
    public void add(int index, Macaroon macaroon) {
        macaroons.add(index, macaroon);
    }

    @Override
    public Macaroon remove(int index) {
        return macaroons.remove(index);
    }

    public Macaroon primary() {
        if (macaroons.isEmpty()) {
            throw new IllegalStateException("empty macaroon slice");
        }
        return macaroons.get(0);
    }

    public List<Macaroon> discharges() {
        if (macaroons.isEmpty()) {
            return List.of();
        }
        return List.copyOf(macaroons.subList(1, macaroons.size()));
    }

    /**
     * Binds every discharge to the signature of the primary macaroon.
     */
    public void bindDischarges() {
        var rootSignature = primary().signature();
        for (var discharge : discharges()) {
            discharge.bind(rootSignature);
        }
    }

    public void verify(byte[] rootKey, ConditionChecker checker) {
        primary().verify(rootKey, checker, discharges());
    }

    public byte[] toByteArray() {
        var size = 0;
        for (var m : macaroons) {
            size += m.marshalLength();
        }
        var out = new ByteArrayOutputStream(size);
        for (var m : macaroons) {
            try {
                m.writeTo(out);
            } catch (MacaroonFormatException e) {
                throw new MacaroonFormatException("failed to marshal macaroon \"" + m.idString() + "\": "
                        + e.getMessage(), e);
            }
        }
        return out.toByteArray();
    }

    public String serialize() {
        return Base64Url.encode(toByteArray());
    }

    /**
     * Reads macaroons until {@code bytes} is exhausted. Each macaroon gets
     * its own copy of its bytes, so adding caveats to one never touches
     * another.
     */
    public static MacaroonSlice fromByteArray(byte[] bytes) {
        var source = PacketBuffer.copyOf(bytes, 0, bytes.length);
        var slice = new MacaroonSlice();
        var offset = 0;
        while (offset < bytes.length) {
            Macaroon macaroon;
            try {
                macaroon = Macaroon.read(source, offset);
            } catch (MacaroonFormatException e) {
                throw new MacaroonFormatException("cannot unmarshal macaroon: " + e.getMessage(), e);
            }
            slice.macaroons.add(macaroon);
            offset += macaroon.marshalLength();
        }
        logger.debug("Read {} macaroons from {} bytes", slice.size(), bytes.length);
        return slice;
    }

    public static MacaroonSlice deserialize(String serialized) {
        byte[] bytes;
        try {
            bytes = Base64Url.decode(serialized.strip());
        } catch (IllegalArgumentException e) {
            throw new MacaroonFormatException("cannot decode macaroon slice: " + e.getMessage(), e);
        }
        return fromByteArray(bytes);
    }
}
