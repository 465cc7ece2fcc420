package com.manning.macaroons.packet;

import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Optional;

import com.manning.macaroons.MacaroonFormatException;

/**
 * Append-only store of packets. Each packet is laid out as a two byte
 * little-endian total length, a one byte field tag and the payload.
 * Packets already written are never moved or overwritten; callers keep the
 * {@link Packet} returned by {@link #append} to read them back.
 *
 * <p>A buffer is owned by exactly one macaroon. {@link #copy()} gives a
 * second owner its own storage.
 */
public final class PacketBuffer {
    private static final int MIN_PACKET_LENGTH = 6;
    private static final byte[] EMPTY = new byte[0];

    private byte[] data;
    private int length;

    public PacketBuffer() {
        this(64);
    }

    public PacketBuffer(int capacity) {
        this.data = new byte[Math.max(capacity, 0)];
        this.length = 0;
    }

    private PacketBuffer(byte[] data) {
        this.data = data;
        this.length = data.length;
    }

    /**
     * Creates a buffer holding a private copy of {@code len} bytes of
     * {@code src}, starting at {@code offset}.
     */
    public static PacketBuffer copyOf(byte[] src, int offset, int len) {
        return new PacketBuffer(Arrays.copyOfRange(src, offset, offset + len));
    }

    public int length() {
        return length;
    }

    /**
     * Appends a packet with the given field and payload.
     *
     * @return the packet written, or empty if the packet would not fit the
     *         two byte length header; the buffer is unchanged in that case
     */
    public Optional<Packet> append(Field field, byte[] payload) {
        var packetLength = Packet.sizeOf(payload.length);
        if (packetLength > Packet.MAX_LENGTH) {
            return Optional.empty();
        }
        ensureCapacity(length + packetLength);
        var packet = new Packet(length, packetLength);
        writeHeader(data, length, packetLength, field);
        System.arraycopy(payload, 0, data, length + Packet.HEADER_LENGTH, payload.length);
        length += packetLength;
        return Optional.of(packet);
    }

    /**
     * Parses the packet whose header starts at {@code start}.
     */
    public Packet parse(int start) {
        var remaining = length - start;
        if (remaining < MIN_PACKET_LENGTH) {
            throw new MacaroonFormatException("packet too short");
        }
        var packetLength = readSize(data, start);
        if (packetLength > remaining || packetLength < Packet.HEADER_LENGTH) {
            throw new MacaroonFormatException("packet size too big");
        }
        return new Packet(start, packetLength);
    }

    /**
     * Parses the packet at {@code start} and checks that it carries the
     * expected field.
     */
    public Packet expect(int start, Field expected) {
        var packet = parse(start);
        var found = field(packet);
        if (found != expected) {
            throw new MacaroonFormatException("unexpected field " + found + "; expected " + expected);
        }
        return packet;
    }

    public Field field(Packet packet) {
        if (packet.isAbsent()) {
            return Field.INVALID;
        }
        return Field.fromTag(data[packet.start() + 2]);
    }

    public byte[] payload(Packet packet) {
        if (packet.isAbsent()) {
            return EMPTY;
        }
        return Arrays.copyOfRange(data, packet.start() + Packet.HEADER_LENGTH, packet.end());
    }

    /**
     * Returns a copy of the whole packet, header included.
     */
    public byte[] packetBytes(Packet packet) {
        if (packet.isAbsent()) {
            return EMPTY;
        }
        return Arrays.copyOfRange(data, packet.start(), packet.end());
    }

    public String payloadString(Packet packet) {
        if (packet.isAbsent()) {
            return "";
        }
        var offset = packet.start() + Packet.HEADER_LENGTH;
        return new String(data, offset, packet.payloadLength(), StandardCharsets.UTF_8);
    }

    /**
     * Read-only view of the payload, valid until the next append.
     */
    public ByteBuffer payloadView(Packet packet) {
        if (packet.isAbsent()) {
            return ByteBuffer.wrap(EMPTY).asReadOnlyBuffer();
        }
        var offset = packet.start() + Packet.HEADER_LENGTH;
        return ByteBuffer.wrap(data, offset, packet.payloadLength()).slice().asReadOnlyBuffer();
    }

    public boolean payloadEquals(Packet packet, byte[] other) {
        if (packet.payloadLength() != other.length) {
            return false;
        }
        var offset = packet.start() + Packet.HEADER_LENGTH;
        return Arrays.equals(data, offset, offset + other.length, other, 0, other.length);
    }

    /**
     * Returns a copy of the raw bytes between two offsets.
     */
    public byte[] bytes(int from, int to) {
        return Arrays.copyOfRange(data, from, to);
    }

    public byte[] toByteArray() {
        return Arrays.copyOf(data, length);
    }

    public void writeTo(ByteArrayOutputStream out) {
        out.write(data, 0, length);
    }

    /**
     * Returns an independent buffer with the same contents. Appending to
     * either buffer afterwards has no effect on the other.
     */
    public PacketBuffer copy() {
        return new PacketBuffer(toByteArray());
    }

    /**
     * Writes a single packet to {@code out}.
     *
     * @return false if the payload is too big for a packet, in which case
     *         nothing is written
     */
    public static boolean writePacket(ByteArrayOutputStream out, Field field, byte[] payload) {
        var packetLength = Packet.sizeOf(payload.length);
        if (packetLength > Packet.MAX_LENGTH) {
            return false;
        }
        var header = new byte[Packet.HEADER_LENGTH];
        writeHeader(header, 0, packetLength, field);
        out.write(header, 0, header.length);
        out.write(payload, 0, payload.length);
        return true;
    }

    private void ensureCapacity(int required) {
        if (required <= data.length) {
            return;
        }
        var newCapacity = Math.max(required, data.length * 2);
        data = Arrays.copyOf(data, newCapacity);
    }

    private static void writeHeader(byte[] dest, int offset, int packetLength, Field field) {
        dest[offset] = (byte) packetLength;
        dest[offset + 1] = (byte) (packetLength >>> 8);
        dest[offset + 2] = field.tag();
    }

    private static int readSize(byte[] src, int offset) {
        return (src[offset] & 0xff) | ((src[offset + 1] & 0xff) << 8);
    }
}
