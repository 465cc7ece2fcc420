package com.manning.macaroons.packet;

/**
 * A span of a {@link PacketBuffer}: the offset of the packet header and the
 * total packet length, header included. A packet does not own any bytes; it
 * is only meaningful together with the buffer it was appended to or parsed
 * from.
 */
public final class Packet {
    public static final int HEADER_LENGTH = 3;
    public static final int MAX_LENGTH = 0xffff;

    /** Marks a field that is not present. */
    public static final Packet ABSENT = new Packet(0, 0);

    private final int start;
    private final int totalLength;

    Packet(int start, int totalLength) {
        this.start = start;
        this.totalLength = totalLength;
    }

    public int start() {
        return start;
    }

    public int totalLength() {
        return totalLength;
    }

    public int end() {
        return start + totalLength;
    }

    public int payloadLength() {
        return isAbsent() ? 0 : totalLength - HEADER_LENGTH;
    }

    public boolean isAbsent() {
        return totalLength == 0;
    }

    /**
     * Returns this packet as seen from a copy of its buffer that begins
     * {@code offset} bytes into the original.
     */
    public Packet rebase(int offset) {
        return isAbsent() ? this : new Packet(start - offset, totalLength);
    }

    public static int sizeOf(int payloadLength) {
        return HEADER_LENGTH + payloadLength;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof Packet)) {
            return false;
        }
        var other = (Packet) obj;
        return start == other.start && totalLength == other.totalLength;
    }

    @Override
    public int hashCode() {
        return 31 * start + totalLength;
    }

    @Override
    public String toString() {
        return "Packet[start=" + start + ", length=" + totalLength + "]";
    }
}
