package com.manning.macaroons.packet;

/**
 * Field tags carried in the third byte of every packet.
 */
public enum Field {
    INVALID("invalid"),
    LOCATION("location"),
    IDENTIFIER("identifier"),
    SIGNATURE("signature"),
    CAVEAT_ID("cid"),
    VERIFICATION_ID("vid"),
    CAVEAT_LOCATION("cl");

    private static final Field[] VALUES = values();

    private final String label;

    Field(String label) {
        this.label = label;
    }

    public byte tag() {
        return (byte) ordinal();
    }

    public static Field fromTag(byte tag) {
        var index = tag & 0xff;
        if (index >= VALUES.length) {
            return INVALID;
        }
        return VALUES[index];
    }

    @Override
    public String toString() {
        return label;
    }
}
