package com.manning.macaroons.payload;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;

import com.manning.macaroons.MacaroonFormatException;

/**
 * Encoding of one caveat payload field. Integers are fixed width and little
 * endian; strings are UTF-8; booleans are a single 0 or 1 byte.
 */
public abstract class FieldType<V> {
    public static final FieldType<Byte> INT8 = new FixedWidth<>("int8", 1) {
        @Override
        void put(ByteBuffer buf, Byte value) {
            buf.put(value);
        }

        @Override
        Byte get(ByteBuffer buf) {
            return buf.get();
        }
    };

    public static final FieldType<Short> INT16 = new FixedWidth<>("int16", 2) {
        @Override
        void put(ByteBuffer buf, Short value) {
            buf.putShort(value);
        }

        @Override
        Short get(ByteBuffer buf) {
            return buf.getShort();
        }
    };

    public static final FieldType<Integer> INT32 = new FixedWidth<>("int32", 4) {
        @Override
        void put(ByteBuffer buf, Integer value) {
            buf.putInt(value);
        }

        @Override
        Integer get(ByteBuffer buf) {
            return buf.getInt();
        }
    };

    public static final FieldType<Long> INT64 = new FixedWidth<>("int64", 8) {
        @Override
        void put(ByteBuffer buf, Long value) {
            buf.putLong(value);
        }

        @Override
        Long get(ByteBuffer buf) {
            return buf.getLong();
        }
    };

    public static final FieldType<Boolean> BOOL = new FieldType<>("bool") {
        @Override
        byte[] toBytes(Boolean value) {
            return new byte[] { (byte) (value ? 1 : 0) };
        }

        @Override
        Boolean fromBytes(byte[] bytes) {
            if (bytes.length != 1 || (bytes[0] != 0 && bytes[0] != 1)) {
                throw new MacaroonFormatException("cannot decode bool caveat field");
            }
            return bytes[0] == 1;
        }
    };

    public static final FieldType<String> STRING = new FieldType<>("string") {
        @Override
        byte[] toBytes(String value) {
            return value.getBytes(StandardCharsets.UTF_8);
        }

        @Override
        String fromBytes(byte[] bytes) {
            return new String(bytes, StandardCharsets.UTF_8);
        }
    };

    public static final FieldType<byte[]> BYTES = new FieldType<>("bytes") {
        @Override
        byte[] toBytes(byte[] value) {
            return value.clone();
        }

        @Override
        byte[] fromBytes(byte[] bytes) {
            return bytes.clone();
        }
    };

    private final String name;

    private FieldType(String name) {
        this.name = name;
    }

    abstract byte[] toBytes(V value);

    abstract V fromBytes(byte[] bytes);

    @Override
    public String toString() {
        return name;
    }

    private abstract static class FixedWidth<V> extends FieldType<V> {
        private final int width;

        FixedWidth(String name, int width) {
            super(name);
            this.width = width;
        }

        abstract void put(ByteBuffer buf, V value);

        abstract V get(ByteBuffer buf);

        @Override
        byte[] toBytes(V value) {
            var buf = ByteBuffer.allocate(width).order(ByteOrder.LITTLE_ENDIAN);
            put(buf, value);
            return buf.array();
        }

        @Override
        V fromBytes(byte[] bytes) {
            if (bytes.length != width) {
                throw new MacaroonFormatException("cannot decode " + this + " caveat field of length " + bytes.length);
            }
            return get(ByteBuffer.wrap(bytes).order(ByteOrder.LITTLE_ENDIAN));
        }
    }
}
