package com.manning.macaroons.payload;

import static com.google.common.base.Preconditions.checkState;

import java.io.ByteArrayOutputStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.function.BiConsumer;
import java.util.function.Function;
import java.util.function.Supplier;

import com.manning.macaroons.MacaroonFormatException;

/**
 * Encodes records of type {@code T} as caveat identifiers. Fields are
 * declared in order; the position of a field is its index on the wire. Each
 * present field is written as {@code [index][length][bytes]}, with index
 * and length one byte each. Null fields are skipped.
 *
 * <pre>
 * var schema = CaveatSchema.builder(Transfer::new)
 *         .string(t -&gt; t.account, (t, v) -&gt; t.account = v)
 *         .int64(t -&gt; t.limit, (t, v) -&gt; t.limit = v)
 *         .build();
 * macaroon.addFirstPartyCaveat(schema.encode(transfer));
 * </pre>
 */
public final class CaveatSchema<T> {
    static final int MAX_FIELDS = 256;
    static final int MAX_FIELD_LENGTH = 255;

    private final Supplier<T> factory;
    private final List<FieldSpec<T, ?>> fields;

    private CaveatSchema(Supplier<T> factory, List<FieldSpec<T, ?>> fields) {
        this.factory = factory;
        this.fields = List.copyOf(fields);
    }

    public static <T> Builder<T> builder(Supplier<T> factory) {
        return new Builder<>(factory);
    }

    public int fieldCount() {
        return fields.size();
    }

    public byte[] encode(T value) {
        var out = new ByteArrayOutputStream();
        for (int i = 0; i < fields.size(); i++) {
            var bytes = fields.get(i).read(value);
            if (bytes == null) {
                continue;
            }
            if (bytes.length > MAX_FIELD_LENGTH) {
                throw new MacaroonFormatException("caveat field " + i + " too big");
            }
            out.write(i);
            out.write(bytes.length);
            out.write(bytes, 0, bytes.length);
        }
        return out.toByteArray();
    }

    public T decode(byte[] data) {
        var value = factory.get();
        var seen = new boolean[fields.size()];
        var cursor = 0;
        while (cursor < data.length) {
            if (data.length - cursor < 2) {
                throw new MacaroonFormatException("truncated caveat field header");
            }
            var index = data[cursor] & 0xff;
            var length = data[cursor + 1] & 0xff;
            cursor += 2;
            if (index >= fields.size()) {
                throw new MacaroonFormatException("unknown caveat field " + index);
            }
            if (seen[index]) {
                throw new MacaroonFormatException("duplicate caveat field " + index);
            }
            if (data.length - cursor < length) {
                throw new MacaroonFormatException("truncated caveat field " + index);
            }
            seen[index] = true;
            fields.get(index).write(value, Arrays.copyOfRange(data, cursor, cursor + length));
            cursor += length;
        }
        return value;
    }

    public static final class Builder<T> {
        private final Supplier<T> factory;
        private final List<FieldSpec<T, ?>> fields = new ArrayList<>();

        private Builder(Supplier<T> factory) {
            this.factory = factory;
        }

        public <V> Builder<T> field(FieldType<V> type, Function<T, V> getter, BiConsumer<T, V> setter) {
            checkState(fields.size() < MAX_FIELDS, "a caveat schema holds at most %s fields", MAX_FIELDS);
            fields.add(new FieldSpec<>(type, getter, setter));
            return this;
        }

        public Builder<T> int8(Function<T, Byte> getter, BiConsumer<T, Byte> setter) {
            return field(FieldType.INT8, getter, setter);
        }

        public Builder<T> int16(Function<T, Short> getter, BiConsumer<T, Short> setter) {
            return field(FieldType.INT16, getter, setter);
        }

        public Builder<T> int32(Function<T, Integer> getter, BiConsumer<T, Integer> setter) {
            return field(FieldType.INT32, getter, setter);
        }

        public Builder<T> int64(Function<T, Long> getter, BiConsumer<T, Long> setter) {
            return field(FieldType.INT64, getter, setter);
        }

        public Builder<T> bool(Function<T, Boolean> getter, BiConsumer<T, Boolean> setter) {
            return field(FieldType.BOOL, getter, setter);
        }

        public Builder<T> string(Function<T, String> getter, BiConsumer<T, String> setter) {
            return field(FieldType.STRING, getter, setter);
        }

        public Builder<T> bytes(Function<T, byte[]> getter, BiConsumer<T, byte[]> setter) {
            return field(FieldType.BYTES, getter, setter);
        }

        public CaveatSchema<T> build() {
            return new CaveatSchema<>(factory, fields);
        }
    }

    private static final class FieldSpec<T, V> {
        private final FieldType<V> type;
        private final Function<T, V> getter;
        private final BiConsumer<T, V> setter;

        FieldSpec(FieldType<V> type, Function<T, V> getter, BiConsumer<T, V> setter) {
            this.type = type;
            this.getter = getter;
            this.setter = setter;
        }

        byte[] read(T record) {
            var value = getter.apply(record);
            return value == null ? null : type.toBytes(value);
        }

        void write(T record, byte[] bytes) {
            setter.accept(record, type.fromBytes(bytes));
        }
    }
}
