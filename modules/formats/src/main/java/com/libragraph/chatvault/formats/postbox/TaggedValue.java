package com.libragraph.chatvault.formats.postbox;

import com.libragraph.chatvault.types.ValueType;

import java.util.List;
import java.util.Objects;

/**
 * A decoded field value together with its wire type.
 *
 * <p>Java representation per type:
 * <ul>
 *   <li>INT32 {@code Integer}, INT64 {@code Long}, BOOL {@code Boolean}, DOUBLE {@code Double}</li>
 *   <li>STRING {@code String}, BYTES {@code byte[]}, NIL {@code null}</li>
 *   <li>OBJECT {@link TaggedObject}, OBJECT_ARRAY {@code List<TaggedObject>},
 *       OBJECT_DICTIONARY {@code List<ObjectPair>}</li>
 *   <li>INT32_ARRAY {@code int[]}, INT64_ARRAY {@code long[]},
 *       STRING_ARRAY {@code List<String>}, BYTES_ARRAY {@code List<byte[]>}</li>
 * </ul>
 */
public record TaggedValue(ValueType type, Object value) {

    public TaggedValue {
        Objects.requireNonNull(type, "type cannot be null");
    }

    public static TaggedValue nil() {
        return new TaggedValue(ValueType.NIL, null);
    }

    public boolean is(ValueType expected) {
        return type == expected;
    }

    public int asInt32() {
        return (Integer) expect(ValueType.INT32);
    }

    public long asInt64() {
        return (Long) expect(ValueType.INT64);
    }

    public boolean asBool() {
        return (Boolean) expect(ValueType.BOOL);
    }

    public double asDouble() {
        return (Double) expect(ValueType.DOUBLE);
    }

    public String asString() {
        return (String) expect(ValueType.STRING);
    }

    public byte[] asBytes() {
        return (byte[]) expect(ValueType.BYTES);
    }

    public TaggedObject asObject() {
        return (TaggedObject) expect(ValueType.OBJECT);
    }

    @SuppressWarnings("unchecked")
    public List<TaggedObject> asObjectArray() {
        return (List<TaggedObject>) expect(ValueType.OBJECT_ARRAY);
    }

    @SuppressWarnings("unchecked")
    public List<String> asStringArray() {
        return (List<String>) expect(ValueType.STRING_ARRAY);
    }

    private Object expect(ValueType expected) {
        if (type != expected) {
            throw new IllegalStateException("Expected " + expected.label() + " but was " + type.label());
        }
        return value;
    }
}
