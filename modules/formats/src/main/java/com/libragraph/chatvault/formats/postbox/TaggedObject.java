package com.libragraph.chatvault.formats.postbox;

import java.util.Arrays;
import java.util.HexFormat;
import java.util.Objects;

/**
 * Payload of an Object-typed field: an opaque type hash plus the bytes of a
 * complete nested tagged stream.
 */
public record TaggedObject(int typeHash, byte[] data) {

    public TaggedObject {
        Objects.requireNonNull(data, "data cannot be null");
    }

    /** Views the payload as a nested stream. Nothing is decoded until asked. */
    public TaggedStream stream() {
        return new TaggedStream(data);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof TaggedObject other)) return false;
        return typeHash == other.typeHash && Arrays.equals(data, other.data);
    }

    @Override
    public int hashCode() {
        return 31 * typeHash + Arrays.hashCode(data);
    }

    @Override
    public String toString() {
        return "TaggedObject[typeHash=" + HexFormat.of().toHexDigits(typeHash)
                + ", length=" + data.length + "]";
    }
}
