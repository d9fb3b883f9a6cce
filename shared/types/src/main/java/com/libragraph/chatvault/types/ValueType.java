package com.libragraph.chatvault.types;

/**
 * Type tags of the Postbox tagged-value encoding.
 * The id is the single byte written after each field key.
 */
public enum ValueType {
    INT32(0, "int32"),
    INT64(1, "int64"),
    BOOL(2, "bool"),
    DOUBLE(3, "double"),
    STRING(4, "string"),
    OBJECT(5, "object"),
    INT32_ARRAY(6, "int32[]"),
    INT64_ARRAY(7, "int64[]"),
    OBJECT_ARRAY(8, "object[]"),
    OBJECT_DICTIONARY(9, "object-dictionary"),
    BYTES(10, "bytes"),
    NIL(11, "nil"),
    STRING_ARRAY(12, "string[]"),
    BYTES_ARRAY(13, "bytes[]");

    private static final ValueType[] BY_ID = values();

    private final int id;
    private final String label;

    ValueType(int id, String label) {
        this.id = id;
        this.label = label;
    }

    public int id() {
        return id;
    }

    public String label() {
        return label;
    }

    public static ValueType fromId(int id) {
        if (id >= 0 && id < BY_ID.length && BY_ID[id].id == id) {
            return BY_ID[id];
        }
        throw new IllegalArgumentException("Unknown ValueType id: " + id);
    }
}
