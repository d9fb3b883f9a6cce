package com.libragraph.chatvault.formats.postbox;

import com.libragraph.chatvault.types.ValueType;
import com.libragraph.chatvault.util.ByteReader;
import com.libragraph.chatvault.util.TruncatedDataException;

import java.nio.ByteOrder;
import java.util.ArrayList;
import java.util.List;

/**
 * Reader for single records of the Postbox tagged-value encoding.
 *
 * <p>A record is {@code shortString key, uint8 type, payload}; payloads are
 * little-endian and their shape is fixed by the type (see {@link ValueType}).
 * {@link #readValue} and {@link #skipValue} must consume exactly the same
 * bytes for every type, otherwise seeking and full decoding disagree.
 *
 * <p>Malformed input surfaces as {@link TruncatedDataException}
 * (ran off the end) or {@link IllegalArgumentException} (unknown tag, negative length).
 */
public final class TaggedValueDecoder {

    private TaggedValueDecoder() {
    }

    /** A value decoded at some offset, with the number of bytes its type tag and payload took. */
    public record Decoded(TaggedValue value, int consumed) {
    }

    /** A key/value record. */
    public record Field(String key, TaggedValue value) {
    }

    /**
     * Decodes the type tag and payload starting at {@code offset}.
     */
    public static Decoded decodeValue(byte[] buffer, int offset) {
        ByteReader reader = new ByteReader(buffer, offset, buffer.length - offset, ByteOrder.LITTLE_ENDIAN);
        TaggedValue value = readValue(reader);
        return new Decoded(value, reader.position());
    }

    public static Field readField(ByteReader reader) {
        String key = reader.readShortString();
        return new Field(key, readValue(reader));
    }

    public static ValueType readType(ByteReader reader) {
        return ValueType.fromId(reader.readUInt8());
    }

    /**
     * Reads a type tag and its payload.
     */
    public static TaggedValue readValue(ByteReader reader) {
        ValueType type = readType(reader);
        return new TaggedValue(type, readPayload(type, reader));
    }

    /**
     * Reads the payload of a value whose type tag has already been consumed.
     */
    public static Object readPayload(ValueType type, ByteReader reader) {
        switch (type) {
            case INT32:
                return reader.readInt32();
            case INT64:
                return reader.readInt64();
            case BOOL:
                return reader.readUInt8() != 0;
            case DOUBLE:
                return reader.readDouble();
            case STRING:
                return reader.readString();
            case OBJECT:
                return readObject(reader);
            case INT32_ARRAY: {
                int count = readCount(reader, 4);
                int[] values = new int[count];
                for (int i = 0; i < count; i++) {
                    values[i] = reader.readInt32();
                }
                return values;
            }
            case INT64_ARRAY: {
                int count = readCount(reader, 8);
                long[] values = new long[count];
                for (int i = 0; i < count; i++) {
                    values[i] = reader.readInt64();
                }
                return values;
            }
            case OBJECT_ARRAY: {
                int count = readCount(reader, 8);
                List<TaggedObject> items = new ArrayList<>(count);
                for (int i = 0; i < count; i++) {
                    items.add(readObject(reader));
                }
                return items;
            }
            case OBJECT_DICTIONARY: {
                int count = readCount(reader, 16);
                List<ObjectPair> pairs = new ArrayList<>(count);
                for (int i = 0; i < count; i++) {
                    TaggedObject key = readObject(reader);
                    TaggedObject value = readObject(reader);
                    pairs.add(new ObjectPair(key, value));
                }
                return pairs;
            }
            case BYTES:
                return reader.readLengthPrefixedBytes();
            case NIL:
                return null;
            case STRING_ARRAY: {
                int count = readCount(reader, 4);
                List<String> items = new ArrayList<>(count);
                for (int i = 0; i < count; i++) {
                    items.add(reader.readString());
                }
                return items;
            }
            case BYTES_ARRAY: {
                int count = readCount(reader, 4);
                List<byte[]> items = new ArrayList<>(count);
                for (int i = 0; i < count; i++) {
                    items.add(reader.readLengthPrefixedBytes());
                }
                return items;
            }
            default:
                throw new IllegalArgumentException("Unhandled value type: " + type);
        }
    }

    /**
     * Advances past a payload without materializing it.
     */
    public static void skipValue(ValueType type, ByteReader reader) {
        switch (type) {
            case INT32:
                reader.skip(4);
                break;
            case INT64:
            case DOUBLE:
                reader.skip(8);
                break;
            case BOOL:
                reader.skip(1);
                break;
            case STRING:
            case BYTES:
                reader.skip(reader.readInt32());
                break;
            case OBJECT:
                skipObject(reader);
                break;
            case INT32_ARRAY:
                reader.skip(reader.readInt32(), 4);
                break;
            case INT64_ARRAY:
                reader.skip(reader.readInt32(), 8);
                break;
            case OBJECT_ARRAY: {
                int count = readCount(reader, 8);
                for (int i = 0; i < count; i++) {
                    skipObject(reader);
                }
                break;
            }
            case OBJECT_DICTIONARY: {
                int count = readCount(reader, 16);
                for (int i = 0; i < count; i++) {
                    skipObject(reader);
                    skipObject(reader);
                }
                break;
            }
            case NIL:
                break;
            case STRING_ARRAY:
            case BYTES_ARRAY: {
                int count = readCount(reader, 4);
                for (int i = 0; i < count; i++) {
                    reader.skip(reader.readInt32());
                }
                break;
            }
            default:
                throw new IllegalArgumentException("Unhandled value type: " + type);
        }
    }

    private static TaggedObject readObject(ByteReader reader) {
        int typeHash = reader.readInt32();
        return new TaggedObject(typeHash, reader.readLengthPrefixedBytes());
    }

    private static void skipObject(ByteReader reader) {
        reader.skip(4);
        reader.skip(reader.readInt32());
    }

    /**
     * Reads an element count and rejects counts that cannot fit in what is left,
     * given the smallest encoded size of one element.
     */
    private static int readCount(ByteReader reader, int minElementSize) {
        int count = reader.readInt32();
        if (count < 0) {
            throw new IllegalArgumentException("Negative element count: " + count);
        }
        if ((long) count * minElementSize > reader.remaining()) {
            throw new TruncatedDataException(
                    reader.position(), (int) Math.min((long) count * minElementSize, Integer.MAX_VALUE),
                    reader.remaining());
        }
        return count;
    }
}
