package com.libragraph.chatvault.formats.postbox;

import com.libragraph.chatvault.types.ValueType;
import com.libragraph.chatvault.util.ByteReader;
import com.libragraph.chatvault.util.TruncatedDataException;
import org.jboss.logging.Logger;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A Postbox-encoded blob: a flat run of {@code key, type, payload} records
 * with no header and no index.
 *
 * <p>Both access modes are linear in the blob size and neither throws on
 * malformed input. {@link #decodeAll()} keeps whatever it managed to parse;
 * {@link #seekField} reports absence.
 */
public class TaggedStream {
    private static final Logger log = Logger.getLogger(TaggedStream.class);

    private final byte[] data;

    public TaggedStream(byte[] data) {
        this.data = Objects.requireNonNull(data, "data cannot be null");
    }

    public int size() {
        return data.length;
    }

    /**
     * Decodes every record into an insertion-ordered map.
     * A key that occurs more than once maps to its last occurrence.
     * Stops at the first malformed record and returns the fields read before it.
     */
    public Map<String, TaggedValue> decodeAll() {
        Map<String, TaggedValue> fields = new LinkedHashMap<>();
        ByteReader reader = new ByteReader(data);
        while (reader.hasRemaining()) {
            int recordStart = reader.position();
            try {
                TaggedValueDecoder.Field field = TaggedValueDecoder.readField(reader);
                fields.put(field.key(), field.value());
            } catch (TruncatedDataException | IllegalArgumentException e) {
                log.debugf("Stopped decoding at offset %d of %d: %s", recordStart, data.length, e.getMessage());
                break;
            }
        }
        return Collections.unmodifiableMap(fields);
    }

    /**
     * Finds the first record with the given key and type, skipping everything before it.
     */
    public Optional<TaggedValue> seekField(String key, ValueType expectedType) {
        Objects.requireNonNull(key, "key cannot be null");
        Objects.requireNonNull(expectedType, "expectedType cannot be null");
        ByteReader reader = new ByteReader(data);
        try {
            while (reader.hasRemaining()) {
                String recordKey = reader.readShortString();
                ValueType type = TaggedValueDecoder.readType(reader);
                if (type == expectedType && recordKey.equals(key)) {
                    return Optional.of(new TaggedValue(type, TaggedValueDecoder.readPayload(type, reader)));
                }
                TaggedValueDecoder.skipValue(type, reader);
            }
        } catch (TruncatedDataException | IllegalArgumentException e) {
            log.debugf("Field '%s' not found before malformed data at offset %d: %s",
                    key, reader.position(), e.getMessage());
        }
        return Optional.empty();
    }

    public Optional<String> string(String key) {
        return seekField(key, ValueType.STRING).map(TaggedValue::asString);
    }

    public Optional<Integer> int32(String key) {
        return seekField(key, ValueType.INT32).map(TaggedValue::asInt32);
    }

    public Optional<Long> int64(String key) {
        return seekField(key, ValueType.INT64).map(TaggedValue::asInt64);
    }

    public Optional<TaggedObject> object(String key) {
        return seekField(key, ValueType.OBJECT).map(TaggedValue::asObject);
    }

    @Override
    public String toString() {
        return "TaggedStream[" + data.length + " bytes]";
    }
}
