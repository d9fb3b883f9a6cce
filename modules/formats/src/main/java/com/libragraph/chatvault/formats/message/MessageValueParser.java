package com.libragraph.chatvault.formats.message;

import com.libragraph.chatvault.formats.ParseResult;
import com.libragraph.chatvault.util.ByteReader;
import com.libragraph.chatvault.util.TruncatedDataException;

/**
 * Parses the value blob of a message-table row (little-endian).
 *
 * <pre>
 *   int8   kind                (0 = regular message, anything else is unsupported)
 *   uint32 stableId
 *   uint32 stableVersion
 *   uint8  dataFlags           (bits select the optional fields below, in order)
 *     int64 globallyUniqueId   bit 0
 *     uint32 globalTags        bit 1
 *     int64 groupingKey        bit 2
 *     uint32 groupInfo         bit 3
 *     uint32 localTags         bit 4
 *     int64 threadId           bit 5
 *   uint32 flags               (see MessageFlag)
 *   uint32 tags
 *   forward info               (see ForwardInfoParser)
 *   int8   hasAuthor, int64 authorId if hasAuthor == 1
 *   int32  length, UTF-8 text
 * </pre>
 */
public final class MessageValueParser {
    public static final int KIND_REGULAR = 0;

    static final int GLOBALLY_UNIQUE_ID = 1;
    static final int GLOBAL_TAGS = 1 << 1;
    static final int GROUPING_KEY = 1 << 2;
    static final int GROUP_INFO = 1 << 3;
    static final int LOCAL_TAGS = 1 << 4;
    static final int THREAD_ID = 1 << 5;

    private MessageValueParser() {
    }

    public static ParseResult<MessageValue> parse(byte[] value) {
        if (value == null) {
            return ParseResult.unparsable("no value");
        }
        ByteReader reader = ByteReader.littleEndian(value);
        try {
            int kind = reader.readInt8();
            if (kind != KIND_REGULAR) {
                return ParseResult.unparsable("unsupported message kind " + kind);
            }

            reader.readUInt32(); // stable id
            reader.readUInt32(); // stable version

            int dataFlags = reader.readUInt8();
            if ((dataFlags & GLOBALLY_UNIQUE_ID) != 0) {
                reader.readInt64();
            }
            if ((dataFlags & GLOBAL_TAGS) != 0) {
                reader.readUInt32();
            }
            if ((dataFlags & GROUPING_KEY) != 0) {
                reader.readInt64();
            }
            if ((dataFlags & GROUP_INFO) != 0) {
                reader.readUInt32();
            }
            if ((dataFlags & LOCAL_TAGS) != 0) {
                reader.readUInt32();
            }
            if ((dataFlags & THREAD_ID) != 0) {
                reader.readInt64();
            }

            long flags = reader.readUInt32();
            reader.readUInt32(); // tags

            ForwardInfo forwardInfo = ForwardInfoParser.parse(reader).orElse(null);

            Long authorId = null;
            if (reader.readInt8() == 1) {
                authorId = reader.readInt64();
            }

            String text = reader.readString();
            return ParseResult.parsed(new MessageValue(text, authorId, flags, forwardInfo));
        } catch (TruncatedDataException e) {
            return ParseResult.unparsable("truncated at offset " + e.position());
        } catch (IllegalArgumentException e) {
            return ParseResult.unparsable(e.getMessage());
        }
    }
}
