package com.libragraph.chatvault.formats.message;

import com.libragraph.chatvault.util.ByteReader;

import java.util.Optional;

/**
 * Reads the optional forward-info block embedded in a message value.
 *
 * <p>Layout: {@code int8 flags}; zero means no block. Otherwise
 * {@code int64 author, int32 date}, followed by the optional parts below in
 * bit order. Optional parts are consumed and dropped.
 */
public final class ForwardInfoParser {
    static final int SOURCE_ID = 1 << 1;
    static final int SOURCE_MESSAGE = 1 << 2;
    static final int SIGNATURE = 1 << 3;
    static final int PSA_TYPE = 1 << 4;
    static final int FLAGS = 1 << 5;

    private ForwardInfoParser() {
    }

    /**
     * Consumes the block from {@code reader}.
     *
     * @throws com.libragraph.chatvault.util.TruncatedDataException if the block is cut short
     */
    public static Optional<ForwardInfo> parse(ByteReader reader) {
        int flags = reader.readInt8();
        if (flags == 0) {
            return Optional.empty();
        }

        long authorId = reader.readInt64();
        int date = reader.readInt32();

        if ((flags & SOURCE_ID) != 0) {
            reader.readInt64();
        }
        if ((flags & SOURCE_MESSAGE) != 0) {
            reader.readInt64(); // peer
            reader.readInt32(); // namespace
            reader.readInt32(); // id
        }
        if ((flags & SIGNATURE) != 0) {
            reader.readString();
        }
        if ((flags & PSA_TYPE) != 0) {
            reader.readString();
        }
        if ((flags & FLAGS) != 0) {
            reader.readInt32();
        }

        return Optional.of(new ForwardInfo(authorId, date));
    }
}
