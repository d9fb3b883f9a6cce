package com.libragraph.chatvault.util;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;

/**
 * Cursor over an in-memory byte array with fixed byte order.
 *
 * Every read checks bounds first and throws {@link TruncatedDataException}
 * without moving the cursor when not enough bytes remain. Length prefixes
 * are signed int32; negative values are rejected with
 * {@link IllegalArgumentException}.
 */
public class ByteReader {
    private final ByteBuffer buffer;

    /**
     * Little-endian reader over the whole array.
     */
    public ByteReader(byte[] data) {
        this(data, 0, data.length, ByteOrder.LITTLE_ENDIAN);
    }

    public ByteReader(byte[] data, ByteOrder order) {
        this(data, 0, data.length, order);
    }

    /**
     * Reader over {@code data[offset, offset + length)}. Positions are relative to {@code offset}.
     */
    public ByteReader(byte[] data, int offset, int length, ByteOrder order) {
        this.buffer = ByteBuffer.wrap(data, offset, length).slice().order(order);
    }

    public static ByteReader littleEndian(byte[] data) {
        return new ByteReader(data, ByteOrder.LITTLE_ENDIAN);
    }

    public static ByteReader bigEndian(byte[] data) {
        return new ByteReader(data, ByteOrder.BIG_ENDIAN);
    }

    public int position() {
        return buffer.position();
    }

    public void position(int newPosition) {
        if (newPosition < 0 || newPosition > buffer.limit()) {
            throw new IllegalArgumentException("Position out of range: " + newPosition);
        }
        buffer.position(newPosition);
    }

    public int remaining() {
        return buffer.remaining();
    }

    public boolean hasRemaining() {
        return buffer.hasRemaining();
    }

    public byte readInt8() {
        require(1);
        return buffer.get();
    }

    public int readUInt8() {
        require(1);
        return buffer.get() & 0xFF;
    }

    public int readInt32() {
        require(4);
        return buffer.getInt();
    }

    public long readUInt32() {
        require(4);
        return buffer.getInt() & 0xFFFFFFFFL;
    }

    public long readInt64() {
        require(8);
        return buffer.getLong();
    }

    public double readDouble() {
        require(8);
        return buffer.getDouble();
    }

    public byte[] readBytes(int count) {
        checkLength(count);
        require(count);
        byte[] out = new byte[count];
        buffer.get(out);
        return out;
    }

    /**
     * Reads an int32 length followed by that many bytes.
     */
    public byte[] readLengthPrefixedBytes() {
        int mark = buffer.position();
        int length = readInt32();
        try {
            return readBytes(length);
        } catch (RuntimeException e) {
            buffer.position(mark);
            throw e;
        }
    }

    /**
     * Reads an int32-length-prefixed UTF-8 string. Malformed sequences are replaced, never rejected.
     */
    public String readString() {
        return new String(readLengthPrefixedBytes(), StandardCharsets.UTF_8);
    }

    /**
     * Reads a uint8-length-prefixed UTF-8 string.
     */
    public String readShortString() {
        int mark = buffer.position();
        int length = readUInt8();
        if (buffer.remaining() < length) {
            buffer.position(mark);
            throw new TruncatedDataException(mark + 1, length, buffer.remaining());
        }
        byte[] out = new byte[length];
        buffer.get(out);
        return new String(out, StandardCharsets.UTF_8);
    }

    public void skip(int count) {
        checkLength(count);
        require(count);
        buffer.position(buffer.position() + count);
    }

    /**
     * Skips {@code count} elements of {@code width} bytes each.
     */
    public void skip(int count, int width) {
        checkLength(count);
        long total = (long) count * width;
        if (total > buffer.remaining()) {
            throw new TruncatedDataException(buffer.position(),
                    (int) Math.min(total, Integer.MAX_VALUE), buffer.remaining());
        }
        buffer.position(buffer.position() + (int) total);
    }

    private void require(int count) {
        if (buffer.remaining() < count) {
            throw new TruncatedDataException(buffer.position(), count, buffer.remaining());
        }
    }

    private static void checkLength(int count) {
        if (count < 0) {
            throw new IllegalArgumentException("Negative length: " + count);
        }
    }

    @Override
    public String toString() {
        return "ByteReader[pos=" + buffer.position() + ", limit=" + buffer.limit()
                + ", order=" + buffer.order() + "]";
    }
}
