package com.libragraph.chatvault.formats.message;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Primary key of a row in the message table: 20 big-endian bytes
 * {@code peerId:i64, namespace:i32, timestamp:i32, messageId:i32}.
 *
 * Big-endian ordering makes the raw key sort by peer, then namespace, then
 * time, so a peer's messages share an 8-byte prefix and a descending key
 * scan returns newest first.
 */
public record MessageKey(long peerId, int namespace, int timestamp, int messageId) {
    public static final int LENGTH = 20;
    public static final int PEER_PREFIX_LENGTH = 8;

    public static MessageKey parse(byte[] key) {
        Objects.requireNonNull(key, "key cannot be null");
        if (key.length != LENGTH) {
            throw new IllegalArgumentException("Message key must be 20 bytes, got: " + key.length);
        }
        ByteBuffer buf = ByteBuffer.wrap(key).order(ByteOrder.BIG_ENDIAN);
        return new MessageKey(buf.getLong(), buf.getInt(), buf.getInt(), buf.getInt());
    }

    /**
     * Returns empty for keys of the wrong length instead of throwing.
     */
    public static Optional<MessageKey> tryParse(byte[] key) {
        if (key == null || key.length != LENGTH) {
            return Optional.empty();
        }
        return Optional.of(parse(key));
    }

    /** First 8 bytes shared by every message key of the given peer. */
    public static byte[] peerPrefix(long peerId) {
        return ByteBuffer.allocate(PEER_PREFIX_LENGTH).order(ByteOrder.BIG_ENDIAN).putLong(peerId).array();
    }

    public byte[] encode() {
        return ByteBuffer.allocate(LENGTH).order(ByteOrder.BIG_ENDIAN)
                .putLong(peerId)
                .putInt(namespace)
                .putInt(timestamp)
                .putInt(messageId)
                .array();
    }

    public Instant sentAt() {
        return Instant.ofEpochSecond(timestamp);
    }
}
