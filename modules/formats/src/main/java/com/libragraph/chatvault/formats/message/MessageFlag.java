package com.libragraph.chatvault.formats.message;

/**
 * Bits of the uint32 message flags word. Only {@link #INCOMING} is used downstream.
 */
public enum MessageFlag {
    UNSENT(1),
    FAILED(1 << 1),
    INCOMING(1 << 2),
    TOP_INDEXABLE(1 << 4),
    SENDING(1 << 5),
    WAS_SCHEDULED(1 << 7),
    COUNTED_AS_INCOMING(1 << 8);

    private final int mask;

    MessageFlag(int mask) {
        this.mask = mask;
    }

    public int mask() {
        return mask;
    }

    public boolean isSet(long flags) {
        return (flags & mask) != 0;
    }
}
