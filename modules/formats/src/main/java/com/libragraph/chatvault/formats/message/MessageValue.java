package com.libragraph.chatvault.formats.message;

/**
 * The parts of a stored message this library reads.
 *
 * @param text        message text, possibly empty
 * @param authorId    author peer id, or {@code null} when the record has none
 * @param flags       raw uint32 flags word, see {@link MessageFlag}
 * @param forwardInfo forward origin, or {@code null}
 */
public record MessageValue(String text, Long authorId, long flags, ForwardInfo forwardInfo) {

    public boolean incoming() {
        return MessageFlag.INCOMING.isSet(flags);
    }

    public boolean hasText() {
        return text != null && !text.isEmpty();
    }
}
