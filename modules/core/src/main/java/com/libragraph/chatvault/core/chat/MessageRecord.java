package com.libragraph.chatvault.core.chat;

import java.time.Instant;

/**
 * A message of one chat. {@code sender} is {@code "Me"} for outgoing messages.
 */
public record MessageRecord(
        Instant timestamp,
        String sender,
        String text,
        long peerId,
        int messageId
) {}
