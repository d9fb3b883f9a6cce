package com.libragraph.chatvault.core.chat;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

/**
 * Row of a bulk export. {@code senderName} is set for incoming messages only.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ExportedMessage(
        long peerId,
        String peerName,
        int messageId,
        Instant timestamp,
        String text,
        boolean fromMe,
        String senderName
) {}
