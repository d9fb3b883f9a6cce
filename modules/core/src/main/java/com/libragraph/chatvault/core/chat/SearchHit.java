package com.libragraph.chatvault.core.chat;

import java.time.Instant;

public record SearchHit(
        Instant timestamp,
        String chatName,
        String sender,
        String text,
        long peerId
) {}
