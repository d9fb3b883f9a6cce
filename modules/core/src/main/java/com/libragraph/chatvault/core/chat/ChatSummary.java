package com.libragraph.chatvault.core.chat;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

/**
 * A chat as listed by {@link ChatStore#recentChats} and {@link ChatStore#findChats}.
 * {@code lastMessageAt} is only populated by the recent-chats listing.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ChatSummary(
        long peerId,
        String name,
        String username,
        String phone,
        Instant lastMessageAt
) {}
