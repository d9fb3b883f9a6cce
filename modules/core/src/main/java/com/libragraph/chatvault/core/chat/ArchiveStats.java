package com.libragraph.chatvault.core.chat;

public record ArchiveStats(long messages, long peers) {}
