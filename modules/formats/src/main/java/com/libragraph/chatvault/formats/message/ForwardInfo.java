package com.libragraph.chatvault.formats.message;

/**
 * Origin of a forwarded message: the original author and send date (epoch seconds).
 */
public record ForwardInfo(long authorId, int date) {
}
