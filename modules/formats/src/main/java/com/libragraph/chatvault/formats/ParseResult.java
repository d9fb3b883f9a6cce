package com.libragraph.chatvault.formats;

import java.util.Optional;

/**
 * Outcome of decoding one record. Scans keep {@link Parsed} values and drop
 * {@link Unparsable} ones; a bad record never aborts the scan.
 */
public sealed interface ParseResult<T> {

    record Parsed<T>(T value) implements ParseResult<T> {}

    record Unparsable<T>(String reason) implements ParseResult<T> {}

    static <T> ParseResult<T> parsed(T value) {
        return new Parsed<>(value);
    }

    static <T> ParseResult<T> unparsable(String reason) {
        return new Unparsable<>(reason);
    }

    default boolean isParsed() {
        return this instanceof Parsed;
    }

    default Optional<T> toOptional() {
        if (this instanceof Parsed<T> parsed) {
            return Optional.ofNullable(parsed.value());
        }
        return Optional.empty();
    }
}
