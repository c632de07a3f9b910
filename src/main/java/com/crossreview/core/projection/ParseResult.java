package com.crossreview.core.projection;

import java.util.function.Function;

/**
 * Tagged outcome of decoding LLM output: either {@link Parsed} or {@link ParseError}.
 */
public sealed interface ParseResult<T> permits ParseResult.Parsed, ParseResult.ParseError {

    record Parsed<T>(T value) implements ParseResult<T> {}

    record ParseError<T>(String reason) implements ParseResult<T> {}

    static <T> ParseResult<T> parsed(T value) {
        return new Parsed<>(value);
    }

    static <T> ParseResult<T> error(String reason) {
        return new ParseError<>(reason);
    }

    default boolean isParsed() {
        return this instanceof Parsed<T>;
    }

    default T orElse(T fallback) {
        return this instanceof Parsed<T> p ? p.value() : fallback;
    }

    default <U> ParseResult<U> map(Function<? super T, ? extends U> mapper) {
        if (this instanceof Parsed<T> p) {
            return new Parsed<>(mapper.apply(p.value()));
        }
        return new ParseError<>(((ParseError<T>) this).reason());
    }

    default <U> ParseResult<U> flatMap(Function<? super T, ParseResult<U>> mapper) {
        if (this instanceof Parsed<T> p) {
            return mapper.apply(p.value());
        }
        return new ParseError<>(((ParseError<T>) this).reason());
    }

    default String errorReason() {
        return this instanceof ParseError<T> e ? e.reason() : null;
    }
}
