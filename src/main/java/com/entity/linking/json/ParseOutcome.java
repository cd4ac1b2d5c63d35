package com.entity.linking.json;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Tagged result of a tolerant parse.
 *
 * <ul>
 *   <li>{@link Status#PARSED} - a value was decoded</li>
 *   <li>{@link Status#MALFORMED} - a bracketed span was found but did not decode</li>
 *   <li>{@link Status#MISSING} - the text contained no bracketed span at all</li>
 * </ul>
 */
public record ParseOutcome<T>(Status status, T value, String reason) {

    public enum Status {
        PARSED,
        MALFORMED,
        MISSING
    }

    public ParseOutcome {
        Objects.requireNonNull(status, "status is required");
        if (status == Status.PARSED && value == null) {
            throw new IllegalArgumentException("A parsed outcome requires a value");
        }
    }

    public static <T> ParseOutcome<T> parsed(T value) {
        return new ParseOutcome<>(Status.PARSED, value, null);
    }

    public static <T> ParseOutcome<T> malformed(String reason) {
        return new ParseOutcome<>(Status.MALFORMED, null, reason);
    }

    public static <T> ParseOutcome<T> missing() {
        return new ParseOutcome<>(Status.MISSING, null, "No JSON span found");
    }

    public boolean isParsed() {
        return status == Status.PARSED;
    }

    public Optional<T> getValue() {
        return Optional.ofNullable(value);
    }

    /**
     * Maps a parsed value, keeping failure outcomes as they are.
     */
    public <U> ParseOutcome<U> map(Function<? super T, ? extends U> mapper) {
        if (status != Status.PARSED) {
            return new ParseOutcome<>(status, null, reason);
        }
        return parsed(mapper.apply(value));
    }
}
