package com.holdemengine.common;

import com.holdemengine.common.exception.PokerEngineException;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.util.function.Function;

/**
 * Outcome of an engine operation: either a value or a {@link PokerError}.
 *
 * @param <T> type of the success value
 */
@EqualsAndHashCode
@ToString
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class Result<T> {

    private final T value;
    private final PokerError error;

    public static <T> Result<T> ok(T value) {
        return new Result<>(value, null);
    }

    public static <T> Result<T> error(PokerError error) {
        if (error == null) {
            throw new IllegalArgumentException("Error cannot be null");
        }
        return new Result<>(null, error);
    }

    public static <T> Result<T> error(ErrorCode code, String message) {
        return error(PokerError.of(code, message));
    }

    public boolean isOk() {
        return error == null;
    }

    public boolean isError() {
        return error != null;
    }

    public T getValue() {
        if (error != null) {
            throw new IllegalStateException("No value present, result failed with " + error.getCode());
        }
        return value;
    }

    public PokerError getError() {
        if (error == null) {
            throw new IllegalStateException("No error present");
        }
        return error;
    }

    public <U> Result<U> map(Function<? super T, ? extends U> mapper) {
        if (error != null) {
            return new Result<>(null, error);
        }
        return Result.ok(mapper.apply(value));
    }

    public <U> Result<U> flatMap(Function<? super T, Result<U>> mapper) {
        if (error != null) {
            return new Result<>(null, error);
        }
        return mapper.apply(value);
    }

    public T orElse(T fallback) {
        return error == null ? value : fallback;
    }

    /**
     * @throws PokerEngineException carrying the error if this result failed
     */
    public T orElseThrow() {
        if (error != null) {
            throw new PokerEngineException(error);
        }
        return value;
    }
}
