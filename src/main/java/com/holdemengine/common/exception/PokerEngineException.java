package com.holdemengine.common.exception;

import com.holdemengine.common.PokerError;

/**
 * Base exception for all holdem engine exceptions.
 *
 * The public engine operations return errors as values; this exception is only raised
 * when a caller explicitly unwraps a failed result, or internally for broken invariants
 * that are converted back into an error value at the service boundary.
 */
public class PokerEngineException extends RuntimeException {

    private final PokerError error;

    public PokerEngineException(PokerError error) {
        super(error.getCode() + ": " + error.getMessage());
        this.error = error;
    }

    public PokerEngineException(PokerError error, Throwable cause) {
        super(error.getCode() + ": " + error.getMessage(), cause);
        this.error = error;
    }

    public PokerError getError() {
        return error;
    }
}
