package com.holdemengine.betting.rules;

import com.holdemengine.common.ErrorCode;
import com.holdemengine.common.PokerError;
import com.holdemengine.common.Result;
import lombok.Value;

/**
 * Result of an action rule evaluation: approved, or declined with the error the
 * submitter gets back.
 */
@Value
public class RuleResult {
    boolean approved;
    PokerError error;

    public static RuleResult approve() {
        return new RuleResult(true, null);
    }

    public static RuleResult decline(PokerError error) {
        if (error == null) {
            throw new IllegalArgumentException("A declined rule needs an error");
        }
        return new RuleResult(false, error);
    }

    /**
     * @param details alternating key/value pairs attached to the error
     */
    public static RuleResult decline(ErrorCode code, String message, Object... details) {
        return decline(PokerError.of(code, message, details));
    }

    /**
     * The decline as a failed engine result.
     *
     * @throws IllegalStateException if the rule approved
     */
    public <T> Result<T> toResult() {
        if (approved) {
            throw new IllegalStateException("Approved rule has no error");
        }
        return Result.error(error);
    }
}
