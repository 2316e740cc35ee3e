package com.holdemengine.betting.rules;

import com.holdemengine.common.ErrorCode;
import com.holdemengine.common.Result;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class RuleResultTest {

    @Test
    void testDeclineCarriesCodeAndDetails() {
        RuleResult result = RuleResult.decline(ErrorCode.INSUFFICIENT_STACK, "Not enough chips",
            "required", 50, "available", 15);

        assertFalse(result.isApproved());
        assertEquals(ErrorCode.INSUFFICIENT_STACK, result.getError().getCode());
        assertEquals(15, result.getError().getDetails().get("available"));
    }

    @Test
    void testDeclineBecomesFailedResult() {
        Result<String> result = RuleResult.decline(ErrorCode.NOT_PLAYER_TURN, "Wait your turn").toResult();

        assertTrue(result.isError());
        assertEquals(ErrorCode.NOT_PLAYER_TURN, result.getError().getCode());
    }

    @Test
    void testApprovedHasNoResultError() {
        assertTrue(RuleResult.approve().isApproved());
        assertThrows(IllegalStateException.class, () -> RuleResult.approve().toResult());
        assertThrows(IllegalArgumentException.class, () -> RuleResult.decline(null));
    }
}
