package com.holdemengine.config;

import com.holdemengine.betting.RoundConfig;
import com.holdemengine.common.ChipAmount;
import lombok.Getter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Table defaults used to build per-street round configuration.
 */
@Component
@Getter
public class TableSettings {

    @Value("${holdem.table.small-blind:10}")
    private long smallBlind;

    @Value("${holdem.table.big-blind:20}")
    private long bigBlind;

    /**
     * Zero means "same as the big blind".
     */
    @Value("${holdem.table.min-bet:0}")
    private long minBet;

    /**
     * When set, dealing uses a deterministic random source.
     */
    @Value("${holdem.table.rng-seed:#{null}}")
    private Long rngSeed;

    public RoundConfig roundConfig(String firstToActPlayerId) {
        return RoundConfig.builder()
            .bigBlind(ChipAmount.of(bigBlind))
            .minBet(minBet > 0 ? ChipAmount.of(minBet) : null)
            .firstToActPlayerId(firstToActPlayerId)
            .build();
    }
}
