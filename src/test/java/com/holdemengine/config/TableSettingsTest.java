package com.holdemengine.config;

import com.holdemengine.betting.RoundConfig;
import com.holdemengine.common.ChipAmount;
import com.holdemengine.rng.RandomSource;
import com.holdemengine.rng.SeededRandomSource;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
@ActiveProfiles("test")
class TableSettingsTest {

    @Autowired
    private TableSettings tableSettings;

    @Autowired
    private RandomSource randomSource;

    @Test
    void testBlindsFromProfile() {
        assertEquals(10, tableSettings.getSmallBlind());
        assertEquals(20, tableSettings.getBigBlind());
        assertEquals(42L, tableSettings.getRngSeed());
    }

    @Test
    void testRoundConfigDefaultsMinBetToBigBlind() {
        RoundConfig config = tableSettings.roundConfig("p1");

        assertEquals(ChipAmount.of(20), config.getBigBlind());
        assertNull(config.getMinBet());
        assertEquals(ChipAmount.of(20), config.effectiveMinBet());
        assertEquals("p1", config.getFirstToActPlayerId());
    }

    @Test
    void testSeededRandomSourceWhenSeedConfigured() {
        assertInstanceOf(SeededRandomSource.class, randomSource);
    }
}
