package com.holdemengine.pot;

import com.holdemengine.betting.BettingRoundPlayerState;
import com.holdemengine.common.ChipAmount;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for layering main and side pots from hand contributions.
 */
class PotCalculatorTest {

    private final PotCalculator calculator = new PotCalculator();

    @Test
    void testEqualContributionsMakeSinglePot() {
        List<Pot> pots = calculator.computePots(List.of(
            contributed("a", 100, false),
            contributed("b", 100, false),
            contributed("c", 100, false)
        ));

        assertEquals(1, pots.size());
        assertEquals(ChipAmount.of(300), pots.get(0).getAmount());
        assertEquals(List.of("a", "b", "c"), pots.get(0).getEligiblePlayerIds());
        assertFalse(pots.get(0).isUncalled());
    }

    @Test
    void testAllInCreatesSidePot() {
        List<Pot> pots = calculator.computePots(List.of(
            contributed("a", 50, false),
            allIn("b", 15),
            contributed("c", 50, false)
        ));

        assertEquals(2, pots.size());
        assertEquals(ChipAmount.of(45), pots.get(0).getAmount());
        assertEquals(List.of("a", "b", "c"), pots.get(0).getEligiblePlayerIds());
        assertEquals(ChipAmount.of(70), pots.get(1).getAmount());
        assertEquals(List.of("a", "c"), pots.get(1).getEligiblePlayerIds());
    }

    @Test
    void testMultipleAllInsCreateLayeredPots() {
        List<Pot> pots = calculator.computePots(List.of(
            allIn("a", 100),
            allIn("b", 250),
            contributed("c", 400, false),
            contributed("d", 400, false)
        ));

        assertEquals(3, pots.size());
        assertEquals(ChipAmount.of(400), pots.get(0).getAmount());
        assertEquals(ChipAmount.of(450), pots.get(1).getAmount());
        assertEquals(List.of("b", "c", "d"), pots.get(1).getEligiblePlayerIds());
        assertEquals(ChipAmount.of(300), pots.get(2).getAmount());
        assertEquals(List.of("c", "d"), pots.get(2).getEligiblePlayerIds());
    }

    @Test
    void testFoldedChipsStayInPotsWithoutEligibility() {
        List<Pot> pots = calculator.computePots(List.of(
            contributed("a", 80, true),
            allIn("b", 30),
            contributed("c", 60, false)
        ));

        ChipAmount total = ChipAmount.sum(pots.stream().map(Pot::getAmount).toList());
        assertEquals(ChipAmount.of(170), total);
        assertTrue(pots.stream().noneMatch(p -> p.isEligible("a")));
        // 30 from each of the three, then c's and a's chips between 30 and 60, then a's excess.
        assertEquals(ChipAmount.of(90), pots.get(0).getAmount());
        assertEquals(ChipAmount.of(80), pots.get(1).getAmount());
        assertEquals(List.of("c"), pots.get(1).getEligiblePlayerIds());
        assertFalse(pots.get(1).isUncalled());
    }

    @Test
    void testUnmatchedTopLayerIsUncalled() {
        List<Pot> pots = calculator.computePots(List.of(
            contributed("a", 100, false),
            contributed("b", 100, false),
            allIn("c", 120)
        ));

        assertEquals(2, pots.size());
        assertEquals(ChipAmount.of(300), pots.get(0).getAmount());
        assertEquals(ChipAmount.of(20), pots.get(1).getAmount());
        assertEquals(List.of("c"), pots.get(1).getEligiblePlayerIds());
        assertTrue(pots.get(1).isUncalled());
    }

    @Test
    void testSoleSurvivorGetsEverything() {
        List<Pot> pots = calculator.computePots(List.of(
            contributed("a", 60, true),
            contributed("b", 20, false),
            contributed("c", 10, true)
        ));

        assertEquals(1, pots.size());
        assertEquals(ChipAmount.of(90), pots.get(0).getAmount());
        assertEquals(List.of("b"), pots.get(0).getEligiblePlayerIds());
        assertFalse(pots.get(0).isUncalled());
    }

    @Test
    void testPriorStreetsCountTowardsLayers() {
        BettingRoundPlayerState a = BettingRoundPlayerState.builder()
            .playerId("a").stack(ChipAmount.zero()).allIn(true)
            .priorContribution(ChipAmount.of(40)).committed(ChipAmount.of(10)).build();
        BettingRoundPlayerState b = BettingRoundPlayerState.builder()
            .playerId("b").stack(ChipAmount.of(500))
            .priorContribution(ChipAmount.of(40)).committed(ChipAmount.of(60)).build();
        BettingRoundPlayerState c = BettingRoundPlayerState.builder()
            .playerId("c").stack(ChipAmount.of(500))
            .priorContribution(ChipAmount.of(40)).committed(ChipAmount.of(60)).build();

        List<Pot> pots = calculator.computePots(List.of(a, b, c));

        assertEquals(ChipAmount.of(150), pots.get(0).getAmount());
        assertEquals(ChipAmount.of(100), pots.get(1).getAmount());
        assertEquals(List.of("b", "c"), pots.get(1).getEligiblePlayerIds());
    }

    @Test
    void testNoContributionsNoPots() {
        assertTrue(calculator.computePots(List.of(
            BettingRoundPlayerState.seated("a", 100),
            BettingRoundPlayerState.seated("b", 100)
        )).isEmpty());
    }

    private BettingRoundPlayerState contributed(String id, long committed, boolean folded) {
        return BettingRoundPlayerState.builder()
            .playerId(id)
            .stack(ChipAmount.of(1000))
            .committed(ChipAmount.of(committed))
            .folded(folded)
            .build();
    }

    private BettingRoundPlayerState allIn(String id, long committed) {
        return BettingRoundPlayerState.builder()
            .playerId(id)
            .stack(ChipAmount.zero())
            .committed(ChipAmount.of(committed))
            .allIn(true)
            .build();
    }
}
