package com.playlistgen.recommender;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

public class LotterySelectorTest {

    @Test
    void testZeroWeightArtistIsNeverDrawn() throws Exception {
        Map<String, Double> weights = new LinkedHashMap<>();
        weights.put("Silent", 0.0);
        weights.put("Loud", 1.0);
        weights.put("Also Silent", 0.0);
        LotterySelector lottery = new LotterySelector(new Random(7));
        for (String winner : lottery.drawMany(weights, 500)) {
            assertEquals("Loud", winner);
        }
    }

    @Test
    void testHeavyArtistWinsMostDraws() throws Exception {
        Map<String, Double> weights = new LinkedHashMap<>();
        weights.put("X", 10.0);
        weights.put("Y", 1.0);
        LotterySelector lottery = new LotterySelector(new Random(42));
        List<String> winners = lottery.drawMany(weights, 1000);
        long xWins = winners.stream().filter("X"::equals).count();
        assertTrue(xWins > 800, "expected X to win over 80% of draws, got " + xWins);
        assertTrue(winners.contains("Y"));
    }

    @Test
    void testSameSeedGivesSameDraws() throws Exception {
        Map<String, Double> weights = new LinkedHashMap<>();
        weights.put("A", 3.0);
        weights.put("B", 2.0);
        weights.put("C", 5.0);
        List<String> first = new LotterySelector(new Random(99)).drawMany(weights, 20);
        List<String> second = new LotterySelector(new Random(99)).drawMany(weights, 20);
        assertEquals(first, second);
    }

    @Test
    void testEmptyPoolThrows() {
        LotterySelector lottery = new LotterySelector(new Random(1));
        assertThrows(EmptyPoolException.class, () -> lottery.draw(new HashMap<>()));
        assertThrows(EmptyPoolException.class, () -> lottery.draw(Map.of("A", 0.0, "B", 0.0)));
        assertThrows(EmptyPoolException.class, () -> lottery.drawMany(Map.of("A", 0.0), 0));
    }

    @Test
    void testNegativeWeightRejected() {
        LotterySelector lottery = new LotterySelector(new Random(1));
        assertThrows(IllegalArgumentException.class, () -> lottery.draw(Map.of("A", 2.0, "B", -1.0)));
    }
}
