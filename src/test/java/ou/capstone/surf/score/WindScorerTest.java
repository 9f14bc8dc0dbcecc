package ou.capstone.surf.score;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

final class WindScorerTest {

    private final WindScorer scorer = new WindScorer(45.0);

    @Test
    void glassyOffshoreScoresFull() {
        assertEquals(100, scorer.scoreWind(4, 50));
        assertEquals(100, scorer.scoreWind(0, 45));
    }

    @Test
    void glassyFloorsTheDirectionPenalty() {
        // onshore would be x0.4, but under 5 mph the multiplier is at least 0.9
        assertEquals(90, scorer.scoreWind(4, 225));
    }

    @Test
    void speedAndDirectionCombine() {
        assertEquals(85, scorer.scoreWind(8, 45));
        assertEquals(55, scorer.scoreWind(12, 120));   // 75 deg off: cross-offshore
        assertEquals(39, scorer.scoreWind(12, 170));   // 125 deg off: cross-onshore
        assertEquals(26, scorer.scoreWind(12, 225));   // dead onshore
        assertEquals(2, scorer.scoreWind(30, 225));
    }

    @Test
    void directionComparisonWrapsAroundNorth() {
        final WindScorer northOffshore = new WindScorer(350.0);
        assertEquals(85, northOffshore.scoreWind(8, 20));
    }

    @Test
    void nonIncreasingInSpeedAtEveryDirection() {
        for (int dir = 0; dir <= 360; dir += 15) {
            int previous = 101;
            for (double speed = 0; speed <= 40; speed += 0.5) {
                final int s = scorer.scoreWind(speed, dir);
                assertTrue(s <= previous, "score rose with speed at dir " + dir + ", speed " + speed);
                previous = s;
            }
        }
    }

    @Test
    void offshoreBearingIsTheBestDirection() {
        for (double speed : new double[] {2, 7, 12, 17, 22, 30}) {
            final int best = scorer.scoreWind(speed, 45);
            for (int dir = 0; dir <= 360; dir += 5) {
                assertTrue(scorer.scoreWind(speed, dir) <= best, "dir " + dir + " beat offshore at " + speed);
            }
        }
    }

    @Test
    void rejectsInvalidInput() {
        assertThrows(IllegalArgumentException.class, () -> scorer.scoreWind(-1, 45));
        assertThrows(IllegalArgumentException.class, () -> scorer.scoreWind(5, 361));
        assertThrows(IllegalArgumentException.class, () -> new WindScorer(-10));
    }
}
