package ou.capstone.surf.history;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Clock;
import java.time.Instant;
import java.time.Month;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;

final class HistoricalPercentileEstimatorTest {

    private final HistoricalPercentileEstimator estimator = new HistoricalPercentileEstimator();

    @Test
    void averageScoreIsTheMedian() {
        assertEquals(50, estimator.percentile(45, Month.JUNE));
        assertEquals(45.0, estimator.averageFor(Month.JUNE).avgScore());
    }

    @Test
    void percentileFollowsTheCurve() {
        assertEquals(63, estimator.percentile(50, Month.JUNE));
        assertEquals(95, estimator.percentile(70, Month.JULY));
        assertEquals(83, estimator.percentile(80, Month.OCTOBER));
        assertEquals(37, estimator.percentile(60, Month.OCTOBER));
    }

    @Test
    void percentileIsClamped() {
        assertEquals(99, estimator.percentile(100, Month.JULY));
        assertEquals(1, estimator.percentile(0, Month.DECEMBER));
    }

    @Test
    void percentileNeverDecreasesWithScore() {
        for (final Month month : Month.values()) {
            int previous = 0;
            for (int score = 0; score <= 100; score++) {
                final int p = estimator.percentile(score, month);
                assertTrue(p >= previous, month + " at " + score);
                assertTrue(p >= 1 && p <= 99);
                previous = p;
            }
        }
    }

    @Test
    void contextPhrases() {
        assertEquals("Top 10% day for July!", estimator.context(70, Month.JULY));
        assertEquals("Better than 83% of October days", estimator.context(80, Month.OCTOBER));
        assertEquals("Above average for October", estimator.context(72, Month.OCTOBER));
        assertEquals("Typical October conditions", estimator.context(60, Month.OCTOBER));
        assertEquals("Below average for October", estimator.context(40, Month.OCTOBER));
    }

    @Test
    void clockOverloadsUseTheCurrentMonth() {
        final Clock october = Clock.fixed(Instant.parse("2024-10-26T15:00:00Z"), ZoneOffset.UTC);
        assertEquals(83, estimator.percentile(80, october));
        assertEquals("Better than 83% of October days", estimator.context(80, october));
    }

    @Test
    void defaultTableHasEveryMonth() {
        final HistoricalAverages averages = HistoricalAverages.loadDefault();
        for (final Month month : Month.values()) {
            assertEquals(month, averages.forMonth(month).month());
        }
    }

    @Test
    void tableMustCoverTheWholeYear() {
        final List<MonthlyAverage> elevenMonths = new ArrayList<>();
        for (final Month month : Month.values()) {
            if (month != Month.FEBRUARY) {
                elevenMonths.add(new MonthlyAverage(month, 50, 4.0, 30));
            }
        }
        assertThrows(IllegalArgumentException.class, () -> new HistoricalAverages(elevenMonths));
    }
}
