package ou.capstone.surf.history;

import java.time.Month;
import java.util.Objects;

/**
 * Long-run conditions for one calendar month.
 *
 * @param goodDaysPct share of days that scored GOOD or better, 0-100
 */
public record MonthlyAverage(Month month, double avgScore, double avgWaveHeightFt, double goodDaysPct) {

    public MonthlyAverage {
        Objects.requireNonNull(month, "month is required");
        if (!(avgScore >= 0 && avgScore <= 100)) {
            throw new IllegalArgumentException("Average score must be 0-100 for " + month + ", got: " + avgScore);
        }
        if (!(avgWaveHeightFt >= 0)) {
            throw new IllegalArgumentException("Average wave height must be >= 0 for " + month);
        }
        if (!(goodDaysPct >= 0 && goodDaysPct <= 100)) {
            throw new IllegalArgumentException("Good days % must be 0-100 for " + month);
        }
    }
}
