package ou.capstone.surf.history;

import java.time.Clock;
import java.time.LocalDate;
import java.time.Month;
import java.time.format.TextStyle;
import java.util.Locale;
import java.util.Objects;

/**
 * Frames a score against what is typical for the month. This is a fixed
 * normal-ish curve around the monthly average, not a learned model.
 */
public class HistoricalPercentileEstimator {

    // ---- knobs ----
    static final double STD_DEV = 15.0;
    static final double TANH_SCALE = 0.8;
    static final int MIN_PERCENTILE = 1;
    static final int MAX_PERCENTILE = 99;

    private final HistoricalAverages averages;

    public HistoricalPercentileEstimator() {
        this(HistoricalAverages.loadDefault());
    }

    public HistoricalPercentileEstimator(final HistoricalAverages averages) {
        this.averages = Objects.requireNonNull(averages, "averages are required");
    }

    /**
     * @return 1-99, where 50 means the score equals the month's average
     */
    public int percentile(final int score, final Month month) {
        Objects.requireNonNull(month, "month is required");
        final double z = (score - averages.forMonth(month).avgScore()) / STD_DEV;
        final long p = Math.round(50.0 * (1.0 + Math.tanh(TANH_SCALE * z)));
        return (int) Math.max(MIN_PERCENTILE, Math.min(MAX_PERCENTILE, p));
    }

    public int percentile(final int score, final Clock clock) {
        return percentile(score, LocalDate.now(clock).getMonth());
    }

    /** e.g. "Better than 82% of June days". */
    public String context(final int score, final Month month) {
        final int p = percentile(score, month);
        final String name = month.getDisplayName(TextStyle.FULL, Locale.US);
        if (p >= 90) return "Top 10% day for " + name + "!";
        if (p >= 75) return "Better than " + p + "% of " + name + " days";
        if (p >= 50) return "Above average for " + name;
        if (p >= 25) return "Typical " + name + " conditions";
        return "Below average for " + name;
    }

    public String context(final int score, final Clock clock) {
        return context(score, LocalDate.now(clock).getMonth());
    }

    public MonthlyAverage averageFor(final Month month) {
        return averages.forMonth(month);
    }
}
