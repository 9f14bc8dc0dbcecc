package ou.capstone.surf.window;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ou.capstone.surf.spots.TidePreference;
import ou.capstone.surf.tide.TidePrediction;
import ou.capstone.surf.tide.TideSeries;

/**
 * Finds the best 2-3 hour session in a day from the hourly tide curve and
 * the typical diurnal wind pattern.
 *
 * Each hourly slot h covers [h, h+1). Its score is half the tide
 * suitability plus the full diurnal wind score. Windows of 3 hours are tried
 * before 2 hours; the highest mean wins and the earliest window wins ties.
 */
public class BestTimeWindowFinder {
    private static final Logger logger = LoggerFactory.getLogger(BestTimeWindowFinder.class);

    /** Default surfable band: sessions must fit inside 5:00-20:00. */
    public static final int DEFAULT_FIRST_HOUR = 5;
    public static final int DEFAULT_LAST_HOUR = 20;

    private static final double TIDE_WEIGHT = 0.5;
    private static final int[] WINDOW_SIZES = {3, 2};

    // Tide curve read against a nominal -1..6 ft range
    private static final double TIDE_FLOOR_FT = -1.0;
    private static final double TIDE_SPAN_FT = 7.0;
    static final int ANY_TIDE_SUITABILITY = 70;

    private final DiurnalWindCurve windCurve;

    /** Default constructor: bundled wind curve. */
    public BestTimeWindowFinder() {
        this(DiurnalWindCurve.loadDefault());
    }

    public BestTimeWindowFinder(final DiurnalWindCurve windCurve) {
        this.windCurve = Objects.requireNonNull(windCurve, "windCurve is required");
    }

    /**
     * Searches the samples of {@code series} that fall on {@code date}.
     */
    public TimeWindow find(final TideSeries series, final LocalDate date, final TidePreference preference) {
        return find(series.forDate(date).hourly(), preference);
    }

    /**
     * Searches one day's hourly samples within the default 5-20 band.
     *
     * @return the best window, or null when no recommendation is possible
     */
    public TimeWindow find(final List<TidePrediction> hourly, final TidePreference preference) {
        return find(hourly, preference, DEFAULT_FIRST_HOUR, DEFAULT_LAST_HOUR);
    }

    /**
     * Searches one day's hourly samples; the window must lie within
     * [firstHour, lastHour].
     *
     * @return the best window, or null when fewer than two consecutive hours
     *         fall inside the band
     */
    public TimeWindow find(final List<TidePrediction> hourly,
                           final TidePreference preference,
                           final int firstHour,
                           final int lastHour) {
        Objects.requireNonNull(preference, "preference is required");
        if (firstHour < 0 || lastHour > 24 || firstHour >= lastHour) {
            throw new IllegalArgumentException("Invalid hour band " + firstHour + "-" + lastHour);
        }
        if (hourly == null || hourly.isEmpty()) {
            logger.debug("No hourly tide data, no window");
            return null;
        }

        final List<HourScore> scored = new ArrayList<>();
        for (final TidePrediction p : hourly) {
            final int hour = p.hour();
            if (hour < firstHour || hour >= lastHour) {
                continue;
            }
            final double score = tideSuitability(p.heightFt(), preference) * TIDE_WEIGHT
                    + windCurve.scoreAt(hour);
            scored.add(new HourScore(p, score));
        }
        if (scored.isEmpty()) {
            logger.debug("No hourly samples inside {}-{}, no window", firstHour, lastHour);
            return null;
        }

        HourScore bestStart = null;
        int bestSize = 0;
        double bestAvgScore = 0.0;
        double bestAvgTide = 0.0;

        for (final int size : WINDOW_SIZES) {
            for (int i = 0; i + size <= scored.size(); i++) {
                if (!isContiguous(scored, i, size)) {
                    continue;
                }
                double sumScore = 0.0;
                double sumTide = 0.0;
                for (int j = i; j < i + size; j++) {
                    sumScore += scored.get(j).score();
                    sumTide += scored.get(j).prediction().heightFt();
                }
                final double avgScore = sumScore / size;
                if (avgScore > bestAvgScore) {
                    bestAvgScore = avgScore;
                    bestAvgTide = sumTide / size;
                    bestStart = scored.get(i);
                    bestSize = size;
                }
            }
        }

        if (bestStart == null) {
            logger.debug("No two consecutive hours inside {}-{}, no window", firstHour, lastHour);
            return null;
        }

        final int startHour = bestStart.prediction().hour();
        final int endHour = startHour + bestSize;
        final TimeWindow window = new TimeWindow(startHour, endHour, reason(startHour, bestAvgTide));
        logger.debug("Best window {} (mean score {})", window, bestAvgScore);
        return window;
    }

    /**
     * How well a tide height suits the preference, 0-100.
     */
    public static int tideSuitability(final double heightFt, final TidePreference preference) {
        if (preference == TidePreference.ANY) {
            return ANY_TIDE_SUITABILITY;
        }
        final double pct = Math.min(1.0, Math.max(0.0, (heightFt - TIDE_FLOOR_FT) / TIDE_SPAN_FT));
        switch (preference) {
            case LOW:
                if (pct < 0.3) return 100;
                if (pct < 0.45) return 80;
                if (pct < 0.6) return 50;
                return 20;
            case MID:
                if (pct >= 0.35 && pct <= 0.65) return 100;
                if (pct >= 0.25 && pct <= 0.75) return 80;
                return 50;
            case HIGH:
                if (pct > 0.7) return 100;
                if (pct > 0.55) return 80;
                if (pct > 0.4) return 50;
                return 20;
            default:
                return 50;
        }
    }

    /** Coarse tide label for a height in feet. */
    public static String describeTide(final double heightFt) {
        if (heightFt < 1) return "Low tide";
        if (heightFt < 2.5) return "Low-mid tide";
        if (heightFt < 4) return "Mid tide";
        if (heightFt < 5) return "Mid-high tide";
        return "High tide";
    }

    private static String reason(final int startHour, final double avgTideFt) {
        final String tide = describeTide(avgTideFt);
        if (startHour >= 5 && startHour < 9) {
            return tide + " + light morning winds";
        }
        if (startHour >= 17) {
            return tide + " + evening glass-off";
        }
        return tide + " conditions";
    }

    private static boolean isContiguous(final List<HourScore> scored, final int from, final int size) {
        for (int j = from + 1; j < from + size; j++) {
            final TidePrediction prev = scored.get(j - 1).prediction();
            final TidePrediction cur = scored.get(j).prediction();
            if (!cur.time().equals(prev.time().plusHours(1))) {
                return false;
            }
        }
        return true;
    }

    private record HourScore(TidePrediction prediction, double score) {
    }
}
