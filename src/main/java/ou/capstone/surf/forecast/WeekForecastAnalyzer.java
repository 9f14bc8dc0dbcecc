package ou.capstone.surf.forecast;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ou.capstone.surf.spots.LocationProfile;
import ou.capstone.surf.spots.TidePreference;
import ou.capstone.surf.sun.MoonInfo;
import ou.capstone.surf.sun.MoonPhaseCalculator;
import ou.capstone.surf.sun.SunTimes;
import ou.capstone.surf.sun.SunTimesCalculator;
import ou.capstone.surf.tide.TidePrediction;
import ou.capstone.surf.tide.TideSeries;
import ou.capstone.surf.window.BestTimeWindowFinder;
import ou.capstone.surf.window.TimeWindow;

/**
 * Ranks the next seven days at one spot. Wave and wind are not forecast, so
 * a day is judged on its tide curve: how many daylight hours sit in the
 * spot's preferred tide band, how many of those are early, whether it is a
 * weekend, and whether the tide range is extreme.
 */
public class WeekForecastAnalyzer {
    private static final Logger logger = LoggerFactory.getLogger(WeekForecastAnalyzer.class);

    public static final int DAYS = 7;

    // ---- knobs ----
    static final int BASE_SCORE = 50;
    static final int FIRST_SURF_HOUR = 6;
    static final int LAST_SURF_HOUR = 18;
    static final int LAST_DAWN_HOUR = 9;

    static final int GREAT_DAWN_BONUS = 25;
    static final int GOOD_DAWN_BONUS = 15;
    static final int EXTENDED_WINDOW_BONUS = 20;
    static final int SOLID_WINDOW_BONUS = 10;
    static final int WEEKEND_BONUS = 5;
    static final int VERY_HIGH_TIDE_PENALTY = 10;
    static final int NEGATIVE_LOW_PENALTY = 5;

    static final double VERY_HIGH_TIDE_FT = 6.0;
    static final double NEGATIVE_LOW_FT = -0.5;
    static final int SIGNIFICANT_MARGIN = 15;

    static final String NO_TIDE_DATA = "Tide data unavailable";
    static final String AVERAGE_DAY = "Average conditions expected";

    private final BestTimeWindowFinder windowFinder;

    public WeekForecastAnalyzer() {
        this(new BestTimeWindowFinder());
    }

    public WeekForecastAnalyzer(final BestTimeWindowFinder windowFinder) {
        this.windowFinder = Objects.requireNonNull(windowFinder, "windowFinder is required");
    }

    /**
     * @param tideByDate tide series keyed by local date; a series may cover
     *                   more than its key, only the key's day is used
     * @param spot       the spot being forecast
     * @param startDate  first day of the outlook
     * @param zone       zone for sun times and moon phase
     */
    public WeekForecast analyze(final Map<LocalDate, TideSeries> tideByDate,
                                final LocationProfile spot,
                                final LocalDate startDate,
                                final ZoneId zone) {
        Objects.requireNonNull(tideByDate, "tideByDate is required");
        Objects.requireNonNull(spot, "spot is required");
        Objects.requireNonNull(startDate, "startDate is required");
        Objects.requireNonNull(zone, "zone is required");

        final List<DayForecast> days = new ArrayList<>(DAYS);
        for (int i = 0; i < DAYS; i++) {
            final LocalDate date = startDate.plusDays(i);
            final SunTimes sun = SunTimesCalculator.compute(spot.coordinate(), date, zone);
            final MoonInfo moon = MoonPhaseCalculator.phaseOn(date, zone);
            final TideSeries series = tideByDate.get(date);
            days.add(scoreDay(date, series, spot.bestTide(), sun, moon));
        }

        DayForecast best = null;
        for (final DayForecast day : days) {
            if (best == null || day.score() > best.score()) {
                best = day;
            }
        }
        final String reason = bestDayReason(best, days);
        logger.info("Week outlook for {} from {}: best {}", spot.id(), startDate, reason);
        return new WeekForecast(days, best, reason);
    }

    DayForecast scoreDay(final LocalDate date,
                         final TideSeries fullSeries,
                         final TidePreference preference,
                         final SunTimes sun,
                         final MoonInfo moon) {
        final TideSeries series = (fullSeries == null) ? null : fullSeries.forDate(date);
        if (series == null || series.isEmpty()) {
            logger.debug("No tide data for {}", date);
            return new DayForecast(date, sun, moon, BASE_SCORE, NO_TIDE_DATA, null, false);
        }

        int score = BASE_SCORE;
        final List<String> points = new ArrayList<>();

        int idealHours = 0;
        int idealDawnHours = 0;
        for (final TidePrediction p : series.hourly()) {
            final int hour = p.hour();
            if (hour < FIRST_SURF_HOUR || hour > LAST_SURF_HOUR || !isIdealTide(p.heightFt(), preference)) {
                continue;
            }
            idealHours++;
            if (hour <= LAST_DAWN_HOUR) {
                idealDawnHours++;
            }
        }

        if (idealDawnHours >= 2) {
            score += GREAT_DAWN_BONUS;
            points.add("Great early morning tide");
        } else if (idealDawnHours >= 1) {
            score += GOOD_DAWN_BONUS;
            points.add("Good dawn patrol window");
        }

        if (idealHours >= 6) {
            score += EXTENDED_WINDOW_BONUS;
            points.add("Extended surf window");
        } else if (idealHours >= 3) {
            score += SOLID_WINDOW_BONUS;
        }

        final DayOfWeek dow = date.getDayOfWeek();
        if (dow == DayOfWeek.SATURDAY || dow == DayOfWeek.SUNDAY) {
            score += WEEKEND_BONUS;
            points.add("Weekend");
        }

        if (!series.highLow().isEmpty()) {
            double max = Double.NEGATIVE_INFINITY;
            double min = Double.POSITIVE_INFINITY;
            for (final TidePrediction event : series.highLow()) {
                max = Math.max(max, event.heightFt());
                min = Math.min(min, event.heightFt());
            }
            if (max > VERY_HIGH_TIDE_FT) {
                score -= VERY_HIGH_TIDE_PENALTY;
                points.add("Very high tide");
            }
            if (min < NEGATIVE_LOW_FT) {
                score -= NEGATIVE_LOW_PENALTY;
                points.add("Negative low tide");
            }
        }

        score = Math.max(0, Math.min(100, score));
        final String analysis = points.isEmpty() ? AVERAGE_DAY : String.join(" • ", points);
        final TimeWindow window = windowFinder.find(series.hourly(), preference, FIRST_SURF_HOUR, LAST_SURF_HOUR);

        logger.debug("{}: score {} ({} ideal hours, {} at dawn)", date, score, idealHours, idealDawnHours);
        return new DayForecast(date, sun, moon, score, analysis, window, true);
    }

    /**
     * Whether a tide height sits in the band a spot prefers, against the
     * typical SF Bay range of about -1 to 6 ft.
     */
    static boolean isIdealTide(final double heightFt, final TidePreference preference) {
        switch (preference) {
            case LOW:
                return heightFt < 2.0;
            case MID:
                return heightFt >= 1.5 && heightFt <= 4.0;
            case HIGH:
                return heightFt > 3.5;
            case ANY:
            default:
                return true;
        }
    }

    static String bestDayReason(final DayForecast best, final List<DayForecast> days) {
        if (best == null) {
            return "Unable to determine best day";
        }
        final List<String> parts = new ArrayList<>();
        parts.add(best.dayName() + " " + best.dateLabel());
        parts.add(best.analysis().toLowerCase(Locale.US));
        if (best.bestWindow() != null) {
            parts.add("best from " + best.bestWindow().startLabel() + " to " + best.bestWindow().endLabel());
        }
        final double mean = days.stream().mapToInt(DayForecast::score).average().orElse(0.0);
        if (best.score() > mean + SIGNIFICANT_MARGIN) {
            parts.add("significantly better than other days");
        }
        return String.join(" - ", parts);
    }
}
