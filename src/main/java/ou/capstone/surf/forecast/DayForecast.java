package ou.capstone.surf.forecast;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

import ou.capstone.surf.sun.MoonInfo;
import ou.capstone.surf.sun.SunTimes;
import ou.capstone.surf.window.TimeWindow;

/**
 * One day of the week outlook for a spot.
 *
 * @param bestWindow null when the day had no usable tide data
 */
public record DayForecast(LocalDate date,
                          SunTimes sunTimes,
                          MoonInfo moon,
                          int score,
                          String analysis,
                          TimeWindow bestWindow,
                          boolean hasTideData) {

    private static final DateTimeFormatter DAY_NAME = DateTimeFormatter.ofPattern("EEE", Locale.US);
    private static final DateTimeFormatter DATE_LABEL = DateTimeFormatter.ofPattern("MMM d", Locale.US);

    public DayForecast {
        Objects.requireNonNull(date, "date is required");
        Objects.requireNonNull(sunTimes, "sunTimes is required");
        Objects.requireNonNull(moon, "moon is required");
        Objects.requireNonNull(analysis, "analysis is required");
        if (score < 0 || score > 100) {
            throw new IllegalArgumentException("Day score must be 0-100, got: " + score);
        }
    }

    /** "Sat" */
    public String dayName() {
        return DAY_NAME.format(date);
    }

    /** "Oct 24" */
    public String dateLabel() {
        return DATE_LABEL.format(date);
    }

    public Optional<TimeWindow> window() {
        return Optional.ofNullable(bestWindow);
    }
}
