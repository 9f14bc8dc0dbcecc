package ou.capstone.surf.forecast;

import java.util.List;
import java.util.Optional;

/**
 * Seven day outlook with the pick of the week.
 *
 * @param bestDay null only when {@code days} is empty
 */
public record WeekForecast(List<DayForecast> days, DayForecast bestDay, String bestDayReason) {

    public WeekForecast {
        days = List.copyOf(days);
        bestDayReason = (bestDayReason == null) ? "" : bestDayReason;
    }

    public Optional<DayForecast> best() {
        return Optional.ofNullable(bestDay);
    }
}
