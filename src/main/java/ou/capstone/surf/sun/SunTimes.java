package ou.capstone.surf.sun;

import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.Objects;

/**
 * Sun events for one day at one place. Civil twilight (sun 6 degrees below
 * the horizon) is "first light" and "last light".
 */
public record SunTimes(ZonedDateTime firstLight,
                       ZonedDateTime sunrise,
                       ZonedDateTime sunset,
                       ZonedDateTime lastLight) {

    private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("h:mm a", Locale.US);

    public SunTimes {
        Objects.requireNonNull(firstLight, "firstLight is required");
        Objects.requireNonNull(sunrise, "sunrise is required");
        Objects.requireNonNull(sunset, "sunset is required");
        Objects.requireNonNull(lastLight, "lastLight is required");
        if (sunrise.isBefore(firstLight) || sunset.isBefore(sunrise) || lastLight.isBefore(sunset)) {
            throw new IllegalArgumentException("Sun events out of order: " + firstLight + ", " + sunrise
                    + ", " + sunset + ", " + lastLight);
        }
    }

    /** True between first light and last light, both inclusive. */
    public boolean isDaylight(final ZonedDateTime now) {
        return !now.isBefore(firstLight) && !now.isAfter(lastLight);
    }

    /** "6:45 AM" style clock time. */
    public static String formatTime(final ZonedDateTime time) {
        return TIME_FORMAT.format(time);
    }

    @Override
    public String toString() {
        return "first light " + formatTime(firstLight)
                + ", sunrise " + formatTime(sunrise)
                + ", sunset " + formatTime(sunset)
                + ", last light " + formatTime(lastLight);
    }
}
