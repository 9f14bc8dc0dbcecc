package ou.capstone.surf.tide;

import java.time.LocalDateTime;
import java.util.Objects;

/**
 * One predicted water level, in feet above MLLW, at station-local time.
 *
 * @param type HIGH/LOW for high-low events, null for plain hourly samples
 */
public record TidePrediction(LocalDateTime time, double heightFt, TideEventType type) {

    public TidePrediction {
        Objects.requireNonNull(time, "time is required");
        if (!Double.isFinite(heightFt)) {
            throw new IllegalArgumentException("Tide height must be finite, got: " + heightFt);
        }
    }

    public static TidePrediction hourly(final LocalDateTime time, final double heightFt) {
        return new TidePrediction(time, heightFt, null);
    }

    public static TidePrediction event(final LocalDateTime time, final double heightFt, final TideEventType type) {
        return new TidePrediction(time, heightFt, Objects.requireNonNull(type, "type is required"));
    }

    public int hour() {
        return time.getHour();
    }
}
