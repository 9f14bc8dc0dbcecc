package ou.capstone.surf.tide;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads the current state of the tide out of a {@link TideSeries}.
 * Stateless; "now" is always passed in.
 */
public final class TideAnalyzer {
    private static final Logger logger = LoggerFactory.getLogger(TideAnalyzer.class);

    /** Within this many minutes of a high/low the tide counts as being at that peak. */
    public static final long NEAR_EVENT_MINUTES = 30L;

    private TideAnalyzer() {
        // Prevent instantiation
    }

    /**
     * Water level at {@code now}, linearly interpolated between the two
     * hourly samples around it. Outside the sampled range the nearest
     * endpoint is returned (no extrapolation); an empty curve yields 0.0.
     */
    public static double currentHeight(final TideSeries series, final LocalDateTime now) {
        final List<TidePrediction> hourly = series.hourly();
        if (hourly.isEmpty()) {
            logger.debug("No hourly tide samples, reporting 0.0 ft");
            return 0.0;
        }

        final TidePrediction first = hourly.get(0);
        final TidePrediction last = hourly.get(hourly.size() - 1);
        if (!now.isAfter(first.time())) {
            return first.heightFt();
        }
        if (!now.isBefore(last.time())) {
            return last.heightFt();
        }

        for (int i = 0; i < hourly.size() - 1; i++) {
            final TidePrediction current = hourly.get(i);
            final TidePrediction next = hourly.get(i + 1);
            if (!now.isBefore(current.time()) && now.isBefore(next.time())) {
                final double span = Duration.between(current.time(), next.time()).toMillis();
                if (span <= 0) {
                    return current.heightFt();
                }
                final double progress = Duration.between(current.time(), now).toMillis() / span;
                return current.heightFt() + progress * (next.heightFt() - current.heightFt());
            }
        }
        // Unreachable for an ordered series
        return last.heightFt();
    }

    /**
     * Tide phase at {@code now}, from the surrounding high/low events.
     * <ul>
     *   <li>under {@value #NEAR_EVENT_MINUTES} minutes before the next event: that event's type</li>
     *   <li>under {@value #NEAR_EVENT_MINUTES} minutes after the previous event: that event's type</li>
     *   <li>otherwise RISING after a low and FALLING after a high</li>
     *   <li>RISING when there is no previous event</li>
     * </ul>
     */
    public static TidePhase phase(final TideSeries series, final LocalDateTime now) {
        TidePrediction previous = null;
        TidePrediction next = null;
        for (final TidePrediction event : series.highLow()) {
            if (!event.time().isAfter(now)) {
                previous = event;
            } else {
                next = event;
                break;
            }
        }

        if (next != null && minutesBetween(now, next.time()) < NEAR_EVENT_MINUTES) {
            return next.type().asPhase();
        }
        if (previous == null) {
            return TidePhase.RISING;
        }
        if (minutesBetween(previous.time(), now) < NEAR_EVENT_MINUTES) {
            return previous.type().asPhase();
        }
        return previous.type() == TideEventType.LOW ? TidePhase.RISING : TidePhase.FALLING;
    }

    /**
     * The first high and first low strictly after {@code now}.
     */
    public static NextTides nextTides(final TideSeries series, final LocalDateTime now) {
        TidePrediction nextHigh = null;
        TidePrediction nextLow = null;
        for (final TidePrediction event : series.highLow()) {
            if (!event.time().isAfter(now)) {
                continue;
            }
            if (event.type() == TideEventType.HIGH && nextHigh == null) {
                nextHigh = event;
            } else if (event.type() == TideEventType.LOW && nextLow == null) {
                nextLow = event;
            }
            if (nextHigh != null && nextLow != null) {
                break;
            }
        }
        return new NextTides(Optional.ofNullable(nextHigh), Optional.ofNullable(nextLow));
    }

    private static double minutesBetween(final LocalDateTime from, final LocalDateTime to) {
        return Duration.between(from, to).toMillis() / 60_000.0;
    }

    /** Upcoming high and low, either of which may be absent. */
    public record NextTides(Optional<TidePrediction> nextHigh, Optional<TidePrediction> nextLow) {
    }
}
