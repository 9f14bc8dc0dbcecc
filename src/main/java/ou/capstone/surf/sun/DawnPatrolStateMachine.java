package ou.capstone.surf.sun;

import java.time.Duration;
import java.time.ZonedDateTime;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ou.capstone.surf.sun.DawnPatrolStatus.Status;

/**
 * Decides how urgent a dawn patrol is, given the clock, the day's sun times
 * and (optionally) the drive time to the spot. The target arrival is always
 * first light.
 */
public final class DawnPatrolStateMachine {
    private static final Logger logger = LoggerFactory.getLogger(DawnPatrolStateMachine.class);

    // ---- knobs ----
    /** Parking and suiting up. */
    public static final int DEFAULT_BUFFER_MINUTES = 10;
    /** How long before the departure time the "leave now" warning starts. */
    public static final int LEAVE_WARNING_MINUTES = 30;

    private DawnPatrolStateMachine() {
        // Prevent instantiation
    }

    /**
     * @param now          current time
     * @param sun          today's sun times at the spot
     * @param driveMinutes drive time; null or 0 means unknown
     */
    public static DawnPatrolStatus evaluate(final ZonedDateTime now,
                                            final SunTimes sun,
                                            final Integer driveMinutes) {
        Objects.requireNonNull(now, "now is required");
        Objects.requireNonNull(sun, "sun times are required");
        if (driveMinutes != null && driveMinutes < 0) {
            throw new IllegalArgumentException("Drive time cannot be negative: " + driveMinutes);
        }

        final DawnPatrolStatus result;
        if (driveMinutes == null || driveMinutes == 0) {
            result = withoutDrive(now, sun);
        } else {
            result = withDrive(now, sun, driveMinutes);
        }
        logger.debug("Dawn patrol at {}: {}", now, result);
        return result;
    }

    private static DawnPatrolStatus withoutDrive(final ZonedDateTime now, final SunTimes sun) {
        if (now.isBefore(sun.firstLight())) {
            return new DawnPatrolStatus(Status.TOO_EARLY,
                    "First light at " + SunTimes.formatTime(sun.firstLight()), null);
        }
        if (now.isBefore(sun.sunrise())) {
            return new DawnPatrolStatus(Status.SURFING,
                    "Sunrise at " + SunTimes.formatTime(sun.sunrise()), null);
        }
        if (now.isBefore(sun.sunset())) {
            return new DawnPatrolStatus(Status.SURFING,
                    "Sun is up until " + SunTimes.formatTime(sun.sunset()), null);
        }
        return new DawnPatrolStatus(Status.MISSED, "Sun has set", null);
    }

    private static DawnPatrolStatus withDrive(final ZonedDateTime now, final SunTimes sun, final int driveMinutes) {
        final ZonedDateTime leaveBy = leaveBy(sun.firstLight(), driveMinutes, DEFAULT_BUFFER_MINUTES);
        final ZonedDateTime arriveBy = leaveBy.plusMinutes(driveMinutes + (long) DEFAULT_BUFFER_MINUTES);

        if (now.isBefore(leaveBy.minusMinutes(LEAVE_WARNING_MINUTES))) {
            return new DawnPatrolStatus(Status.TOO_EARLY,
                    "Leave by " + SunTimes.formatTime(leaveBy) + " for first light", leaveBy);
        }
        if (now.isBefore(leaveBy)) {
            final long minutes = Math.round(Duration.between(now, leaveBy).getSeconds() / 60.0);
            return new DawnPatrolStatus(Status.LEAVE_NOW,
                    "Leave in " + minutes + " min for dawn patrol!", leaveBy);
        }
        if (now.isBefore(arriveBy)) {
            return new DawnPatrolStatus(Status.ON_THE_WAY, "Go now to catch first light!", leaveBy);
        }
        if (now.isBefore(sun.sunset())) {
            return new DawnPatrolStatus(Status.SURFING,
                    "Sun up until " + SunTimes.formatTime(sun.sunset()), null);
        }
        return new DawnPatrolStatus(Status.MISSED, "Sun has set", null);
    }

    /** Time to leave to arrive at {@code target} with {@code bufferMinutes} to spare. */
    public static ZonedDateTime leaveBy(final ZonedDateTime target, final int driveMinutes, final int bufferMinutes) {
        Objects.requireNonNull(target, "target is required");
        if (driveMinutes < 0 || bufferMinutes < 0) {
            throw new IllegalArgumentException("Drive and buffer minutes cannot be negative");
        }
        return target.minusMinutes((long) driveMinutes + bufferMinutes);
    }

    /** "passed", "in 25 min", "in 2h" or "in 2h 5m". */
    public static String describeTimeUntil(final ZonedDateTime now, final ZonedDateTime target) {
        final long minutes = Math.round(Duration.between(now, target).getSeconds() / 60.0);
        if (minutes < 0) {
            return "passed";
        }
        if (minutes < 60) {
            return "in " + minutes + " min";
        }
        final long hours = minutes / 60;
        final long rest = minutes % 60;
        return rest == 0 ? "in " + hours + "h" : "in " + hours + "h " + rest + "m";
    }
}
