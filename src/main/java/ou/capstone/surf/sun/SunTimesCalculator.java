package ou.capstone.surf.sun;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ou.capstone.surf.geo.Coordinate;

/**
 * Sunrise, sunset and civil twilight from the NOAA fractional-year
 * approximation. Accurate to a minute or two at mid latitudes, which is
 * plenty for deciding when to paddle out.
 */
public final class SunTimesCalculator {
    private static final Logger logger = LoggerFactory.getLogger(SunTimesCalculator.class);

    // ---- knobs ----
    /** Sun altitude at sunrise/sunset, including refraction and disc radius. */
    static final double HORIZON_DEG = -0.833;
    /** Sun altitude at civil twilight. */
    static final double CIVIL_TWILIGHT_DEG = -6.0;

    private static final double MINUTES_PER_DEGREE = 4.0;
    private static final double SOLAR_NOON_UTC_MINUTES = 720.0;

    private SunTimesCalculator() {
        // Prevent instantiation
    }

    public static SunTimes compute(final Coordinate where, final LocalDate date, final ZoneId zone) {
        Objects.requireNonNull(where, "coordinate is required");
        return compute(where.getLatitude(), where.getLongitude(), date, zone);
    }

    /**
     * @param latitude  degrees north
     * @param longitude degrees east (negative west)
     * @param date      local calendar date
     * @param zone      zone the results are expressed in
     */
    public static SunTimes compute(final double latitude,
                                   final double longitude,
                                   final LocalDate date,
                                   final ZoneId zone) {
        Objects.requireNonNull(date, "date is required");
        Objects.requireNonNull(zone, "zone is required");
        if (!Double.isFinite(latitude) || latitude < -90 || latitude > 90) {
            throw new IllegalArgumentException("Latitude out of range: " + latitude);
        }
        if (!Double.isFinite(longitude) || longitude < -180 || longitude > 180) {
            throw new IllegalArgumentException("Longitude out of range: " + longitude);
        }

        final double gamma = 2.0 * Math.PI / 365.0 * (date.getDayOfYear() - 1);

        final double eqTime = 229.18 * (0.000075
                + 0.001868 * Math.cos(gamma)
                - 0.032077 * Math.sin(gamma)
                - 0.014615 * Math.cos(2 * gamma)
                - 0.040849 * Math.sin(2 * gamma));

        final double declination = 0.006918
                - 0.399912 * Math.cos(gamma)
                + 0.070257 * Math.sin(gamma)
                - 0.006758 * Math.cos(2 * gamma)
                + 0.000907 * Math.sin(2 * gamma)
                - 0.002697 * Math.cos(3 * gamma)
                + 0.00148 * Math.sin(3 * gamma);

        final double latRad = Math.toRadians(latitude);
        final double horizonHa = hourAngle(latRad, declination, HORIZON_DEG);
        final double civilHa = hourAngle(latRad, declination, CIVIL_TWILIGHT_DEG);

        final ZoneOffset noonOffset = zone.getRules().getOffset(date.atTime(12, 0));
        final int offsetMinutes = noonOffset.getTotalSeconds() / 60;
        final double solarNoon = SOLAR_NOON_UTC_MINUTES - MINUTES_PER_DEGREE * longitude - eqTime + offsetMinutes;

        final SunTimes times = new SunTimes(
                at(date, noonOffset, zone, solarNoon - civilHa * MINUTES_PER_DEGREE),
                at(date, noonOffset, zone, solarNoon - horizonHa * MINUTES_PER_DEGREE),
                at(date, noonOffset, zone, solarNoon + horizonHa * MINUTES_PER_DEGREE),
                at(date, noonOffset, zone, solarNoon + civilHa * MINUTES_PER_DEGREE));
        logger.debug("Sun times at ({}, {}) on {}: {}", latitude, longitude, date, times);
        return times;
    }

    /** Hour angle in degrees; the arccos argument is clamped so polar days stay finite. */
    static double hourAngle(final double latRad, final double declination, final double altitudeDeg) {
        final double cosHa = (Math.sin(Math.toRadians(altitudeDeg)) - Math.sin(latRad) * Math.sin(declination))
                / (Math.cos(latRad) * Math.cos(declination));
        final double clamped = Math.max(-1.0, Math.min(1.0, cosHa));
        return Math.toDegrees(Math.acos(clamped));
    }

    /**
     * Minutes are counted on the noon offset's clock, so the four events keep
     * their order even when one falls in a DST gap or overlap.
     */
    private static ZonedDateTime at(final LocalDate date,
                                    final ZoneOffset noonOffset,
                                    final ZoneId zone,
                                    final double minutesFromMidnight) {
        final LocalDateTime local = date.atStartOfDay().plusMinutes(Math.round(minutesFromMidnight));
        return local.atOffset(noonOffset).atZoneSameInstant(zone);
    }
}
