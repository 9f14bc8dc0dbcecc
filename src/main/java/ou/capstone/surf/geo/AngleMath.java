package ou.capstone.surf.geo;

/**
 * Compass bearing helpers shared by the wind and swell scorers.
 * All bearings are in degrees.
 */
public final class AngleMath {

    private AngleMath() {
        // Prevent instantiation
    }

    /**
     * Folds an angle into the range (-180, 180] by repeatedly adding or
     * subtracting 360. Every direction comparison goes through here so that
     * differences close to 180 degrees come out the same way everywhere.
     *
     * @param angle any finite angle in degrees
     * @return the equivalent angle in (-180, 180]
     */
    public static double normalize(final double angle) {
        if (!Double.isFinite(angle)) {
            throw new IllegalArgumentException("Angle must be finite, got: " + angle);
        }
        double normalized = angle;
        while (normalized <= -180.0) {
            normalized += 360.0;
        }
        while (normalized > 180.0) {
            normalized -= 360.0;
        }
        return normalized;
    }

    /**
     * Absolute circular distance between two bearings, in [0, 180].
     */
    public static double difference(final double bearingA, final double bearingB) {
        return Math.abs(normalize(bearingA - bearingB));
    }

    /**
     * Smallest circular distance from {@code bearing} to any of the targets.
     * Returns 180 when the target list is empty.
     */
    public static double minDifference(final double bearing, final Iterable<Double> targets) {
        double min = 180.0;
        for (final Double target : targets) {
            min = Math.min(min, difference(bearing, target));
        }
        return min;
    }
}
