package ou.capstone.surf.profile;

/**
 * Wave heights in feet a surfer profile handles: the ideal band sits inside
 * the surfable band.
 */
public record WaveRange(double idealMin, double idealMax, double surfableMin, double surfableMax) {

    public WaveRange {
        if (!(Double.isFinite(idealMin) && Double.isFinite(idealMax)
                && Double.isFinite(surfableMin) && Double.isFinite(surfableMax))) {
            throw new IllegalArgumentException("Wave range bounds must be finite");
        }
        if (surfableMin <= 0.0) {
            throw new IllegalArgumentException("surfableMin must be positive, got: " + surfableMin);
        }
        if (!(surfableMin <= idealMin && idealMin <= idealMax && idealMax <= surfableMax)) {
            throw new IllegalArgumentException(String.format(
                    "Expected surfableMin <= idealMin <= idealMax <= surfableMax, got %s/%s/%s/%s",
                    surfableMin, idealMin, idealMax, surfableMax));
        }
    }

    public boolean isIdeal(final double heightFt) {
        return heightFt >= idealMin && heightFt <= idealMax;
    }
}
